package com.feeguard.metric;

import com.feeguard.config.ImpactUnit;
import com.feeguard.pool.PoolMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class MetricCalculatorTest {

    private final MetricCalculator calculator = new MetricCalculator(10_000L);

    @Nested
    @DisplayName("relativeSize")
    class RelativeSize {

        @Test
        void coldStart_isNeutral() {
            assertEquals(1, calculator.relativeSize(BigInteger.valueOf(100), BigInteger.ZERO));
            assertEquals(1, calculator.relativeSize(BigInteger.valueOf(1_000_000_000), BigInteger.ZERO));
            assertEquals(1, calculator.relativeSize(BigInteger.ZERO, BigInteger.ZERO));
        }

        @Test
        void ratioIsFloored() {
            assertEquals(2, calculator.relativeSize(BigInteger.valueOf(250), BigInteger.valueOf(100)));
            assertEquals(0, calculator.relativeSize(BigInteger.valueOf(50), BigInteger.valueOf(100)));
            assertEquals(6, calculator.relativeSize(BigInteger.valueOf(600), BigInteger.valueOf(100)));
        }

        @Test
        void outsizedTrade_isCappedAtTen() {
            assertEquals(10, calculator.relativeSize(BigInteger.valueOf(5_000), BigInteger.valueOf(100)));
            assertEquals(10, calculator.relativeSize(BigInteger.TEN.pow(40), BigInteger.ONE));
        }

        @Test
        void negativeSize_usesMagnitude() {
            assertEquals(3, calculator.relativeSize(BigInteger.valueOf(-300), BigInteger.valueOf(100)));
        }
    }

    @Nested
    @DisplayName("impact")
    class Impact {

        @Test
        void noPriorMetric_isZero() {
            assertEquals(0L, calculator.impact(500L, null, ImpactUnit.TICK));
            assertEquals(0L, calculator.impact(500L, null, ImpactUnit.PRICE));
        }

        @Test
        void noCurrentMetric_isZero() {
            assertEquals(0L, calculator.impact(null, 500L, ImpactUnit.TICK));
        }

        @Test
        void tickDelta_isAbsoluteAndUncapped() {
            assertEquals(5L, calculator.impact(105L, 100L, ImpactUnit.TICK));
            assertEquals(50L, calculator.impact(-20L, 30L, ImpactUnit.TICK));
            assertEquals(887_272L, calculator.impact(443_636L, -443_636L, ImpactUnit.TICK));
        }

        @Test
        void priceDelta_isNormalizedAndCapped() {
            assertEquals(5L, calculator.impact(1_050_000L, 1_000_000L, ImpactUnit.PRICE));
            assertEquals(0L, calculator.impact(1_009_999L, 1_000_000L, ImpactUnit.PRICE));
            assertEquals(10L, calculator.impact(9_000_000L, 1_000_000L, ImpactUnit.PRICE));
        }

        @Test
        void extremeDelta_saturates() {
            assertEquals(Long.MAX_VALUE, calculator.impact(Long.MAX_VALUE, Long.MIN_VALUE, ImpactUnit.TICK));
            assertEquals(Long.MAX_VALUE, calculator.impact(Long.MIN_VALUE, 0L, ImpactUnit.TICK));
            assertEquals(10L, calculator.impact(Long.MAX_VALUE, Long.MIN_VALUE, ImpactUnit.PRICE));
        }
    }

    @Test
    void spikeCount_isCappedForScoringOnly() {
        PoolMetrics metrics = new PoolMetrics(0L, BigInteger.TEN, BigInteger.TEN, 42, 50);
        assertEquals(10, calculator.spikeCount(metrics));
        assertEquals(42, metrics.consecutiveSpikeCount());
        assertEquals(3, calculator.spikeCount(new PoolMetrics(0L, BigInteger.TEN, BigInteger.TEN, 3, 5)));
    }

    @Test
    void derive_coldStart_yieldsNeutralMetrics() {
        TradeMetrics metrics = calculator.derive(PoolMetrics.empty(), BigInteger.valueOf(100), 12L, ImpactUnit.TICK);
        assertEquals(new TradeMetrics(1, 0L, 0), metrics);
    }

    @Test
    void nonPositiveDivisor_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MetricCalculator(0L));
    }
}
