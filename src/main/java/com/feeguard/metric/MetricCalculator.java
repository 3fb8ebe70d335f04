package com.feeguard.metric;

import com.feeguard.config.ImpactUnit;
import com.feeguard.pool.PoolMetrics;

import java.math.BigInteger;

/**
 * Derives relative trade size, price impact and spike count from pool history.
 *
 * All functions are total: cold start and missing observations resolve to neutral
 * values instead of errors. Integer arithmetic only.
 */
public class MetricCalculator {

    public static final int NEUTRAL_RELATIVE_SIZE = 1;
    public static final int MAX_RELATIVE_SIZE = 10;
    public static final long MAX_PRICE_IMPACT = 10;
    public static final int MAX_SCORED_SPIKES = 10;

    private static final BigInteger MAX_RELATIVE_SIZE_BIG = BigInteger.valueOf(MAX_RELATIVE_SIZE);

    private final long priceImpactDivisor;

    public MetricCalculator(long priceImpactDivisor) {
        if (priceImpactDivisor <= 0) {
            throw new IllegalArgumentException("priceImpactDivisor must be positive");
        }
        this.priceImpactDivisor = priceImpactDivisor;
    }

    /**
     * {@code floor(tradeSize / averageTradeSize)} capped at 10, or 1 when the average is
     * still zero.
     */
    public int relativeSize(BigInteger tradeSize, BigInteger averageTradeSize) {
        if (averageTradeSize == null || averageTradeSize.signum() == 0) {
            return NEUTRAL_RELATIVE_SIZE;
        }
        BigInteger ratio = magnitude(tradeSize).divide(averageTradeSize.abs());
        return ratio.min(MAX_RELATIVE_SIZE_BIG).intValue();
    }

    /**
     * Absolute move between the previous and the current metric. TICK deltas are returned
     * as-is; PRICE deltas are divided by the price-impact divisor and capped at 10.
     */
    public long impact(Long currentMetric, Long lastMetric, ImpactUnit unit) {
        if (currentMetric == null || lastMetric == null) {
            return 0L;
        }
        long delta = distance(currentMetric, lastMetric);
        if (unit == ImpactUnit.PRICE) {
            return Math.min(delta / priceImpactDivisor, MAX_PRICE_IMPACT);
        }
        return delta;
    }

    /** Stored spike counter capped for scoring; the stored value is not changed. */
    public int spikeCount(PoolMetrics metrics) {
        return Math.min(metrics.consecutiveSpikeCount(), MAX_SCORED_SPIKES);
    }

    public TradeMetrics derive(PoolMetrics metrics, BigInteger tradeSize, Long currentMetric, ImpactUnit unit) {
        return new TradeMetrics(
            relativeSize(tradeSize, metrics.averageTradeSize()),
            impact(currentMetric, metrics.lastObservedMetric(), unit),
            spikeCount(metrics));
    }

    /** Order size magnitude; {@code null} counts as an empty trade. */
    public static BigInteger magnitude(BigInteger tradeSize) {
        return tradeSize == null ? BigInteger.ZERO : tradeSize.abs();
    }

    private static long distance(long a, long b) {
        try {
            return Math.absExact(Math.subtractExact(a, b));
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }
}
