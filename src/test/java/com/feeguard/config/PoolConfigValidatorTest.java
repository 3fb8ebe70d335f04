package com.feeguard.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PoolConfigValidatorTest {

    private final PoolConfigValidator validator = new PoolConfigValidator();

    private ConfigErrorCode rejectionOf(PoolConfig config) {
        return assertThrows(PoolConfigException.class, () -> validator.validate(config)).getErrorCode();
    }

    private static DiscreteTierConfig tiers(int low, int med, int high, int tLow, int tHigh) {
        return new DiscreteTierConfig(low, med, high, tLow, tHigh, 50, 30, 20, ImpactUnit.TICK);
    }

    @Test
    void defaults_areValid() {
        assertDoesNotThrow(() -> validator.validate(DiscreteTierConfig.defaults(ImpactUnit.TICK)));
        assertDoesNotThrow(() -> validator.validate(DiscreteTierConfig.defaults(ImpactUnit.PRICE)));
        assertDoesNotThrow(() -> validator.validate(QuadraticImpactConfig.defaults(ImpactUnit.TICK)));
    }

    @Test
    void nullConfig_isRejected() {
        assertEquals(ConfigErrorCode.INVALID_PARAMETER, rejectionOf(null));
    }

    @Nested
    @DisplayName("Discrete tier model")
    class Discrete {

        @Test
        void feesOutsideBps_areOutOfBounds() {
            assertEquals(ConfigErrorCode.FEE_OUT_OF_BOUNDS, rejectionOf(tiers(0, 20, 60, 50, 150)));
            assertEquals(ConfigErrorCode.FEE_OUT_OF_BOUNDS, rejectionOf(tiers(-5, 20, 60, 50, 150)));
            assertEquals(ConfigErrorCode.FEE_OUT_OF_BOUNDS, rejectionOf(tiers(5, 20, 10_001, 50, 150)));
        }

        @Test
        void maximumFee_isAccepted() {
            assertDoesNotThrow(() -> validator.validate(tiers(1, 2, 10_000, 50, 150)));
        }

        @Test
        void nonIncreasingFees_areInvalidRange() {
            assertEquals(ConfigErrorCode.INVALID_FEE_RANGE, rejectionOf(tiers(20, 20, 60, 50, 150)));
            assertEquals(ConfigErrorCode.INVALID_FEE_RANGE, rejectionOf(tiers(5, 60, 20, 50, 150)));
            assertEquals(ConfigErrorCode.INVALID_FEE_RANGE, rejectionOf(tiers(60, 20, 5, 50, 150)));
        }

        @Test
        void thresholdsOutOfOrder_areRejected() {
            assertEquals(ConfigErrorCode.INVALID_THRESHOLD_ORDER, rejectionOf(tiers(5, 20, 60, 150, 150)));
            assertEquals(ConfigErrorCode.INVALID_THRESHOLD_ORDER, rejectionOf(tiers(5, 20, 60, 150, 50)));
        }

        @Test
        void thresholdsOutsideScoreRange_areRejected() {
            assertEquals(ConfigErrorCode.INVALID_THRESHOLD_ORDER, rejectionOf(tiers(5, 20, 60, -1, 150)));
            assertEquals(ConfigErrorCode.INVALID_THRESHOLD_ORDER, rejectionOf(tiers(5, 20, 60, 50, 256)));
        }

        @Test
        void thresholdsAtScoreLimits_areAccepted() {
            assertDoesNotThrow(() -> validator.validate(tiers(5, 20, 60, 0, 255)));
        }

        @Test
        void negativeWeight_isInvalidParameter() {
            DiscreteTierConfig config = new DiscreteTierConfig(5, 20, 60, 50, 150, 50, -1, 20, ImpactUnit.TICK);
            assertEquals(ConfigErrorCode.INVALID_PARAMETER, rejectionOf(config));
        }

        @Test
        void missingImpactUnit_isInvalidParameter() {
            DiscreteTierConfig config = new DiscreteTierConfig(5, 20, 60, 50, 150, 50, 30, 20, null);
            assertEquals(ConfigErrorCode.INVALID_PARAMETER, rejectionOf(config));
        }
    }

    @Nested
    @DisplayName("Quadratic impact model")
    class Quadratic {

        private QuadraticImpactConfig curve(int base, int max, FixedPoint k1, FixedPoint k2) {
            return new QuadraticImpactConfig(base, max, k1, k2, ImpactUnit.TICK);
        }

        @Test
        void maxNotAboveBase_isInvalidRange() {
            assertEquals(ConfigErrorCode.INVALID_FEE_RANGE,
                rejectionOf(curve(60, 60, FixedPoint.ofScaled(5), FixedPoint.ofScaled(2))));
            assertEquals(ConfigErrorCode.INVALID_FEE_RANGE,
                rejectionOf(curve(60, 5, FixedPoint.ofScaled(5), FixedPoint.ofScaled(2))));
        }

        @Test
        void zeroBaseFee_isOutOfBounds() {
            assertEquals(ConfigErrorCode.FEE_OUT_OF_BOUNDS,
                rejectionOf(curve(0, 60, FixedPoint.ofScaled(5), FixedPoint.ofScaled(2))));
            assertEquals(ConfigErrorCode.FEE_OUT_OF_BOUNDS,
                rejectionOf(curve(5, 20_000, FixedPoint.ofScaled(5), FixedPoint.ofScaled(2))));
        }

        @Test
        void missingOrNegativeCoefficient_isInvalidParameter() {
            assertEquals(ConfigErrorCode.INVALID_PARAMETER,
                rejectionOf(curve(5, 60, null, FixedPoint.ofScaled(2))));
            assertEquals(ConfigErrorCode.INVALID_PARAMETER,
                rejectionOf(curve(5, 60, FixedPoint.ofScaled(5), FixedPoint.ofScaled(-2))));
        }
    }
}
