package com.feeguard.config;

import com.feeguard.fee.RiskScore;
import org.springframework.stereotype.Component;

/**
 * Validates parameter values of a {@link PoolConfig}. Fails on the first violation.
 *
 * Caller identity is not checked here; the host authorizes configuration changes
 * before they reach the engine.
 */
@Component
public class PoolConfigValidator {

    public void validate(PoolConfig config) {
        if (config == null) {
            throw new PoolConfigException(ConfigErrorCode.INVALID_PARAMETER, "config is required");
        }
        if (config.impactUnit() == null) {
            throw new PoolConfigException(ConfigErrorCode.INVALID_PARAMETER, "impact_unit is required");
        }

        switch (config.model()) {
            case DISCRETE_TIER -> validateDiscrete((DiscreteTierConfig) config);
            case QUADRATIC_IMPACT -> validateQuadratic((QuadraticImpactConfig) config);
        }
    }

    private void validateDiscrete(DiscreteTierConfig config) {
        requireFeeInBounds(config.feeLow(), "fee_low");
        requireFeeInBounds(config.feeMed(), "fee_med");
        requireFeeInBounds(config.feeHigh(), "fee_high");

        if (!(config.feeLow() < config.feeMed() && config.feeMed() < config.feeHigh())) {
            throw new PoolConfigException(ConfigErrorCode.INVALID_FEE_RANGE,
                "fees must satisfy fee_low < fee_med < fee_high, got "
                    + config.feeLow() + "/" + config.feeMed() + "/" + config.feeHigh());
        }

        requireThresholdInRange(config.thresholdLow(), "threshold_low");
        requireThresholdInRange(config.thresholdHigh(), "threshold_high");
        if (config.thresholdLow() >= config.thresholdHigh()) {
            throw new PoolConfigException(ConfigErrorCode.INVALID_THRESHOLD_ORDER,
                "threshold_low must be below threshold_high, got "
                    + config.thresholdLow() + "/" + config.thresholdHigh());
        }

        requireNonNegative(config.w1(), "w1");
        requireNonNegative(config.w2(), "w2");
        requireNonNegative(config.w3(), "w3");
    }

    private void validateQuadratic(QuadraticImpactConfig config) {
        requireFeeInBounds(config.baseFee(), "base_fee");
        requireFeeInBounds(config.maxFee(), "max_fee");

        if (config.maxFee() <= config.baseFee()) {
            throw new PoolConfigException(ConfigErrorCode.INVALID_FEE_RANGE,
                "max_fee must exceed base_fee, got " + config.baseFee() + "/" + config.maxFee());
        }

        requireCoefficient(config.k1(), "k1");
        requireCoefficient(config.k2(), "k2");
    }

    private void requireFeeInBounds(int feeBps, String field) {
        if (feeBps <= 0 || feeBps > PoolConfig.MAX_FEE_BPS) {
            throw new PoolConfigException(ConfigErrorCode.FEE_OUT_OF_BOUNDS,
                field + " must be in (0, " + PoolConfig.MAX_FEE_BPS + "] bps, got " + feeBps);
        }
    }

    /**
     * Thresholds are unsigned 8-bit score values, compared against a score clamped to
     * {@code [0, 255]}. A wider value is not a representable threshold, so it is reported
     * together with ordering errors.
     */
    private void requireThresholdInRange(int threshold, String field) {
        if (threshold < RiskScore.MIN || threshold > RiskScore.MAX) {
            throw new PoolConfigException(ConfigErrorCode.INVALID_THRESHOLD_ORDER,
                field + " must be in [" + RiskScore.MIN + ", " + RiskScore.MAX + "], got " + threshold);
        }
    }

    private void requireNonNegative(int weight, String field) {
        if (weight < 0) {
            throw new PoolConfigException(ConfigErrorCode.INVALID_PARAMETER,
                field + " must not be negative, got " + weight);
        }
    }

    private void requireCoefficient(FixedPoint coefficient, String field) {
        if (coefficient == null) {
            throw new PoolConfigException(ConfigErrorCode.INVALID_PARAMETER, field + " is required");
        }
        if (coefficient.isNegative()) {
            throw new PoolConfigException(ConfigErrorCode.INVALID_PARAMETER,
                field + " must not be negative, got " + coefficient);
        }
    }
}
