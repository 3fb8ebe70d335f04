package com.feeguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Continuous model: {@code fee = clamp(baseFee + k1*delta + k2*delta^2, baseFee, maxFee)}.
 *
 * @param k1 linear coefficient, one fractional digit
 * @param k2 quadratic coefficient, one fractional digit
 */
public record QuadraticImpactConfig(
    @JsonProperty("base_fee") int baseFee,
    @JsonProperty("max_fee") int maxFee,
    @JsonProperty("k1") FixedPoint k1,
    @JsonProperty("k2") FixedPoint k2,
    @JsonProperty("impact_unit") ImpactUnit impactUnit
) implements PoolConfig {

    public static final int DEFAULT_BASE_FEE = 5;
    public static final int DEFAULT_MAX_FEE = 60;
    public static final FixedPoint DEFAULT_K1 = FixedPoint.ofScaled(5);
    public static final FixedPoint DEFAULT_K2 = FixedPoint.ofScaled(2);

    public static QuadraticImpactConfig defaults(ImpactUnit impactUnit) {
        return new QuadraticImpactConfig(DEFAULT_BASE_FEE, DEFAULT_MAX_FEE, DEFAULT_K1, DEFAULT_K2, impactUnit);
    }

    @Override
    public FeeModel model() {
        return FeeModel.QUADRATIC_IMPACT;
    }
}
