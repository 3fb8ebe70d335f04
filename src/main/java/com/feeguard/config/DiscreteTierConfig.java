package com.feeguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weighted score model: three fee tiers split by two score thresholds.
 *
 * @param feeLow fee (bps) for {@code score < thresholdLow}
 * @param feeMed fee (bps) for {@code thresholdLow <= score < thresholdHigh}
 * @param feeHigh fee (bps) for {@code score >= thresholdHigh}
 * @param w1 weight of the relative trade size
 * @param w2 weight of the price impact
 * @param w3 weight of the consecutive spike count
 */
public record DiscreteTierConfig(
    @JsonProperty("fee_low") int feeLow,
    @JsonProperty("fee_med") int feeMed,
    @JsonProperty("fee_high") int feeHigh,
    @JsonProperty("threshold_low") int thresholdLow,
    @JsonProperty("threshold_high") int thresholdHigh,
    @JsonProperty("w1") int w1,
    @JsonProperty("w2") int w2,
    @JsonProperty("w3") int w3,
    @JsonProperty("impact_unit") ImpactUnit impactUnit
) implements PoolConfig {

    public static final int DEFAULT_FEE_LOW = 5;
    public static final int DEFAULT_FEE_MED = 20;
    public static final int DEFAULT_FEE_HIGH = 60;
    public static final int DEFAULT_THRESHOLD_LOW = 50;
    public static final int DEFAULT_THRESHOLD_HIGH = 150;
    public static final int DEFAULT_W1 = 50;
    public static final int DEFAULT_W2 = 30;
    public static final int DEFAULT_W3 = 20;

    public static DiscreteTierConfig defaults(ImpactUnit impactUnit) {
        return new DiscreteTierConfig(
            DEFAULT_FEE_LOW, DEFAULT_FEE_MED, DEFAULT_FEE_HIGH,
            DEFAULT_THRESHOLD_LOW, DEFAULT_THRESHOLD_HIGH,
            DEFAULT_W1, DEFAULT_W2, DEFAULT_W3,
            impactUnit);
    }

    @Override
    public FeeModel model() {
        return FeeModel.DISCRETE_TIER;
    }
}
