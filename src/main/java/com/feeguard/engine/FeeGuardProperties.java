package com.feeguard.engine;

import com.feeguard.config.FeeModel;
import com.feeguard.config.ImpactUnit;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Engine-wide settings. Per-pool parameters live in {@link com.feeguard.config.PoolConfig}.
 *
 * @param defaultModel fee model used by pools that were never configured
 * @param defaultImpactUnit impact unit of the default configuration
 * @param priceImpactDivisor divisor that maps a PRICE delta onto the 0-10 impact scale
 * @param spikeThreshold relative size a trade must exceed to count as a spike
 * @param spikeCounterCap saturation value of the stored spike counter
 */
@Validated
@ConfigurationProperties(prefix = "fee-guard")
public record FeeGuardProperties(
    FeeModel defaultModel,
    ImpactUnit defaultImpactUnit,
    @Positive Long priceImpactDivisor,
    @Min(0) Integer spikeThreshold,
    @Min(1) Integer spikeCounterCap
) {

    public static final long DEFAULT_PRICE_IMPACT_DIVISOR = 10_000L;
    public static final int DEFAULT_SPIKE_THRESHOLD = 5;
    public static final int DEFAULT_SPIKE_COUNTER_CAP = 255;

    public FeeGuardProperties {
        if (defaultModel == null) {
            defaultModel = FeeModel.DISCRETE_TIER;
        }
        if (defaultImpactUnit == null) {
            defaultImpactUnit = ImpactUnit.TICK;
        }
        if (priceImpactDivisor == null) {
            priceImpactDivisor = DEFAULT_PRICE_IMPACT_DIVISOR;
        }
        if (spikeThreshold == null) {
            spikeThreshold = DEFAULT_SPIKE_THRESHOLD;
        }
        if (spikeCounterCap == null) {
            spikeCounterCap = DEFAULT_SPIKE_COUNTER_CAP;
        }
    }

    public static FeeGuardProperties defaults() {
        return new FeeGuardProperties(null, null, null, null, null);
    }
}
