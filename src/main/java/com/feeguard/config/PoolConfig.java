package com.feeguard.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Per-pool tunable parameters. The concrete type selects the fee model.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "model")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DiscreteTierConfig.class, name = "discrete_tier"),
    @JsonSubTypes.Type(value = QuadraticImpactConfig.class, name = "quadratic_impact")
})
public sealed interface PoolConfig permits DiscreteTierConfig, QuadraticImpactConfig {

    /** Maximum fee in basis points (100%). */
    int MAX_FEE_BPS = 10_000;

    @JsonIgnore
    FeeModel model();

    ImpactUnit impactUnit();

    static PoolConfig defaults(FeeModel model, ImpactUnit impactUnit) {
        return switch (model) {
            case DISCRETE_TIER -> DiscreteTierConfig.defaults(impactUnit);
            case QUADRATIC_IMPACT -> QuadraticImpactConfig.defaults(impactUnit);
        };
    }
}
