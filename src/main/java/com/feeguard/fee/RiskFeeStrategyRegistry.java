package com.feeguard.fee;

import com.feeguard.config.FeeModel;
import com.feeguard.config.PoolConfig;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Selects the {@link RiskFeeStrategy} matching a pool's configuration type.
 */
public class RiskFeeStrategyRegistry {

    private final Map<FeeModel, RiskFeeStrategy> strategies = new EnumMap<>(FeeModel.class);

    public RiskFeeStrategyRegistry(List<RiskFeeStrategy> strategies) {
        for (RiskFeeStrategy strategy : strategies) {
            RiskFeeStrategy previous = this.strategies.putIfAbsent(strategy.model(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate strategy for model " + strategy.model()
                    + ": " + previous.strategyId() + " and " + strategy.strategyId());
            }
        }
        for (FeeModel model : FeeModel.values()) {
            if (!this.strategies.containsKey(model)) {
                throw new IllegalStateException("No strategy registered for model " + model);
            }
        }
    }

    public RiskFeeStrategy strategyFor(PoolConfig config) {
        return strategies.get(config.model());
    }
}
