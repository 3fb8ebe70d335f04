package com.feeguard.engine;

import com.feeguard.config.PoolConfig;
import com.feeguard.config.PoolConfigException;
import com.feeguard.config.PoolConfigValidator;
import com.feeguard.fee.FeeAssessment;
import com.feeguard.fee.RiskFeeStrategy;
import com.feeguard.fee.RiskFeeStrategyRegistry;
import com.feeguard.metric.MetricCalculator;
import com.feeguard.pool.PoolId;
import com.feeguard.pool.PoolMetrics;
import com.feeguard.pool.PoolSnapshot;
import com.feeguard.pool.PoolStateStore;
import com.feeguard.pool.Trade;
import com.feeguard.state.PoolStateUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Entry point for the swap host.
 *
 * <pre>
 * evaluate(pool, metric, size)  -&gt; fee      before execution, read-only
 * ... host executes and settles the trade at that fee ...
 * record(pool, metric, size)                after settlement, with realized values
 * </pre>
 *
 * Caller obligation: for any single pool the host must serialize
 * "evaluate T, settle T, record T" against every other trade on that pool. No locking
 * is done here. Calls for different pools are independent and may run concurrently.
 *
 * {@code evaluate} and {@code record} never throw for cold start, missing metrics or
 * empty trades; only {@link #setConfig} can fail.
 */
@Service
public class FeeEngineService {

    private static final Logger log = LoggerFactory.getLogger(FeeEngineService.class);

    private final PoolStateStore store;
    private final PoolConfigValidator validator;
    private final RiskFeeStrategyRegistry strategies;
    private final PoolStateUpdater updater;
    private final PoolConfig defaultConfig;

    public FeeEngineService(PoolStateStore store,
                            PoolConfigValidator validator,
                            RiskFeeStrategyRegistry strategies,
                            PoolStateUpdater updater,
                            FeeGuardProperties properties) {
        this.store = store;
        this.validator = validator;
        this.strategies = strategies;
        this.updater = updater;
        this.defaultConfig = PoolConfig.defaults(properties.defaultModel(), properties.defaultImpactUnit());
    }

    /** Fee in bps for a trade about to execute. */
    public int evaluate(PoolId poolId, Long currentMetric, BigInteger tradeSize) {
        return assess(poolId, currentMetric, tradeSize).feeBps();
    }

    /** Like {@link #evaluate} but also returns the score and metrics behind the fee. */
    public FeeAssessment assess(PoolId poolId, Long currentMetric, BigInteger tradeSize) {
        PoolConfig config = getConfig(poolId);
        PoolMetrics metrics = getMetrics(poolId);
        RiskFeeStrategy strategy = strategies.strategyFor(config);

        FeeAssessment assessment = strategy.assess(config, metrics,
            MetricCalculator.magnitude(tradeSize), currentMetric);

        log.debug("Pool {} assessed by {}/{}: fee_bps={} score={} metrics={}",
            poolId, strategy.strategyId(), strategy.strategyVersion(),
            assessment.feeBps(), assessment.riskScore(), assessment.metrics());
        return assessment;
    }

    /**
     * Folds a settled trade into the pool history. Zero-size trades and trades without a
     * resulting metric leave the pool untouched.
     *
     * @return the pool history after the call
     */
    public PoolMetrics record(PoolId poolId, Long currentMetric, BigInteger tradeSize) {
        Trade trade = new Trade(tradeSize, currentMetric);
        PoolMetrics previous = getMetrics(poolId);

        Optional<PoolMetrics> updated = updater.apply(previous, trade);
        if (updated.isEmpty()) {
            return previous;
        }

        store.saveMetrics(poolId, updated.get());
        log.debug("Pool {} history updated: {}", poolId, updated.get());
        return updated.get();
    }

    /**
     * Validates and activates a configuration. On failure the previously active
     * configuration (explicit or default) stays in place.
     *
     * @throws PoolConfigException if any parameter is invalid
     */
    public void setConfig(PoolId poolId, PoolConfig config) {
        try {
            validator.validate(config);
        } catch (PoolConfigException ex) {
            log.warn("Rejected configuration for pool {}: {} {}", poolId, ex.getErrorCode(), ex.getMessage());
            throw ex;
        }
        boolean replacing = store.findConfig(poolId).isPresent();
        store.saveConfig(poolId, config);
        log.info("Pool {} {} with model {}: {}",
            poolId, replacing ? "reconfigured" : "configured", config.model(), config);
    }

    /** The explicit configuration, or the engine defaults if none was ever set. */
    public PoolConfig getConfig(PoolId poolId) {
        return store.findConfig(poolId).orElse(defaultConfig);
    }

    public boolean isConfigured(PoolId poolId) {
        return store.findConfig(poolId).isPresent();
    }

    /** The pool's history, or the all-zero sentinel before its first recorded trade. */
    public PoolMetrics getMetrics(PoolId poolId) {
        return store.findMetrics(poolId).orElse(PoolMetrics.empty());
    }

    /** Creates the all-zero history for a pool if it has none. Existing history is kept. */
    public PoolMetrics initializePool(PoolId poolId) {
        PoolMetrics stored = store.saveMetricsIfAbsent(poolId, PoolMetrics.empty());
        log.info("Pool {} initialized (trade_count={})", poolId, stored.tradeCount());
        return stored;
    }

    public PoolSnapshot snapshot(PoolId poolId) {
        return new PoolSnapshot(poolId, isConfigured(poolId), getConfig(poolId), getMetrics(poolId));
    }
}
