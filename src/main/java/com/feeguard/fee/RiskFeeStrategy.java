package com.feeguard.fee;

import com.feeguard.config.FeeModel;
import com.feeguard.config.PoolConfig;
import com.feeguard.pool.PoolMetrics;

import java.math.BigInteger;

/**
 * Maps a pool's pre-trade history and an incoming trade to a fee.
 * Strategies are deterministic and stateless: no clock, no randomness, no floating point.
 */
public interface RiskFeeStrategy {

    /** Unique strategy identifier, e.g. "discrete-tier". */
    String strategyId();

    /** Strategy version, e.g. "v1". */
    String strategyVersion();

    /** The configuration type this strategy prices with. */
    FeeModel model();

    /**
     * Price a trade.
     *
     * @param config configuration of {@link #model()}
     * @param metrics pool history before this trade
     * @param tradeSize order size magnitude
     * @param currentMetric current price or tick, {@code null} if unknown
     * @return the fee and its inputs; the fee always lies within the configuration's fee bounds
     */
    FeeAssessment assess(PoolConfig config, PoolMetrics metrics, BigInteger tradeSize, Long currentMetric);

    default int computeFee(PoolConfig config, PoolMetrics metrics, BigInteger tradeSize, Long currentMetric) {
        return assess(config, metrics, tradeSize, currentMetric).feeBps();
    }
}
