package com.feeguard.pool;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Trade history of a single pool, as seen after the last recorded trade.
 *
 * Values are immutable; every recorded trade produces a new instance that replaces
 * the previous one in the {@link PoolStateStore}.
 *
 * An {@code averageTradeSize} of zero is the cold-start signal: no trade has been
 * recorded yet. {@code lastObservedMetric} is {@code null} until then.
 */
public record PoolMetrics(
    @JsonProperty("last_observed_metric") Long lastObservedMetric,
    @JsonProperty("last_trade_size") BigInteger lastTradeSize,
    @JsonProperty("average_trade_size") BigInteger averageTradeSize,
    @JsonProperty("consecutive_spike_count") int consecutiveSpikeCount,
    @JsonProperty("trade_count") long tradeCount
) {

    private static final PoolMetrics EMPTY = new PoolMetrics(null, BigInteger.ZERO, BigInteger.ZERO, 0, 0L);

    public PoolMetrics {
        lastTradeSize = lastTradeSize != null ? lastTradeSize : BigInteger.ZERO;
        averageTradeSize = averageTradeSize != null ? averageTradeSize : BigInteger.ZERO;
        if (lastTradeSize.signum() < 0 || averageTradeSize.signum() < 0) {
            throw new IllegalArgumentException("trade sizes must not be negative");
        }
        if (consecutiveSpikeCount < 0 || tradeCount < 0) {
            throw new IllegalArgumentException("counters must not be negative");
        }
    }

    /** All-zero sentinel used before the pool's first trade. */
    public static PoolMetrics empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isColdStart() {
        return averageTradeSize.signum() == 0;
    }
}
