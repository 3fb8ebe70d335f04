package com.feeguard.pool;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.feeguard.config.PoolConfig;

/**
 * Read-only view of a pool: the active configuration, whether it was explicitly set,
 * and the current trade history.
 */
public record PoolSnapshot(
    @JsonProperty("pool_id") PoolId poolId,
    @JsonProperty("configured") boolean configured,
    @JsonProperty("config") PoolConfig config,
    @JsonProperty("metrics") PoolMetrics metrics
) {}
