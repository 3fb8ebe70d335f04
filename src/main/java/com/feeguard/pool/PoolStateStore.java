package com.feeguard.pool;

import com.feeguard.config.PoolConfig;

import java.util.Optional;

/**
 * Key-value backing store for per-pool state, keyed by {@link PoolId}.
 *
 * Entries for different pools must never share data. Implementations are not
 * expected to serialize access to a single pool; that is the caller's obligation.
 */
public interface PoolStateStore {

    Optional<PoolConfig> findConfig(PoolId poolId);

    void saveConfig(PoolId poolId, PoolConfig config);

    Optional<PoolMetrics> findMetrics(PoolId poolId);

    void saveMetrics(PoolId poolId, PoolMetrics metrics);

    /** Stores {@code metrics} only if the pool has none yet; returns the value now stored. */
    PoolMetrics saveMetricsIfAbsent(PoolId poolId, PoolMetrics metrics);
}
