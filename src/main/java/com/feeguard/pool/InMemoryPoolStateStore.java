package com.feeguard.pool;

import com.feeguard.config.PoolConfig;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryPoolStateStore implements PoolStateStore {

    private final ConcurrentHashMap<PoolId, PoolConfig> configs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<PoolId, PoolMetrics> metrics = new ConcurrentHashMap<>();

    @Override
    public Optional<PoolConfig> findConfig(PoolId poolId) {
        return Optional.ofNullable(configs.get(poolId));
    }

    @Override
    public void saveConfig(PoolId poolId, PoolConfig config) {
        configs.put(poolId, config);
    }

    @Override
    public Optional<PoolMetrics> findMetrics(PoolId poolId) {
        return Optional.ofNullable(metrics.get(poolId));
    }

    @Override
    public void saveMetrics(PoolId poolId, PoolMetrics poolMetrics) {
        metrics.put(poolId, poolMetrics);
    }

    @Override
    public PoolMetrics saveMetricsIfAbsent(PoolId poolId, PoolMetrics poolMetrics) {
        PoolMetrics existing = metrics.putIfAbsent(poolId, poolMetrics);
        return existing != null ? existing : poolMetrics;
    }
}
