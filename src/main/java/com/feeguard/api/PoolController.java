package com.feeguard.api;

import com.feeguard.config.PoolConfig;
import com.feeguard.engine.FeeEngineService;
import com.feeguard.fee.FeeAssessment;
import com.feeguard.pool.PoolId;
import com.feeguard.pool.PoolMetrics;
import com.feeguard.pool.PoolSnapshot;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HTTP mapping of {@link FeeEngineService} for operators and out-of-process hosts.
 *
 * Callers are not authenticated here; configuration writes must be authorized upstream.
 */
@RestController
@RequestMapping("/v1/pools/{poolId}")
public class PoolController {

    private final FeeEngineService engine;

    public PoolController(FeeEngineService engine) {
        this.engine = engine;
    }

    @GetMapping
    public PoolSnapshot snapshot(@PathVariable String poolId) {
        return engine.snapshot(PoolId.of(poolId));
    }

    @PostMapping("/quote")
    public FeeAssessment quote(@PathVariable String poolId, @RequestBody TradeRequest request) {
        return engine.assess(PoolId.of(poolId), request.currentMetric(), request.tradeSize());
    }

    @PostMapping("/trades")
    public PoolMetrics recordTrade(@PathVariable String poolId, @RequestBody TradeRequest request) {
        return engine.record(PoolId.of(poolId), request.currentMetric(), request.tradeSize());
    }

    @PostMapping("/init")
    public PoolMetrics initialize(@PathVariable String poolId) {
        return engine.initializePool(PoolId.of(poolId));
    }

    @GetMapping("/config")
    public PoolConfig getConfig(@PathVariable String poolId) {
        return engine.getConfig(PoolId.of(poolId));
    }

    @PutMapping("/config")
    public Map<String, Object> setConfig(@PathVariable String poolId, @RequestBody PoolConfig config) {
        engine.setConfig(PoolId.of(poolId), config);
        return Map.of(
            "status", "accepted",
            "pool_id", poolId,
            "model", config.model()
        );
    }

    @GetMapping("/metrics")
    public PoolMetrics getMetrics(@PathVariable String poolId) {
        return engine.getMetrics(PoolId.of(poolId));
    }
}
