package com.feeguard.fee;

import com.feeguard.config.FeeModel;
import com.feeguard.config.PoolConfig;
import com.feeguard.config.QuadraticImpactConfig;
import com.feeguard.metric.MetricCalculator;
import com.feeguard.metric.TradeMetrics;
import com.feeguard.pool.PoolMetrics;

import java.math.BigInteger;

/**
 * Continuous model: {@code fee = clamp(baseFee + k1*delta + k2*delta^2, baseFee, maxFee)}.
 *
 * Each coefficient term is computed exactly and floored to whole bps before summing,
 * so {@code delta = 15} with the defaults prices at 5 + 7 + 45 = 57 bps.
 */
public class QuadraticImpactFeeStrategy implements RiskFeeStrategy {

    private final MetricCalculator calculator;

    public QuadraticImpactFeeStrategy(MetricCalculator calculator) {
        this.calculator = calculator;
    }

    @Override
    public String strategyId() {
        return "quadratic-impact";
    }

    @Override
    public String strategyVersion() {
        return "v1";
    }

    @Override
    public FeeModel model() {
        return FeeModel.QUADRATIC_IMPACT;
    }

    @Override
    public FeeAssessment assess(PoolConfig config, PoolMetrics metrics, BigInteger tradeSize, Long currentMetric) {
        if (!(config instanceof QuadraticImpactConfig curve)) {
            throw new IllegalArgumentException("quadratic-impact strategy requires a QuadraticImpactConfig");
        }

        TradeMetrics derived = calculator.derive(metrics, tradeSize, currentMetric, curve.impactUnit());
        return new FeeAssessment(feeForDelta(curve, derived.impact()), null, derived,
            model(), strategyId(), strategyVersion());
    }

    public int feeForDelta(QuadraticImpactConfig curve, long delta) {
        BigInteger d = BigInteger.valueOf(Math.max(delta, 0L));
        BigInteger raw = BigInteger.valueOf(curve.baseFee())
            .add(curve.k1().multiplyFloor(d))
            .add(curve.k2().multiplyFloor(d.multiply(d)));

        if (raw.compareTo(BigInteger.valueOf(curve.maxFee())) >= 0) {
            return curve.maxFee();
        }
        return Math.max(raw.intValueExact(), curve.baseFee());
    }
}
