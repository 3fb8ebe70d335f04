package com.feeguard.fee;

import com.feeguard.config.DiscreteTierConfig;
import com.feeguard.config.FeeModel;
import com.feeguard.config.PoolConfig;
import com.feeguard.metric.MetricCalculator;
import com.feeguard.metric.TradeMetrics;
import com.feeguard.pool.PoolMetrics;

import java.math.BigInteger;

/**
 * Weighted score model.
 *
 * <pre>
 * score = clamp(w1*relativeSize + w2*impact + w3*spikeCount, 0, 255)
 * score &lt;  thresholdLow                  -&gt; feeLow
 * thresholdLow &lt;= score &lt; thresholdHigh  -&gt; feeMed
 * score &gt;= thresholdHigh                 -&gt; feeHigh
 * </pre>
 */
public class DiscreteTierFeeStrategy implements RiskFeeStrategy {

    private final MetricCalculator calculator;

    public DiscreteTierFeeStrategy(MetricCalculator calculator) {
        this.calculator = calculator;
    }

    @Override
    public String strategyId() {
        return "discrete-tier";
    }

    @Override
    public String strategyVersion() {
        return "v1";
    }

    @Override
    public FeeModel model() {
        return FeeModel.DISCRETE_TIER;
    }

    @Override
    public FeeAssessment assess(PoolConfig config, PoolMetrics metrics, BigInteger tradeSize, Long currentMetric) {
        if (!(config instanceof DiscreteTierConfig tiers)) {
            throw new IllegalArgumentException("discrete-tier strategy requires a DiscreteTierConfig");
        }

        TradeMetrics derived = calculator.derive(metrics, tradeSize, currentMetric, tiers.impactUnit());
        int score = score(tiers, derived);
        return new FeeAssessment(feeForScore(tiers, score), score, derived,
            model(), strategyId(), strategyVersion());
    }

    public int score(DiscreteTierConfig tiers, TradeMetrics metrics) {
        // An uncapped tick impact above MAX already saturates any non-zero weight.
        long impact = Math.min(metrics.impact(), RiskScore.MAX);
        long raw = (long) tiers.w1() * metrics.relativeSize()
            + (long) tiers.w2() * impact
            + (long) tiers.w3() * metrics.spikeCount();
        return RiskScore.clamp(raw);
    }

    public int feeForScore(DiscreteTierConfig tiers, int score) {
        if (score < tiers.thresholdLow()) {
            return tiers.feeLow();
        }
        if (score < tiers.thresholdHigh()) {
            return tiers.feeMed();
        }
        return tiers.feeHigh();
    }
}
