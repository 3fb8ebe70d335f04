package com.feeguard.state;

import com.feeguard.metric.MetricCalculator;
import com.feeguard.pool.PoolMetrics;
import com.feeguard.pool.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Folds a settled trade into a pool's history.
 *
 * <ul>
 *   <li>average trade size: seeded with the first trade, then {@code floor((avg*9 + size) / 10)}</li>
 *   <li>spike counter: +1 (saturating at the cap) when {@code relativeSize > spikeThreshold},
 *       measured against the pre-trade average, otherwise reset to 0</li>
 *   <li>last observed metric and last trade size: overwritten</li>
 * </ul>
 *
 * Degenerate trades (zero size or no resulting metric) produce no update at all.
 */
public class PoolStateUpdater {

    private static final Logger log = LoggerFactory.getLogger(PoolStateUpdater.class);

    private static final BigInteger HISTORY_WEIGHT = BigInteger.valueOf(9);
    private static final BigInteger EMA_DENOMINATOR = BigInteger.TEN;

    private final MetricCalculator calculator;
    private final int spikeThreshold;
    private final int spikeCounterCap;

    public PoolStateUpdater(MetricCalculator calculator, int spikeThreshold, int spikeCounterCap) {
        if (spikeCounterCap < 1) {
            throw new IllegalArgumentException("spikeCounterCap must be at least 1");
        }
        this.calculator = calculator;
        this.spikeThreshold = spikeThreshold;
        this.spikeCounterCap = spikeCounterCap;
    }

    /**
     * @param previous history before the trade
     * @param trade the settled trade with its realized size and resulting metric
     * @return the updated history, or empty if the trade is degenerate
     */
    public Optional<PoolMetrics> apply(PoolMetrics previous, Trade trade) {
        if (trade.isDegenerate()) {
            log.debug("Skipping history update for degenerate trade size={} metric={}",
                trade.size(), trade.resultingMetric());
            return Optional.empty();
        }

        BigInteger size = trade.size();
        int relativeSize = calculator.relativeSize(size, previous.averageTradeSize());
        boolean spike = relativeSize > spikeThreshold;

        BigInteger average = previous.isColdStart()
            ? size
            : previous.averageTradeSize().multiply(HISTORY_WEIGHT).add(size).divide(EMA_DENOMINATOR);

        int spikes = 0;
        if (spike) {
            spikes = previous.consecutiveSpikeCount() >= spikeCounterCap
                ? spikeCounterCap
                : previous.consecutiveSpikeCount() + 1;
        }

        long tradeCount = previous.tradeCount() == Long.MAX_VALUE
            ? Long.MAX_VALUE
            : previous.tradeCount() + 1;

        PoolMetrics updated = new PoolMetrics(trade.resultingMetric(), size, average, spikes, tradeCount);
        if (spike) {
            log.debug("Spike detected: relative_size={} threshold={} consecutive={}",
                relativeSize, spikeThreshold, spikes);
        }
        return Optional.of(updated);
    }
}
