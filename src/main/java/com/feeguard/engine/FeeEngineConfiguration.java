package com.feeguard.engine;

import com.feeguard.fee.DiscreteTierFeeStrategy;
import com.feeguard.fee.QuadraticImpactFeeStrategy;
import com.feeguard.fee.RiskFeeStrategyRegistry;
import com.feeguard.metric.MetricCalculator;
import com.feeguard.state.PoolStateUpdater;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@EnableConfigurationProperties(FeeGuardProperties.class)
public class FeeEngineConfiguration {

    @Bean
    public MetricCalculator metricCalculator(FeeGuardProperties properties) {
        return new MetricCalculator(properties.priceImpactDivisor());
    }

    /**
     * Both fee models are always registered; each pool's configuration type picks one.
     */
    @Bean
    public RiskFeeStrategyRegistry riskFeeStrategyRegistry(MetricCalculator metricCalculator) {
        return new RiskFeeStrategyRegistry(List.of(
            new DiscreteTierFeeStrategy(metricCalculator),
            new QuadraticImpactFeeStrategy(metricCalculator)
        ));
    }

    @Bean
    public PoolStateUpdater poolStateUpdater(MetricCalculator metricCalculator, FeeGuardProperties properties) {
        return new PoolStateUpdater(metricCalculator, properties.spikeThreshold(), properties.spikeCounterCap());
    }
}
