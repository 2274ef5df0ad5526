package com.company.anomaly.config;

import com.company.anomaly.service.RollupEngine;
import com.company.anomaly.service.RuleTableRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final RollupEngine rollupEngine;
    private final RuleTableRegistry ruleTableRegistry;

    @Bean
    public MeterBinder anomalyEngineMetrics() {
        return (reg) -> {
            Gauge.builder("rollup.buckets.live", rollupEngine, RollupEngine::liveBucketCount)
                    .description("Rollup buckets held in memory")
                    .register(reg);

            Gauge.builder("rules.tiers.loaded", ruleTableRegistry, r -> r.current().size())
                    .description("Rule tiers in the active rule table")
                    .register(reg);

            log.info("Custom metrics registered");
        };
    }
}
