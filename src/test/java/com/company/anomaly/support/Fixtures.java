package com.company.anomaly.support;

import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.MetricSample;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Severity;
import com.company.anomaly.service.RuleTableLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public final class Fixtures {

    public static final String DEFAULT_RULES = "classpath:rules/default-rules.json";

    private Fixtures() {
    }

    public static RuleTableLoader ruleTableLoader() {
        return ruleTableLoader(Clock.systemUTC());
    }

    public static RuleTableLoader ruleTableLoader(Clock clock) {
        return new RuleTableLoader(new DefaultResourceLoader(), new ObjectMapper(), clock);
    }

    public static MetricSample sample(Component component, String metric, double value, Instant timestamp) {
        return MetricSample.builder()
                .timestamp(timestamp)
                .component(component)
                .metricName(metric)
                .value(value)
                .host("node-01")
                .cluster("main-cluster")
                .environment("production")
                .build();
    }

    public static AnomalyEvent anomaly(Component component, String metric, Severity severity, Instant timestamp) {
        return anomaly(UUID.randomUUID().toString(), component, metric, severity, timestamp);
    }

    public static AnomalyEvent anomaly(String id, Component component, String metric, Severity severity,
                                       Instant timestamp) {
        return AnomalyEvent.builder()
                .id(id)
                .timestamp(timestamp)
                .component(component)
                .metricName(metric)
                .observedValue(1.0)
                .severity(severity)
                .reason(metric + " out of range")
                .tags(Map.of())
                .createdAt(timestamp)
                .build();
    }
}
