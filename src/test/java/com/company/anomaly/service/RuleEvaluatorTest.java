package com.company.anomaly.service;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.RuleTable;
import com.company.anomaly.domain.RuleTier;
import com.company.anomaly.domain.enums.Comparison;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Severity;
import com.company.anomaly.event.AnomalyDetectedEvent;
import com.company.anomaly.support.Fixtures;
import com.company.anomaly.support.InMemoryAnomalyEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RuleEvaluatorTest {

    private static final Instant T = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant NOW = T.plusSeconds(3);

    private InMemoryAnomalyEventRepository anomalyRepository;
    private RuleTableRegistry registry;
    private SimpleMeterRegistry meterRegistry;
    private List<Object> published;
    private RuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        anomalyRepository = new InMemoryAnomalyEventRepository();
        registry = new RuleTableRegistry(Fixtures.ruleTableLoader(), new AnomalyProperties());
        registry.loadInitial();
        meterRegistry = new SimpleMeterRegistry();
        published = new ArrayList<>();
        ApplicationEventPublisher publisher = published::add;

        evaluator = new RuleEvaluator(registry, anomalyRepository, publisher, meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("consumer_lag of 150000 produces one critical anomaly mentioning 100k")
    void consumerLagAboveCriticalTier() {
        Optional<AnomalyEvent> result = evaluator.evaluate(
                Fixtures.sample(Component.BROKER, "consumer_lag", 150000, T));

        assertTrue(result.isPresent());
        AnomalyEvent anomaly = result.get();
        assertEquals(Severity.CRITICAL, anomaly.getSeverity());
        assertTrue(anomaly.getReason().contains("100k"), anomaly.getReason());
        assertEquals(T, anomaly.getTimestamp());
        assertEquals(NOW, anomaly.getCreatedAt());
        assertEquals(100000.0, anomaly.getThreshold());
        assertTrue(anomaly.isOpen());

        assertEquals(1, anomalyRepository.all().size());
        assertEquals(1.0, meterRegistry.counter("anomaly.events.created",
                "component", "broker", "severity", "CRITICAL").count());
    }

    @Test
    @DisplayName("consumer_lag of 1000 is within range")
    void consumerLagBelowAllTiers() {
        Optional<AnomalyEvent> result = evaluator.evaluate(
                Fixtures.sample(Component.BROKER, "consumer_lag", 1000, T));

        assertTrue(result.isEmpty());
        assertTrue(anomalyRepository.all().isEmpty());
        assertTrue(published.isEmpty());
    }

    @Test
    @DisplayName("Value between tiers matches the warning tier")
    void consumerLagWarningTier() {
        AnomalyEvent anomaly = evaluator.evaluate(
                Fixtures.sample(Component.BROKER, "consumer_lag", 75000, T)).orElseThrow();

        assertEquals(Severity.WARNING, anomaly.getSeverity());
        assertEquals("Consumer lag exceeds 50k messages", anomaly.getReason());
    }

    @Test
    @DisplayName("Metrics without rule tiers are never anomalous")
    void unknownMetricFailsOpen() {
        assertTrue(evaluator.evaluate(
                Fixtures.sample(Component.BROKER, "bytes_in_per_sec", 1e12, T)).isEmpty());
        assertTrue(evaluator.evaluate(
                Fixtures.sample(Component.ANALYTICS_STORE, "consumer_lag", 1e9, T)).isEmpty());
        assertTrue(anomalyRepository.all().isEmpty());
    }

    @Test
    @DisplayName("Less-than tiers fire below their threshold")
    void lowThroughput() {
        assertEquals(Severity.WARNING, evaluator.evaluate(
                Fixtures.sample(Component.STREAM_PROCESSOR, "task_throughput", 50, T)).orElseThrow().getSeverity());
        assertTrue(evaluator.evaluate(
                Fixtures.sample(Component.STREAM_PROCESSOR, "task_throughput", 5000, T)).isEmpty());
    }

    @Test
    @DisplayName("The first matching tier wins even when a more severe tier follows it")
    void firstMatchingTierWins() {
        registry.swap(new RuleTable("misordered", T, List.of(
                tier(50000, Severity.WARNING),
                tier(100000, Severity.CRITICAL))));

        AnomalyEvent anomaly = evaluator.evaluate(
                Fixtures.sample(Component.BROKER, "consumer_lag", 150000, T)).orElseThrow();

        assertEquals(Severity.WARNING, anomaly.getSeverity());
        assertEquals(1, anomalyRepository.all().size());
    }

    @Test
    @DisplayName("Anomaly tags carry the sample origin and the event names the rule version")
    void publishesDetectedEvent() {
        AnomalyEvent anomaly = evaluator.evaluate(
                Fixtures.sample(Component.ANALYTICS_STORE, "disk_usage", 95, T)).orElseThrow();

        assertEquals("node-01", anomaly.getTags().get("host"));
        assertEquals("production", anomaly.getTags().get("environment"));

        assertEquals(1, published.size());
        AnomalyDetectedEvent event = (AnomalyDetectedEvent) published.get(0);
        assertEquals(anomaly.getId(), event.getAnomaly().getId());
        assertEquals("2024.1", event.getRuleTableVersion());
    }

    @Test
    @DisplayName("Reason templates substitute the observed value")
    void reasonTemplate() {
        registry.swap(new RuleTable("templated", T, List.of(RuleTier.builder()
                .component(Component.BROKER)
                .metricName("consumer_lag")
                .comparison(Comparison.GREATER_THAN)
                .threshold(100000)
                .severity(Severity.CRITICAL)
                .reasonTemplate("{metric} at {value} on {host} (limit {threshold})")
                .build())));

        AnomalyEvent anomaly = evaluator.evaluate(
                Fixtures.sample(Component.BROKER, "consumer_lag", 150000, T)).orElseThrow();

        assertEquals("consumer_lag at 150000 on node-01 (limit 100000)", anomaly.getReason());
    }

    private RuleTier tier(double threshold, Severity severity) {
        return RuleTier.builder()
                .component(Component.BROKER)
                .metricName("consumer_lag")
                .comparison(Comparison.GREATER_THAN)
                .threshold(threshold)
                .severity(severity)
                .build();
    }
}
