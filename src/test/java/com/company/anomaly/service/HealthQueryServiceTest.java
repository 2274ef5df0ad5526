package com.company.anomaly.service;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.CascadeIncident;
import com.company.anomaly.domain.IncidentLink;
import com.company.anomaly.domain.RollupBucket;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Granularity;
import com.company.anomaly.domain.enums.IncidentPattern;
import com.company.anomaly.domain.enums.Severity;
import com.company.anomaly.dto.response.*;
import com.company.anomaly.exception.AnomalyNotFoundException;
import com.company.anomaly.exception.InvalidQueryException;
import com.company.anomaly.support.Fixtures;
import com.company.anomaly.support.InMemoryAnomalyEventRepository;
import com.company.anomaly.support.InMemoryCascadeIncidentRepository;
import com.company.anomaly.support.InMemoryMetricSampleRepository;
import com.company.anomaly.support.InMemoryRollupBucketRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static com.company.anomaly.support.Fixtures.anomaly;
import static org.junit.jupiter.api.Assertions.*;

class HealthQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:30:00Z");
    private static final Map<Component, String> METRICS = Map.of(
            Component.BROKER, "consumer_lag",
            Component.STREAM_PROCESSOR, "task_backpressure",
            Component.ANALYTICS_STORE, "query_duration");

    private InMemoryAnomalyEventRepository anomalyRepository;
    private InMemoryCascadeIncidentRepository incidentRepository;
    private InMemoryRollupBucketRepository rollupRepository;
    private InMemoryMetricSampleRepository sampleRepository;
    private AnomalyProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private HealthQueryService service;

    @BeforeEach
    void setUp() {
        anomalyRepository = new InMemoryAnomalyEventRepository();
        incidentRepository = new InMemoryCascadeIncidentRepository();
        rollupRepository = new InMemoryRollupBucketRepository();
        sampleRepository = new InMemoryMetricSampleRepository();
        properties = new AnomalyProperties();
        meterRegistry = new SimpleMeterRegistry();

        service = new HealthQueryService(anomalyRepository, incidentRepository, rollupRepository,
                sampleRepository, properties, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ========== Current status ==========

    @Test
    @DisplayName("Status lists every component, most recent anomaly first")
    void currentStatusOrdering() {
        append(Component.ANALYTICS_STORE, Severity.CRITICAL, at("12:20:00"));
        append(Component.BROKER, Severity.WARNING, at("12:25:00"));
        AnomalyEvent resolved = append(Component.STREAM_PROCESSOR, Severity.CRITICAL, at("12:28:00"));
        anomalyRepository.resolve(resolved.getId(), at("12:29:00"));
        append(Component.BROKER, Severity.CRITICAL, at("11:00:00"));

        CurrentStatusResponse status = service.currentStatus(15);

        assertEquals("CRITICAL", status.getOverallStatus());
        assertEquals(List.of("stream-processor", "broker", "analytics-store"),
                status.getComponents().stream().map(ComponentStatusResponse::getComponent).toList());

        ComponentStatusResponse processor = status.getComponents().get(0);
        assertEquals(0, processor.getOpenCritical());
        assertTrue(processor.getRecentOpen().isEmpty());

        ComponentStatusResponse broker = status.getComponents().get(1);
        assertEquals(0, broker.getOpenCritical());
        assertEquals(1, broker.getOpenWarning());

        assertEquals(1, status.getComponents().get(2).getOpenCritical());
    }

    @Test
    @DisplayName("Components without anomalies are listed last and healthy")
    void quietComponents() {
        append(Component.BROKER, Severity.WARNING, at("12:25:00"));

        CurrentStatusResponse status = service.currentStatus(15);

        assertEquals("WARNING", status.getOverallStatus());
        assertEquals(3, status.getComponents().size());
        assertEquals("broker", status.getComponents().get(0).getComponent());
        assertNull(status.getComponents().get(1).getLatestAnomaly());
        assertNull(status.getComponents().get(2).getLatestAnomaly());
    }

    @Test
    @DisplayName("An empty window is healthy")
    void healthyWhenEmpty() {
        assertEquals("HEALTHY", service.currentStatus(15).getOverallStatus());
        assertThrows(InvalidQueryException.class, () -> service.currentStatus(0));
    }

    // ========== Summary ==========

    @Test
    @DisplayName("Whole hours come from the hourly rollup, partial hours from raw events")
    void summarySplitsRollupAndRaw() {
        append(Component.BROKER, Severity.CRITICAL, at("09:45:00"));
        AnomalyEvent first = append(Component.BROKER, Severity.CRITICAL, at("10:15:00"));
        anomalyRepository.resolve(first.getId(), at("10:16:30"));
        AnomalyEvent second = append(Component.BROKER, Severity.CRITICAL, at("11:50:00"));
        anomalyRepository.resolve(second.getId(), at("11:51:30"));
        append(Component.BROKER, Severity.WARNING, at("12:10:00"));
        append(Component.ANALYTICS_STORE, Severity.WARNING, at("09:00:00"));

        AnomalySummaryResponse summary = service.summary(3);

        assertEquals(List.of(at("10:00:00"), at("11:00:00")), summary.getRollupHours());
        assertEquals(1, anomalyRepository.hourlyQueries.get());
        assertEquals(2, anomalyRepository.rawQueries.get());

        assertEquals(2, summary.getCounts().size());
        AnomalySummaryResponse.SeverityCount critical = summary.getCounts().get(0);
        assertEquals("broker", critical.getComponent());
        assertEquals("CRITICAL", critical.getSeverity());
        assertEquals(3, critical.getAnomalyCount());
        assertEquals(2, critical.getResolvedCount());
        assertEquals(90.0, critical.getMeanResolutionSeconds(), 1e-9);
        assertEquals("1m 30s", critical.getMeanResolutionFormatted());

        AnomalySummaryResponse.SeverityCount warning = summary.getCounts().get(1);
        assertEquals("WARNING", warning.getSeverity());
        assertEquals(1, warning.getAnomalyCount());
        assertNull(warning.getMeanResolutionSeconds());
    }

    @Test
    @DisplayName("A window without a closed whole hour is scanned raw only")
    void summaryRawOnly() {
        append(Component.STREAM_PROCESSOR, Severity.WARNING, at("11:45:00"));

        AnomalySummaryResponse summary = service.summary(1);

        assertTrue(summary.getRollupHours().isEmpty());
        assertEquals(0, anomalyRepository.hourlyQueries.get());
        assertEquals(1, anomalyRepository.rawQueries.get());
        assertEquals(1, summary.getCounts().get(0).getAnomalyCount());
    }

    // ========== Trend ==========

    @Test
    @DisplayName("Trend marks buckets still inside their grace period as provisional")
    void trendProvisionalFlags() {
        rollupRepository.upsert(bucket(at("12:15:00"), at("12:22:00"), 40.0));
        rollupRepository.upsert(bucket(at("12:25:00"), at("12:32:00"), 60.0));

        TrendResponse trend = service.trend("broker", "consumer_lag", at("12:00:00"), NOW, "5m");

        assertEquals("5m", trend.getGranularity());
        assertEquals(2, trend.getBuckets().size());
        assertFalse(trend.getBuckets().get(0).isProvisional());
        assertTrue(trend.getBuckets().get(1).isProvisional());
        assertEquals(at("12:30:00"), trend.getBuckets().get(1).getBucketEnd());
        assertTrue(trend.isLatestProvisional());
    }

    @Test
    @DisplayName("Trend rejects unknown components, bad granularities and empty ranges")
    void trendValidation() {
        assertThrows(InvalidQueryException.class,
                () -> service.trend("load-balancer", "latency", at("12:00:00"), NOW, "5m"));
        assertThrows(InvalidQueryException.class,
                () -> service.trend("broker", "consumer_lag", at("12:00:00"), NOW, "10m"));
        assertThrows(InvalidQueryException.class,
                () -> service.trend("broker", "consumer_lag", NOW, NOW, "5m"));
        assertThrows(InvalidQueryException.class,
                () -> service.trend("broker", " ", at("12:00:00"), NOW, "5m"));
    }

    @Test
    @DisplayName("A granularity that is not maintained cannot be queried")
    void trendUnconfiguredGranularity() {
        properties.getRollup().setGranularities(EnumSet.of(Granularity.ONE_MINUTE));

        assertThrows(InvalidQueryException.class,
                () -> service.trend("broker", "consumer_lag", at("10:00:00"), NOW, "1h"));
        assertTrue(service.trend("broker", "consumer_lag", at("10:00:00"), NOW, "1m").getBuckets().isEmpty());
    }

    // ========== Incidents ==========

    @Test
    @DisplayName("Incident chains are returned upstream first")
    void incidentChain() {
        AnomalyEvent broker = append(Component.BROKER, Severity.CRITICAL, at("12:00:00"));
        AnomalyEvent processor = append(Component.STREAM_PROCESSOR, Severity.CRITICAL, at("12:02:00"));
        AnomalyEvent store = append(Component.ANALYTICS_STORE, Severity.CRITICAL, at("12:04:00"));

        incidentRepository.save(CascadeIncident.builder()
                .id("incident-1")
                .dedupeKey("key-1")
                .pattern(IncidentPattern.CASCADE)
                .startTime(at("12:00:00"))
                .endTime(at("12:04:00"))
                .confidence(0.84)
                .links(List.of(
                        new IncidentLink(2, Component.ANALYTICS_STORE, store.getId()),
                        new IncidentLink(0, Component.BROKER, broker.getId()),
                        new IncidentLink(1, Component.STREAM_PROCESSOR, processor.getId())))
                .build());

        List<IncidentResponse> incidents = service.crossComponentIncidents(at("11:00:00"), NOW);

        assertEquals(1, incidents.size());
        assertEquals(List.of("broker", "stream-processor", "analytics-store"),
                incidents.get(0).getChain().stream().map(AnomalyEventResponse::getComponent).toList());
        assertTrue(service.crossComponentIncidents(at("12:10:00"), NOW).isEmpty());
    }

    // ========== Resolve ==========

    @Test
    @DisplayName("Resolving sets the resolution time once; repeats are no-ops")
    void resolveIdempotent() {
        AnomalyEvent event = append(Component.BROKER, Severity.WARNING, at("12:00:00"));

        AnomalyEventResponse resolved = service.resolve(event.getId(), null);
        assertFalse(resolved.isOpen());
        assertEquals(NOW, resolved.getResolvedAt());

        AnomalyEventResponse again = service.resolve(event.getId(), at("12:29:00"));
        assertEquals(NOW, again.getResolvedAt());
        assertEquals(1.0, meterRegistry.counter("anomaly.events.resolved",
                "component", "broker", "severity", "WARNING").count());
    }

    @Test
    @DisplayName("Resolving an unknown anomaly fails")
    void resolveUnknown() {
        assertThrows(AnomalyNotFoundException.class, () -> service.resolve("missing", null));
    }

    // ========== Recent metrics ==========

    @Test
    @DisplayName("Recent metrics are aggregated per component and metric")
    void recentMetrics() {
        Instant recent = Instant.now().minusSeconds(30);
        sampleRepository.append(Fixtures.sample(Component.BROKER, "consumer_lag", 10, recent), recent);
        sampleRepository.append(Fixtures.sample(Component.BROKER, "consumer_lag", 30, recent.plusSeconds(5)), recent);
        sampleRepository.append(Fixtures.sample(Component.ANALYTICS_STORE, "disk_usage", 50, recent), recent);

        List<MetricSummaryResponse> metrics = service.recentMetrics(5);

        assertEquals(2, metrics.size());
        MetricSummaryResponse lag = metrics.stream()
                .filter(m -> m.getMetricName().equals("consumer_lag"))
                .findFirst()
                .orElseThrow();
        assertEquals(20.0, lag.getAvgValue(), 1e-9);
        assertEquals(2, lag.getSampleCount());
    }

    private AnomalyEvent append(Component component, Severity severity, Instant timestamp) {
        return anomalyRepository.append(anomaly(component, metricFor(component), severity, timestamp));
    }

    private static String metricFor(Component component) {
        return METRICS.get(component);
    }

    private static RollupBucket bucket(Instant start, Instant provisionalUntil, double avg) {
        return RollupBucket.builder()
                .granularity(Granularity.FIVE_MINUTES)
                .bucketStart(start)
                .component(Component.BROKER)
                .metricName("consumer_lag")
                .avg(avg)
                .min(avg)
                .max(avg)
                .sampleCount(1)
                .provisionalUntil(provisionalUntil)
                .updatedAt(start)
                .build();
    }

    private static Instant at(String time) {
        return Instant.parse("2024-03-01T" + time + "Z");
    }
}
