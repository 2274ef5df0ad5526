package com.company.anomaly.scheduled;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Severity;
import com.company.anomaly.service.HealthQueryService;
import com.company.anomaly.support.InMemoryAnomalyEventRepository;
import com.company.anomaly.support.InMemoryCascadeIncidentRepository;
import com.company.anomaly.support.InMemoryMetricSampleRepository;
import com.company.anomaly.support.InMemoryRollupBucketRepository;
import com.company.anomaly.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.company.anomaly.support.Fixtures.anomaly;
import static org.junit.jupiter.api.Assertions.*;

class AnomalyAutoResolutionJobTest {

    private static final Instant T = Instant.parse("2024-03-01T12:00:00Z");

    private InMemoryAnomalyEventRepository anomalyRepository;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private AnomalyAutoResolutionJob job;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T);
        meterRegistry = new SimpleMeterRegistry();
        job = newJob(new InMemoryAnomalyEventRepository());
    }

    private AnomalyAutoResolutionJob newJob(InMemoryAnomalyEventRepository repository) {
        anomalyRepository = repository;
        AnomalyProperties properties = new AnomalyProperties();

        HealthQueryService queryService = new HealthQueryService(anomalyRepository,
                new InMemoryCascadeIncidentRepository(), new InMemoryRollupBucketRepository(),
                new InMemoryMetricSampleRepository(), properties, meterRegistry, clock);
        return new AnomalyAutoResolutionJob(anomalyRepository, queryService, properties, meterRegistry, clock);
    }

    // ========== Expiry ==========

    @Test
    @DisplayName("Warnings expire after five minutes, criticals after ten")
    void expiryPerSeverity() {
        AnomalyEvent oldWarning = anomalyRepository.append(
                anomaly(Component.BROKER, "consumer_lag", Severity.WARNING, T));
        AnomalyEvent critical = anomalyRepository.append(
                anomaly(Component.ANALYTICS_STORE, "query_duration", Severity.CRITICAL, T));
        AnomalyEvent freshWarning = anomalyRepository.append(
                anomaly(Component.STREAM_PROCESSOR, "task_backpressure", Severity.WARNING, T.plus(Duration.ofMinutes(8))));

        clock.set(T.plus(Duration.ofMinutes(9)));
        job.resolveExpiredAnomalies();

        assertEquals(T.plus(Duration.ofMinutes(9)), resolvedAt(oldWarning));
        assertNull(resolvedAt(critical));
        assertNull(resolvedAt(freshWarning));

        clock.set(T.plus(Duration.ofMinutes(11)));
        job.resolveExpiredAnomalies();

        assertEquals(T.plus(Duration.ofMinutes(11)), resolvedAt(critical));
        assertNull(resolvedAt(freshWarning));
        assertEquals(1.0, meterRegistry.counter("anomaly.auto_resolved", "severity", "CRITICAL").count());
    }

    @Test
    @DisplayName("Already resolved anomalies are left alone")
    void resolvedAnomaliesUntouched() {
        AnomalyEvent event = anomalyRepository.append(
                anomaly(Component.BROKER, "consumer_lag", Severity.WARNING, T));
        anomalyRepository.resolve(event.getId(), T.plus(Duration.ofMinutes(1)));

        clock.set(T.plus(Duration.ofHours(1)));
        assertEquals(0, job.resolveOlderThan(Severity.WARNING, Duration.ofMinutes(5), clock.instant()));
        assertEquals(T.plus(Duration.ofMinutes(1)), resolvedAt(event));
    }

    // ========== Concurrent resolution ==========

    @Test
    @DisplayName("Anomalies resolved by someone else after the expiry scan are not counted")
    void resolvedAfterScanNotCounted() {
        Instant operatorResolvedAt = T.plus(Duration.ofMinutes(7));
        job = newJob(new InMemoryAnomalyEventRepository() {
            @Override
            public synchronized List<AnomalyEvent> findOpenOlderThan(Severity severity, Instant cutoff, int limit) {
                List<AnomalyEvent> open = super.findOpenOlderThan(severity, cutoff, limit);
                open.forEach(event -> resolve(event.getId(), operatorResolvedAt));
                return open;
            }
        });
        AnomalyEvent event = anomalyRepository.append(
                anomaly(Component.BROKER, "consumer_lag", Severity.WARNING, T));

        clock.set(T.plus(Duration.ofMinutes(9)));
        assertEquals(0, job.resolveOlderThan(Severity.WARNING, Duration.ofMinutes(5), clock.instant()));

        assertEquals(operatorResolvedAt, resolvedAt(event));
        assertEquals(0.0, meterRegistry.counter("anomaly.auto_resolved", "severity", "WARNING").count());
    }

    @Test
    @DisplayName("Losing the conditional update to a concurrent resolve is not counted")
    void lostResolveRaceNotCounted() {
        Instant operatorResolvedAt = T.plus(Duration.ofMinutes(7));
        job = newJob(new InMemoryAnomalyEventRepository() {
            @Override
            public synchronized boolean resolve(String id, Instant resolvedAt) {
                super.resolve(id, operatorResolvedAt);
                return super.resolve(id, resolvedAt);
            }
        });
        AnomalyEvent first = anomalyRepository.append(
                anomaly(Component.BROKER, "consumer_lag", Severity.CRITICAL, T));
        AnomalyEvent second = anomalyRepository.append(
                anomaly(Component.BROKER, "partition_skew", Severity.CRITICAL, T));

        clock.set(T.plus(Duration.ofMinutes(11)));
        job.resolveExpiredAnomalies();

        assertEquals(operatorResolvedAt, resolvedAt(first));
        assertEquals(operatorResolvedAt, resolvedAt(second));
        assertEquals(0.0, meterRegistry.counter("anomaly.auto_resolved", "severity", "CRITICAL").count());
    }

    private Instant resolvedAt(AnomalyEvent event) {
        return anomalyRepository.findById(event.getId()).orElseThrow().getResolvedAt();
    }
}
