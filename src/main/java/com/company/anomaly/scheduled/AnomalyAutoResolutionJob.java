package com.company.anomaly.scheduled;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.enums.Severity;
import com.company.anomaly.repository.AnomalyEventRepository;
import com.company.anomaly.service.HealthQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Resolves anomalies that stayed open past their expiry: warnings after 5 minutes,
 * criticals after 10 minutes by default. Off unless explicitly enabled.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "anomaly.resolution.auto-expiry.enabled",
        havingValue = "true"
)
public class AnomalyAutoResolutionJob {

    private final AnomalyEventRepository anomalyRepository;
    private final HealthQueryService queryService;
    private final AnomalyProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${anomaly.resolution.auto-expiry.interval-ms:60000}",
            initialDelayString = "${anomaly.resolution.auto-expiry.initial-delay-ms:60000}"
    )
    public void resolveExpiredAnomalies() {
        Instant now = clock.instant();

        try {
            int resolved = resolveOlderThan(Severity.WARNING, properties.getResolution().getWarningExpiry(), now)
                    + resolveOlderThan(Severity.CRITICAL, properties.getResolution().getCriticalExpiry(), now);

            if (resolved > 0) {
                log.info("Auto-expiry resolved {} anomalies", resolved);
            }
        } catch (Exception e) {
            log.error("Anomaly auto-expiry job failed", e);
            meterRegistry.counter("anomaly.auto_resolution.failures").increment();
        }
    }

    int resolveOlderThan(Severity severity, Duration expiry, Instant now) {
        List<AnomalyEvent> expired = anomalyRepository.findOpenOlderThan(
                severity, now.minus(expiry), properties.getResolution().getBatchSize());

        int resolved = 0;
        for (AnomalyEvent event : expired) {
            try {
                if (queryService.resolveIfOpen(event.getId(), now)) {
                    resolved++;
                }
            } catch (Exception e) {
                log.error("Failed to auto-resolve anomaly {}", event.getId(), e);
            }
        }

        if (resolved > 0) {
            meterRegistry.counter("anomaly.auto_resolved", "severity", severity.name()).increment(resolved);
        }
        return resolved;
    }
}
