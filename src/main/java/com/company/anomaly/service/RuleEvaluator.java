package com.company.anomaly.service;

import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.MetricSample;
import com.company.anomaly.domain.RuleTable;
import com.company.anomaly.domain.RuleTier;
import com.company.anomaly.event.AnomalyDetectedEvent;
import com.company.anomaly.repository.AnomalyEventRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Classifies one sample against the active rule table and appends at most one anomaly.
 * Metrics without tiers are never anomalous (fail-open).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RuleEvaluator {

    private final RuleTableRegistry ruleTableRegistry;
    private final AnomalyEventRepository anomalyRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public Optional<AnomalyEvent> evaluate(MetricSample sample) {
        RuleTable table = ruleTableRegistry.current();
        Optional<RuleTier> match = table.firstMatch(sample);

        if (match.isEmpty()) {
            return Optional.empty();
        }

        RuleTier tier = match.get();
        AnomalyEvent anomaly = AnomalyEvent.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(sample.getTimestamp())
                .component(sample.getComponent())
                .metricName(sample.getMetricName())
                .observedValue(sample.getValue())
                .severity(tier.getSeverity())
                .threshold(tier.getThreshold())
                .reason(tier.renderReason(sample))
                .durationEstimateMinutes(tier.getDurationEstimateMinutes())
                .tags(buildTags(sample))
                .createdAt(clock.instant())
                .build();

        AnomalyEvent saved = anomalyRepository.append(anomaly);

        meterRegistry.counter("anomaly.events.created",
                "component", sample.getComponent().getWireName(),
                "severity", tier.getSeverity().name()
        ).increment();

        log.debug("Anomaly {} for {}/{}={} ({})", saved.getId(),
                sample.getComponent().getWireName(), sample.getMetricName(),
                sample.getValue(), saved.getReason());

        eventPublisher.publishEvent(new AnomalyDetectedEvent(saved, table.getVersion()));
        return Optional.of(saved);
    }

    private Map<String, String> buildTags(MetricSample sample) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (sample.getTags() != null) {
            tags.putAll(sample.getTags());
        }
        putIfPresent(tags, "host", sample.getHost());
        putIfPresent(tags, "cluster", sample.getCluster());
        putIfPresent(tags, "environment", sample.getEnvironment());
        putIfPresent(tags, "unit", sample.getUnit());
        return tags;
    }

    private static void putIfPresent(Map<String, String> tags, String key, String value) {
        if (value != null && !value.isBlank()) {
            tags.putIfAbsent(key, value);
        }
    }
}
