package com.company.anomaly.service;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.*;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Granularity;
import com.company.anomaly.domain.enums.Severity;
import com.company.anomaly.dto.response.*;
import com.company.anomaly.exception.AnomalyNotFoundException;
import com.company.anomaly.exception.InvalidQueryException;
import com.company.anomaly.repository.AnomalyEventRepository;
import com.company.anomaly.repository.CascadeIncidentRepository;
import com.company.anomaly.repository.MetricSampleRepository;
import com.company.anomaly.repository.RollupBucketRepository;
import com.company.anomaly.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side over the stores. Nothing here evaluates rules or correlates;
 * {@link #resolve} is the only write.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HealthQueryService {

    static final int STATUS_SCAN_LIMIT = 5000;
    static final int RECENT_OPEN_PER_COMPONENT = 5;

    private final AnomalyEventRepository anomalyRepository;
    private final CascadeIncidentRepository incidentRepository;
    private final RollupBucketRepository rollupRepository;
    private final MetricSampleRepository sampleRepository;
    private final AnomalyProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public CurrentStatusResponse currentStatus(int lastMinutes) {
        if (lastMinutes <= 0) {
            throw new InvalidQueryException("lastMinutes must be positive, got " + lastMinutes);
        }

        Instant now = clock.instant();
        List<AnomalyEvent> events = anomalyRepository.find(AnomalyCriteria.builder()
                .from(now.minus(Duration.ofMinutes(lastMinutes)))
                .to(now)
                .limit(STATUS_SCAN_LIMIT)
                .build());

        Map<Component, List<AnomalyEvent>> byComponent = new EnumMap<>(Component.class);
        for (AnomalyEvent event : events) {
            byComponent.computeIfAbsent(event.getComponent(), c -> new ArrayList<>()).add(event);
        }

        List<ComponentStatusResponse> components = Arrays.stream(Component.values())
                .map(component -> toComponentStatus(component, byComponent.getOrDefault(component, List.of())))
                .sorted(Comparator.comparing(ComponentStatusResponse::getLatestAnomaly,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .collect(Collectors.toList());

        return CurrentStatusResponse.builder()
                .generatedAt(now)
                .windowMinutes(lastMinutes)
                .overallStatus(overallStatus(components))
                .components(components)
                .build();
    }

    // Events arrive newest first
    private ComponentStatusResponse toComponentStatus(Component component, List<AnomalyEvent> events) {
        List<AnomalyEvent> open = events.stream().filter(AnomalyEvent::isOpen).toList();

        return ComponentStatusResponse.builder()
                .component(component.getWireName())
                .description(component.getDescription())
                .openCritical(open.stream().filter(e -> e.getSeverity() == Severity.CRITICAL).count())
                .openWarning(open.stream().filter(e -> e.getSeverity() == Severity.WARNING).count())
                .latestAnomaly(events.stream().map(AnomalyEvent::getTimestamp).max(Comparator.naturalOrder()).orElse(null))
                .recentOpen(open.stream()
                        .limit(RECENT_OPEN_PER_COMPONENT)
                        .map(AnomalyEventResponse::from)
                        .collect(Collectors.toList()))
                .build();
    }

    private String overallStatus(List<ComponentStatusResponse> components) {
        if (components.stream().anyMatch(c -> c.getOpenCritical() > 0)) return "CRITICAL";
        if (components.stream().anyMatch(c -> c.getOpenWarning() > 0)) return "WARNING";
        return "HEALTHY";
    }

    /**
     * Closed whole hours come from the hourly rollup; the partial hours at either end
     * (including the current, still-open hour) are scanned raw.
     */
    public AnomalySummaryResponse summary(int hours) {
        if (hours <= 0) {
            throw new InvalidQueryException("hours must be positive, got " + hours);
        }

        Instant to = clock.instant();
        Instant from = to.minus(Duration.ofHours(hours));
        Instant firstWholeHour = TimeUtils.ceilToHour(from);
        Instant currentHour = TimeUtils.truncateToHour(to);

        List<AnomalyCount> parts = new ArrayList<>();
        List<Instant> rollupHours = new ArrayList<>();

        if (firstWholeHour.isBefore(currentHour)) {
            parts.addAll(anomalyRepository.summarizeHourly(firstWholeHour, currentHour));
            for (Instant hour = firstWholeHour; hour.isBefore(currentHour); hour = hour.plus(Duration.ofHours(1))) {
                rollupHours.add(hour);
            }
            if (from.isBefore(firstWholeHour)) {
                parts.addAll(anomalyRepository.summarize(from, firstWholeHour));
            }
            parts.addAll(anomalyRepository.summarize(currentHour, to));
        } else {
            parts.addAll(anomalyRepository.summarize(from, to));
        }

        Map<String, AnomalyCount> merged = new TreeMap<>();
        for (AnomalyCount part : parts) {
            merged.merge(part.getComponent().getWireName() + "|" + part.getSeverity().name(), part, AnomalyCount::plus);
        }

        List<AnomalySummaryResponse.SeverityCount> counts = merged.values().stream()
                .sorted(Comparator.comparing((AnomalyCount c) -> c.getComponent().causalIndex())
                        .thenComparing(c -> c.getSeverity().getLevel(), Comparator.reverseOrder()))
                .map(this::toSeverityCount)
                .collect(Collectors.toList());

        log.debug("Summary over {}h: {} groups, {} rollup hours", hours, counts.size(), rollupHours.size());

        return AnomalySummaryResponse.builder()
                .from(from)
                .to(to)
                .rollupHours(rollupHours)
                .counts(counts)
                .build();
    }

    private AnomalySummaryResponse.SeverityCount toSeverityCount(AnomalyCount count) {
        Double mean = count.meanResolutionSeconds();
        return AnomalySummaryResponse.SeverityCount.builder()
                .component(count.getComponent().getWireName())
                .severity(count.getSeverity().name())
                .anomalyCount(count.getAnomalyCount())
                .resolvedCount(count.getResolvedCount())
                .meanResolutionSeconds(mean)
                .meanResolutionFormatted(TimeUtils.formatDuration(mean))
                .build();
    }

    public TrendResponse trend(String component, String metricName, Instant from, Instant to, String granularity) {
        Component resolvedComponent = Component.fromString(component)
                .orElseThrow(() -> new InvalidQueryException("Unknown component: " + component));
        Granularity resolvedGranularity = Granularity.fromString(granularity)
                .filter(g -> properties.getRollup().getGranularities().contains(g))
                .orElseThrow(() -> new InvalidQueryException("Unsupported granularity: " + granularity));
        if (metricName == null || metricName.isBlank()) {
            throw new InvalidQueryException("Metric name is required");
        }
        if (from == null || to == null || !from.isBefore(to)) {
            throw new InvalidQueryException("Trend range must satisfy from < to");
        }

        Instant now = clock.instant();
        List<TrendResponse.TrendPoint> points = rollupRepository
                .findRange(resolvedGranularity, resolvedComponent, metricName, from, to).stream()
                .map(bucket -> TrendResponse.TrendPoint.builder()
                        .bucketStart(bucket.getBucketStart())
                        .bucketEnd(bucket.getBucketEnd())
                        .avg(bucket.getAvg())
                        .min(bucket.getMin())
                        .max(bucket.getMax())
                        .stddev(bucket.getStddev())
                        .sampleCount(bucket.getSampleCount())
                        .provisional(bucket.isProvisional(now))
                        .build())
                .collect(Collectors.toList());

        return TrendResponse.builder()
                .component(resolvedComponent.getWireName())
                .metricName(metricName)
                .granularity(resolvedGranularity.getLabel())
                .from(from)
                .to(to)
                .buckets(points)
                .latestProvisional(!points.isEmpty() && points.get(points.size() - 1).isProvisional())
                .build();
    }

    public List<IncidentResponse> crossComponentIncidents(Instant from, Instant to) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new InvalidQueryException("Incident range must satisfy from <= to");
        }

        List<CascadeIncident> incidents = incidentRepository.findOverlapping(from, to);
        if (incidents.isEmpty()) {
            return List.of();
        }

        Set<String> eventIds = incidents.stream()
                .flatMap(incident -> incident.getLinks().stream())
                .map(IncidentLink::getEventId)
                .collect(Collectors.toSet());
        Map<String, AnomalyEvent> events = anomalyRepository.findByIds(eventIds).stream()
                .collect(Collectors.toMap(AnomalyEvent::getId, Function.identity(), (a, b) -> a));

        return incidents.stream()
                .map(incident -> IncidentResponse.builder()
                        .id(incident.getId())
                        .pattern(incident.getPatternLabel())
                        .startTime(incident.getStartTime())
                        .endTime(incident.getEndTime())
                        .confidence(incident.getConfidence())
                        .createdAt(incident.getCreatedAt())
                        .chain(incident.getLinks().stream()
                                .sorted(Comparator.comparingInt(IncidentLink::getPosition))
                                .map(link -> events.get(link.getEventId()))
                                .filter(Objects::nonNull)
                                .map(AnomalyEventResponse::from)
                                .collect(Collectors.toList()))
                        .build())
                .collect(Collectors.toList());
    }

    public List<MetricSummaryResponse> recentMetrics(int lastMinutes) {
        if (lastMinutes <= 0) {
            throw new InvalidQueryException("lastMinutes must be positive, got " + lastMinutes);
        }

        return sampleRepository.summarizeRecent(lastMinutes).stream()
                .map(summary -> MetricSummaryResponse.builder()
                        .component(summary.getComponent().getWireName())
                        .metricName(summary.getMetricName())
                        .avgValue(summary.getAvgValue())
                        .minValue(summary.getMinValue())
                        .maxValue(summary.getMaxValue())
                        .sampleCount(summary.getSampleCount())
                        .lastUpdate(summary.getLastUpdate())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Marks the anomaly resolved. Resolving an already resolved anomaly returns it unchanged.
     *
     * @param resolvedAt resolution time, or null for now
     */
    public AnomalyEventResponse resolve(String anomalyEventId, Instant resolvedAt) {
        resolveIfOpen(anomalyEventId, resolvedAt);

        // Re-read: a concurrent resolve may have won
        return anomalyRepository.findById(anomalyEventId)
                .map(AnomalyEventResponse::from)
                .orElseThrow(() -> new AnomalyNotFoundException(anomalyEventId));
    }

    /**
     * @return true only if this call closed the anomaly; false if it was already resolved,
     *         including by a concurrent caller
     */
    public boolean resolveIfOpen(String anomalyEventId, Instant resolvedAt) {
        AnomalyEvent event = anomalyRepository.findById(anomalyEventId)
                .orElseThrow(() -> new AnomalyNotFoundException(anomalyEventId));

        if (!event.isOpen()) {
            log.info("Anomaly {} already resolved at {}", anomalyEventId, event.getResolvedAt());
            return false;
        }

        Instant at = resolvedAt != null ? resolvedAt : clock.instant();
        if (!anomalyRepository.resolve(anomalyEventId, at)) {
            log.debug("Anomaly {} was resolved concurrently", anomalyEventId);
            return false;
        }

        meterRegistry.counter("anomaly.events.resolved",
                "component", event.getComponent().getWireName(),
                "severity", event.getSeverity().name()
        ).increment();
        log.info("Anomaly {} ({}/{}) resolved at {}", anomalyEventId,
                event.getComponent().getWireName(), event.getMetricName(), at);
        return true;
    }
}
