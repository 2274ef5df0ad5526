package com.company.anomaly.service;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.CascadeIncident;
import com.company.anomaly.domain.IncidentLink;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.IncidentPattern;
import com.company.anomaly.domain.enums.Severity;
import com.company.anomaly.event.IncidentCreatedEvent;
import com.company.anomaly.repository.AnomalyEventRepository;
import com.company.anomaly.repository.CascadeIncidentRepository;
import com.company.anomaly.util.ConfidenceScorer;
import com.company.anomaly.util.IncidentKeys;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Links anomalies into incidents:
 * <ul>
 *   <li>cascade: broker → stream-processor → analytics-store, each hop within the max lag</li>
 *   <li>resource exhaustion: several distinct metrics of one component anomalous in one bucket</li>
 * </ul>
 * Incidents are keyed deterministically, so re-running over overlapping windows never
 * creates the same incident twice.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CascadeCorrelator {

    private static final List<Component> CHAIN = List.of(Component.values());
    private static final int CHAIN_HOPS = CHAIN.size() - 1;

    private final AnomalyEventRepository anomalyRepository;
    private final CascadeIncidentRepository incidentRepository;
    private final TransactionOperations transactionOperations;
    private final ApplicationEventPublisher eventPublisher;
    private final AnomalyProperties properties;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    /**
     * @return incidents created by this pass
     */
    public List<CascadeIncident> correlate(Instant windowStart, Instant windowEnd) {
        Span span = tracer.spanBuilder("anomaly.correlation.pass")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("window.start", windowStart.toString());
            span.setAttribute("window.end", windowEnd.toString());

            List<AnomalyEvent> events = collapseDuplicates(anomalyRepository.findBetween(windowStart, windowEnd));
            span.setAttribute("events.scanned", events.size());

            List<CascadeIncident> created = new ArrayList<>();
            created.addAll(detectCascades(events, windowStart, windowEnd));
            created.addAll(detectResourceExhaustion(events));

            span.setAttribute("incidents.created", created.size());
            log.debug("Correlation over [{}, {}]: {} events, {} new incidents",
                    windowStart, windowEnd, events.size(), created.size());
            return created;

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Correlation pass failed");
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * At-least-once appends may store one trigger several times; keep the lowest id per trigger.
     * Result is ordered by timestamp, then id.
     */
    List<AnomalyEvent> collapseDuplicates(List<AnomalyEvent> events) {
        Map<String, AnomalyEvent> byTrigger = new HashMap<>();
        for (AnomalyEvent event : events) {
            byTrigger.merge(event.logicalKey(), event,
                    (a, b) -> a.getId().compareTo(b.getId()) <= 0 ? a : b);
        }
        return byTrigger.values().stream()
                .sorted(Comparator.comparing(AnomalyEvent::getTimestamp).thenComparing(AnomalyEvent::getId))
                .collect(Collectors.toList());
    }

    private List<CascadeIncident> detectCascades(List<AnomalyEvent> events, Instant windowStart, Instant windowEnd) {
        Duration maxLag = properties.getCorrelation().getMaxLag();

        // Events already part of a cascade stay there
        Set<String> used = new HashSet<>();
        incidentRepository.findOverlapping(windowStart.minus(maxLag.multipliedBy(CHAIN_HOPS)), windowEnd).stream()
                .filter(incident -> incident.getPattern() == IncidentPattern.CASCADE)
                .flatMap(incident -> incident.getLinks().stream())
                .map(IncidentLink::getEventId)
                .forEach(used::add);

        Map<Component, List<AnomalyEvent>> byComponent = new EnumMap<>(Component.class);
        for (AnomalyEvent event : events) {
            byComponent.computeIfAbsent(event.getComponent(), c -> new ArrayList<>()).add(event);
        }

        List<CascadeIncident> created = new ArrayList<>();
        for (AnomalyEvent head : byComponent.getOrDefault(CHAIN.get(0), List.of())) {
            if (used.contains(head.getId())) {
                continue;
            }

            List<AnomalyEvent> chain = new ArrayList<>();
            chain.add(head);
            if (!completeChain(chain, byComponent, maxLag, used)) {
                continue;
            }

            List<String> ids = chain.stream().map(AnomalyEvent::getId).toList();
            used.addAll(ids);

            String dedupeKey = IncidentKeys.cascadeKey(ids);
            CascadeIncident incident = CascadeIncident.builder()
                    .id(UUID.randomUUID().toString())
                    .dedupeKey(dedupeKey)
                    .pattern(IncidentPattern.CASCADE)
                    .startTime(head.getTimestamp())
                    .endTime(chain.get(chain.size() - 1).getTimestamp())
                    .links(toLinks(chain))
                    .confidence(cascadeConfidence(chain, maxLag))
                    .build();

            persist(incident, ids).ifPresent(created::add);
        }
        return created;
    }

    /**
     * Extends {@code chain} hop by hop, trying each unused candidate within the lag in time order
     * and backing out of hops that lead nowhere. Returns true with {@code chain} holding one event
     * per component; on false {@code chain} is left as it was passed in.
     */
    private boolean completeChain(List<AnomalyEvent> chain, Map<Component, List<AnomalyEvent>> byComponent,
                                  Duration maxLag, Set<String> used) {
        if (chain.size() == CHAIN.size()) {
            return true;
        }

        Instant earliest = chain.get(chain.size() - 1).getTimestamp();
        Instant latest = earliest.plus(maxLag);
        for (AnomalyEvent candidate : byComponent.getOrDefault(CHAIN.get(chain.size()), List.of())) {
            if (used.contains(candidate.getId())
                    || candidate.getTimestamp().isBefore(earliest)
                    || candidate.getTimestamp().isAfter(latest)) {
                continue;
            }
            chain.add(candidate);
            if (completeChain(chain, byComponent, maxLag, used)) {
                return true;
            }
            chain.remove(chain.size() - 1);
        }
        return false;
    }

    private List<CascadeIncident> detectResourceExhaustion(List<AnomalyEvent> events) {
        long bucketMillis = properties.getCorrelation().getExhaustionBucket().toMillis();
        int minMetrics = properties.getCorrelation().getMinExhaustionMetrics();

        // (component, bucket start) -> metric -> earliest event
        Map<Component, Map<Instant, Map<String, AnomalyEvent>>> grouped = new EnumMap<>(Component.class);
        for (AnomalyEvent event : events) {
            if (!event.getSeverity().isAtLeast(Severity.WARNING)) {
                continue;
            }
            long millis = event.getTimestamp().toEpochMilli();
            Instant bucketStart = Instant.ofEpochMilli(Math.floorDiv(millis, bucketMillis) * bucketMillis);
            grouped.computeIfAbsent(event.getComponent(), c -> new TreeMap<>())
                    .computeIfAbsent(bucketStart, b -> new LinkedHashMap<>())
                    .putIfAbsent(event.getMetricName(), event);
        }

        List<CascadeIncident> created = new ArrayList<>();
        grouped.forEach((component, buckets) -> buckets.forEach((bucketStart, byMetric) -> {
            if (byMetric.size() < minMetrics) {
                return;
            }

            List<AnomalyEvent> members = byMetric.values().stream()
                    .sorted(Comparator.comparing(AnomalyEvent::getTimestamp).thenComparing(AnomalyEvent::getId))
                    .toList();
            String dedupeKey = IncidentKeys.exhaustionKey(component, bucketStart);
            if (incidentRepository.existsByDedupeKey(dedupeKey)) {
                return;
            }

            CascadeIncident incident = CascadeIncident.builder()
                    .id(UUID.randomUUID().toString())
                    .dedupeKey(dedupeKey)
                    .pattern(IncidentPattern.RESOURCE_EXHAUSTION)
                    .startTime(members.get(0).getTimestamp())
                    .endTime(members.get(members.size() - 1).getTimestamp())
                    .links(toLinks(members))
                    .confidence(exhaustionConfidence(members, bucketMillis))
                    .build();

            persist(incident, members.stream().map(AnomalyEvent::getId).toList()).ifPresent(created::add);
        }));
        return created;
    }

    /**
     * Incident row, member rows and back-references commit together or not at all
     */
    private Optional<CascadeIncident> persist(CascadeIncident incident, List<String> eventIds) {
        if (incidentRepository.existsByDedupeKey(incident.getDedupeKey())) {
            return Optional.empty();
        }

        try {
            transactionOperations.executeWithoutResult(status -> {
                incidentRepository.save(incident);
                anomalyRepository.linkToIncident(eventIds, incident.getId());
            });
        } catch (DuplicateKeyException e) {
            log.debug("Incident {} already recorded by a concurrent pass", incident.getDedupeKey());
            meterRegistry.counter("correlation.incidents.duplicate",
                    "pattern", incident.getPattern().name()).increment();
            return Optional.empty();
        }

        meterRegistry.counter("correlation.incidents.created",
                "pattern", incident.getPattern().name()).increment();
        log.info("{} incident {} created: {} events from {} to {} (confidence {})",
                incident.getPatternLabel(), incident.getId(), eventIds.size(),
                incident.getStartTime(), incident.getEndTime(), incident.getConfidence());

        eventPublisher.publishEvent(new IncidentCreatedEvent(incident));
        return Optional.of(incident);
    }

    private List<IncidentLink> toLinks(List<AnomalyEvent> ordered) {
        List<IncidentLink> links = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            AnomalyEvent event = ordered.get(i);
            links.add(new IncidentLink(i, event.getComponent(), event.getId()));
        }
        return links;
    }

    private double cascadeConfidence(List<AnomalyEvent> chain, Duration maxLag) {
        long totalLag = 0;
        for (int i = 1; i < chain.size(); i++) {
            totalLag += Duration.between(chain.get(i - 1).getTimestamp(), chain.get(i).getTimestamp()).toMillis();
        }
        int hops = chain.size() - 1;
        double meanLag = (double) totalLag / hops;

        return ConfidenceScorer.score(
                ConfidenceScorer.lagTightness(meanLag, maxLag.toMillis()),
                hops, CHAIN_HOPS, criticalShare(chain));
    }

    private double exhaustionConfidence(List<AnomalyEvent> members, long bucketMillis) {
        long spread = Duration.between(members.get(0).getTimestamp(),
                members.get(members.size() - 1).getTimestamp()).toMillis();

        return ConfidenceScorer.score(
                ConfidenceScorer.lagTightness(spread, bucketMillis),
                0, CHAIN_HOPS, criticalShare(members));
    }

    private double criticalShare(List<AnomalyEvent> events) {
        long critical = events.stream().filter(e -> e.getSeverity() == Severity.CRITICAL).count();
        return events.isEmpty() ? 0.0 : (double) critical / events.size();
    }
}
