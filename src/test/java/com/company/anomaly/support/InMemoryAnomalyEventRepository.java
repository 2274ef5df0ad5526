package com.company.anomaly.support;

import com.company.anomaly.domain.AnomalyCount;
import com.company.anomaly.domain.AnomalyCriteria;
import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Severity;
import com.company.anomaly.repository.AnomalyEventRepository;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Anomaly store backed by a map; the hourly rollup is derived from the stored events
 */
public class InMemoryAnomalyEventRepository implements AnomalyEventRepository {

    private final Map<String, AnomalyEvent> events = new LinkedHashMap<>();
    public final AtomicInteger hourlyQueries = new AtomicInteger();
    public final AtomicInteger rawQueries = new AtomicInteger();

    @Override
    public synchronized AnomalyEvent append(AnomalyEvent event) {
        if (event.getId() == null) {
            event.setId(UUID.randomUUID().toString());
        }
        if (event.getCreatedAt() == null) {
            event.setCreatedAt(Instant.now());
        }
        events.put(event.getId(), copy(event));
        return event;
    }

    @Override
    public synchronized Optional<AnomalyEvent> findById(String id) {
        return Optional.ofNullable(events.get(id)).map(this::copy);
    }

    @Override
    public synchronized List<AnomalyEvent> findByIds(Collection<String> ids) {
        return ids.stream().map(events::get).filter(Objects::nonNull).map(this::copy).collect(Collectors.toList());
    }

    @Override
    public synchronized List<AnomalyEvent> find(AnomalyCriteria criteria) {
        Predicate<AnomalyEvent> filter = e -> true;
        if (criteria.getFrom() != null) filter = filter.and(e -> !e.getTimestamp().isBefore(criteria.getFrom()));
        if (criteria.getTo() != null) filter = filter.and(e -> !e.getTimestamp().isAfter(criteria.getTo()));
        if (criteria.getComponent() != null) filter = filter.and(e -> e.getComponent() == criteria.getComponent());
        if (criteria.getSeverity() != null) filter = filter.and(e -> e.getSeverity() == criteria.getSeverity());
        if (criteria.isOpenOnly()) filter = filter.and(AnomalyEvent::isOpen);

        return events.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(AnomalyEvent::getTimestamp).reversed())
                .limit(criteria.getLimit())
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<AnomalyEvent> findBetween(Instant from, Instant to) {
        return events.values().stream()
                .filter(e -> !e.getTimestamp().isBefore(from) && !e.getTimestamp().isAfter(to))
                .sorted(Comparator.comparing(AnomalyEvent::getTimestamp).thenComparing(AnomalyEvent::getId))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<AnomalyEvent> findOpenOlderThan(Severity severity, Instant cutoff, int limit) {
        return events.values().stream()
                .filter(AnomalyEvent::isOpen)
                .filter(e -> e.getSeverity() == severity && e.getTimestamp().isBefore(cutoff))
                .sorted(Comparator.comparing(AnomalyEvent::getTimestamp))
                .limit(limit)
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean resolve(String id, Instant resolvedAt) {
        AnomalyEvent event = events.get(id);
        if (event == null || !event.isOpen()) {
            return false;
        }
        event.setResolvedAt(resolvedAt);
        return true;
    }

    @Override
    public synchronized int linkToIncident(Collection<String> eventIds, String incidentId) {
        int linked = 0;
        for (String id : eventIds) {
            AnomalyEvent event = events.get(id);
            if (event != null && event.getCascadeIncidentId() == null) {
                event.setCascadeIncidentId(incidentId);
                linked++;
            }
        }
        return linked;
    }

    @Override
    public synchronized List<AnomalyCount> summarize(Instant from, Instant to) {
        rawQueries.incrementAndGet();
        return count(e -> !e.getTimestamp().isBefore(from) && e.getTimestamp().isBefore(to));
    }

    @Override
    public synchronized List<AnomalyCount> summarizeHourly(Instant fromHour, Instant toHour) {
        hourlyQueries.incrementAndGet();
        return count(e -> {
            Instant hour = e.getTimestamp().truncatedTo(ChronoUnit.HOURS);
            return !hour.isBefore(fromHour) && hour.isBefore(toHour);
        });
    }

    public synchronized List<AnomalyEvent> all() {
        return events.values().stream().map(this::copy).collect(Collectors.toList());
    }

    private List<AnomalyCount> count(Predicate<AnomalyEvent> filter) {
        Map<String, AnomalyCount> counts = new TreeMap<>();
        for (AnomalyEvent event : events.values()) {
            if (!filter.test(event)) {
                continue;
            }
            boolean resolved = event.getResolvedAt() != null;
            double seconds = resolved
                    ? Duration.between(event.getTimestamp(), event.getResolvedAt()).toMillis() / 1000.0
                    : 0.0;
            AnomalyCount single = new AnomalyCount(event.getComponent(), event.getSeverity(),
                    1, resolved ? 1 : 0, seconds);
            counts.merge(key(event.getComponent(), event.getSeverity()), single, AnomalyCount::plus);
        }
        return new ArrayList<>(counts.values());
    }

    private static String key(Component component, Severity severity) {
        return component.name() + "|" + severity.name();
    }

    private AnomalyEvent copy(AnomalyEvent e) {
        return AnomalyEvent.builder()
                .id(e.getId())
                .timestamp(e.getTimestamp())
                .component(e.getComponent())
                .metricName(e.getMetricName())
                .observedValue(e.getObservedValue())
                .severity(e.getSeverity())
                .threshold(e.getThreshold())
                .reason(e.getReason())
                .durationEstimateMinutes(e.getDurationEstimateMinutes())
                .resolvedAt(e.getResolvedAt())
                .cascadeIncidentId(e.getCascadeIncidentId())
                .tags(e.getTags())
                .createdAt(e.getCreatedAt())
                .build();
    }
}
