package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.Component;
import lombok.Getter;

import java.time.Instant;
import java.util.*;

/**
 * Immutable (component, metric) → ordered tiers mapping.
 * Tiers keep their authoring order; the first matching tier wins, so every
 * group must be authored most-severe-first.
 */
public final class RuleTable {

    public static final RuleTable EMPTY = new RuleTable("empty", Instant.EPOCH, List.of());

    @Getter
    private final String version;
    @Getter
    private final Instant loadedAt;
    private final Map<Component, Map<String, List<RuleTier>>> tiers;
    private final int size;

    public RuleTable(String version, Instant loadedAt, List<RuleTier> orderedTiers) {
        this.version = version;
        this.loadedAt = loadedAt;

        Map<Component, Map<String, List<RuleTier>>> grouped = new EnumMap<>(Component.class);
        for (RuleTier tier : orderedTiers) {
            grouped.computeIfAbsent(tier.getComponent(), c -> new LinkedHashMap<>())
                    .computeIfAbsent(tier.getMetricName(), m -> new ArrayList<>())
                    .add(tier);
        }

        Map<Component, Map<String, List<RuleTier>>> frozen = new EnumMap<>(Component.class);
        grouped.forEach((component, byMetric) -> {
            Map<String, List<RuleTier>> metrics = new LinkedHashMap<>();
            byMetric.forEach((metric, list) -> metrics.put(metric, List.copyOf(list)));
            frozen.put(component, Collections.unmodifiableMap(metrics));
        });

        this.tiers = Collections.unmodifiableMap(frozen);
        this.size = orderedTiers.size();
    }

    public List<RuleTier> tiersFor(Component component, String metricName) {
        if (component == null || metricName == null) {
            return List.of();
        }
        return tiers.getOrDefault(component, Map.of()).getOrDefault(metricName, List.of());
    }

    /**
     * First tier, in definition order, whose comparison holds for the sample value
     */
    public Optional<RuleTier> firstMatch(MetricSample sample) {
        for (RuleTier tier : tiersFor(sample.getComponent(), sample.getMetricName())) {
            if (tier.matches(sample.getValue())) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    public List<RuleTier> allTiers() {
        List<RuleTier> all = new ArrayList<>(size);
        tiers.values().forEach(byMetric -> byMetric.values().forEach(all::addAll));
        return all;
    }

    public int size() {
        return size;
    }
}
