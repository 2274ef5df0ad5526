package com.company.anomaly.service;

import com.company.anomaly.domain.RuleTable;
import com.company.anomaly.domain.RuleTier;
import com.company.anomaly.domain.enums.Comparison;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Severity;
import com.company.anomaly.exception.RuleTableLoadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses a versioned rule table document:
 * <pre>
 * { "version": "...", "tiers": [ { "component": "broker", "metric": "consumer_lag",
 *   "comparison": ">", "threshold": 100000, "severity": "critical", "reason": "..." } ] }
 * </pre>
 * Tier order in the document is the evaluation order.
 */
@org.springframework.stereotype.Component
@RequiredArgsConstructor
@Slf4j
public class RuleTableLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RuleTable load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RuleTableLoadException("Rule table not found: " + location);
        }

        try (InputStream in = resource.getInputStream()) {
            RuleTableDocument document = objectMapper.readValue(in, RuleTableDocument.class);
            return toRuleTable(document, location);
        } catch (IOException e) {
            throw new RuleTableLoadException("Failed to read rule table " + location, e);
        }
    }

    RuleTable toRuleTable(RuleTableDocument document, String source) {
        if (document.getVersion() == null || document.getVersion().isBlank()) {
            throw new RuleTableLoadException("Rule table " + source + " has no version");
        }
        if (document.getTiers() == null || document.getTiers().isEmpty()) {
            throw new RuleTableLoadException("Rule table " + source + " has no tiers");
        }

        List<RuleTier> tiers = new ArrayList<>();
        for (int i = 0; i < document.getTiers().size(); i++) {
            tiers.add(toTier(document.getTiers().get(i), i, source));
        }

        RuleTable table = new RuleTable(document.getVersion(), clock.instant(), tiers);
        warnOnShadowedTiers(table);
        return table;
    }

    private RuleTier toTier(TierDocument doc, int index, String source) {
        String where = source + " tier #" + index;
        try {
            Component component = Component.fromString(doc.getComponent())
                    .orElseThrow(() -> new RuleTableLoadException(
                            where + ": unknown component " + doc.getComponent()));
            if (doc.getMetric() == null || doc.getMetric().isBlank()) {
                throw new RuleTableLoadException(where + ": metric is required");
            }
            if (doc.getThreshold() == null || !Double.isFinite(doc.getThreshold())) {
                throw new RuleTableLoadException(where + ": finite threshold is required");
            }

            return RuleTier.builder()
                    .component(component)
                    .metricName(doc.getMetric().trim())
                    .comparison(Comparison.fromString(doc.getComparison()))
                    .threshold(doc.getThreshold())
                    .severity(Severity.fromString(doc.getSeverity()))
                    .reasonTemplate(doc.getReason())
                    .durationEstimateMinutes(doc.getDurationEstimateMinutes())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new RuleTableLoadException(where + ": " + e.getMessage(), e);
        }
    }

    /**
     * A less severe tier listed before a more severe one is reported, never reordered
     */
    private void warnOnShadowedTiers(RuleTable table) {
        for (Component component : Component.values()) {
            table.allTiers().stream()
                    .filter(t -> t.getComponent() == component)
                    .map(RuleTier::getMetricName)
                    .distinct()
                    .forEach(metric -> {
                        List<RuleTier> group = table.tiersFor(component, metric);
                        for (int i = 1; i < group.size(); i++) {
                            if (group.get(i).getSeverity().isHigherThan(group.get(i - 1).getSeverity())) {
                                log.warn("Rule table {}: {}/{} lists {} after {}; first match wins",
                                        table.getVersion(), component.getWireName(), metric,
                                        group.get(i).getSeverity(), group.get(i - 1).getSeverity());
                            }
                        }
                    });
        }
    }

    @Data
    @NoArgsConstructor
    public static class RuleTableDocument {
        private String version;
        private List<TierDocument> tiers;
    }

    @Data
    @NoArgsConstructor
    public static class TierDocument {
        private String component;
        private String metric;
        private String comparison;
        private Double threshold;
        private String severity;
        private String reason;
        private Integer durationEstimateMinutes;
    }
}
