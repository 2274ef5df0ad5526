package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.Comparison;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Severity;
import lombok.Builder;
import lombok.Value;

/**
 * One threshold rule with an associated severity.
 */
@Value
@Builder
public class RuleTier {
    Component component;
    String metricName;
    Comparison comparison;
    double threshold;
    Severity severity;
    String reasonTemplate;
    // Optional: expected minutes until the condition clears, copied onto the event
    Integer durationEstimateMinutes;

    public boolean matches(double value) {
        return comparison.holds(value, threshold);
    }

    /**
     * Placeholders: {value}, {threshold}, {metric}, {component}, {host}
     */
    public String renderReason(MetricSample sample) {
        String template = reasonTemplate != null
                ? reasonTemplate
                : "{metric} " + comparison.getSymbol() + " {threshold}";
        return template
                .replace("{value}", formatNumber(sample.getValue()))
                .replace("{threshold}", formatNumber(threshold))
                .replace("{metric}", metricName)
                .replace("{component}", component.getWireName())
                .replace("{host}", sample.getHost() != null ? sample.getHost() : "unknown");
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
