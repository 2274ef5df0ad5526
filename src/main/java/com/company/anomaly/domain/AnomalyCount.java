package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per (component, severity) anomaly tally over some window.
 * Mergeable so rollup hours and raw-scanned fragments can be combined.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyCount {
    private Component component;
    private Severity severity;
    private long anomalyCount;
    private long resolvedCount;
    private double totalResolutionSeconds;

    public AnomalyCount plus(AnomalyCount other) {
        return new AnomalyCount(component, severity,
                anomalyCount + other.anomalyCount,
                resolvedCount + other.resolvedCount,
                totalResolutionSeconds + other.totalResolutionSeconds);
    }

    public Double meanResolutionSeconds() {
        return resolvedCount > 0 ? totalResolutionSeconds / resolvedCount : null;
    }
}
