package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Classified anomaly. Only resolvedAt and cascadeIncidentId change after creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyEvent {
    private String id;

    // Sample timestamp, not evaluation time
    private Instant timestamp;

    private Component component;
    private String metricName;
    private double observedValue;
    private Severity severity;
    private Double threshold;
    private String reason;
    private Integer durationEstimateMinutes;

    private Instant resolvedAt;
    private String cascadeIncidentId;

    private Map<String, String> tags;
    private Instant createdAt;

    public boolean isOpen() {
        return resolvedAt == null;
    }

    /**
     * Identity of the trigger independent of the row id; at-least-once appends
     * can produce several rows with the same logical key.
     */
    public String logicalKey() {
        return component + "|" + metricName + "|" + timestamp.toEpochMilli()
                + "|" + observedValue + "|" + severity;
    }
}
