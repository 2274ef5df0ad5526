package com.company.anomaly.dto.response;

import com.company.anomaly.domain.AnomalyEvent;
import lombok.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyEventResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private Instant timestamp;
    private String component;
    private String metricName;
    private double observedValue;
    private String severity;
    private Double threshold;
    private String reason;
    private Integer durationEstimateMinutes;
    private boolean open;
    private Instant resolvedAt;
    private String cascadeIncidentId;
    private Map<String, String> tags;

    public static AnomalyEventResponse from(AnomalyEvent event) {
        return AnomalyEventResponse.builder()
                .id(event.getId())
                .timestamp(event.getTimestamp())
                .component(event.getComponent().getWireName())
                .metricName(event.getMetricName())
                .observedValue(event.getObservedValue())
                .severity(event.getSeverity().name())
                .threshold(event.getThreshold())
                .reason(event.getReason())
                .durationEstimateMinutes(event.getDurationEstimateMinutes())
                .open(event.isOpen())
                .resolvedAt(event.getResolvedAt())
                .cascadeIncidentId(event.getCascadeIncidentId())
                .tags(event.getTags())
                .build();
    }
}
