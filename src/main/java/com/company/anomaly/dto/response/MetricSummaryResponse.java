package com.company.anomaly.dto.response;

import lombok.*;

import java.io.Serializable;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSummaryResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private String component;
    private String metricName;
    private double avgValue;
    private double minValue;
    private double maxValue;
    private long sampleCount;
    private Instant lastUpdate;
}
