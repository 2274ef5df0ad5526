package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.Component;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSummary {
    private Component component;
    private String metricName;
    private double avgValue;
    private double minValue;
    private double maxValue;
    private long sampleCount;
    private Instant lastUpdate;
}
