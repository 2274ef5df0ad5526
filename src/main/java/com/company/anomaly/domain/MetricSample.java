package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.Component;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One raw metric observation. Duplicates are legal and are evaluated independently.
 */
@Value
@Builder(toBuilder = true)
public class MetricSample {
    Instant timestamp;
    Component component;
    String metricName;
    double value;
    String unit;
    String host;
    String cluster;
    String environment;
    @Singular
    Map<String, String> tags;
}
