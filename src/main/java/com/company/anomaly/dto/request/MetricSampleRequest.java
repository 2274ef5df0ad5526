package com.company.anomaly.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One metric sample as pushed by a collector
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSampleRequest {
    @NotNull(message = "Timestamp is required")
    private Instant timestamp;

    @NotBlank(message = "Component is required (broker, stream-processor or analytics-store)")
    private String component;

    @NotBlank(message = "Metric name is required")
    private String metricName;

    @NotNull(message = "Value is required")
    private Double value;

    // Optional fields
    private String unit;
    private String host;
    private String cluster;
    private String environment;
    private Map<String, String> tags;
}
