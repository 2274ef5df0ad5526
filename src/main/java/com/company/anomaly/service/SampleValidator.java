package com.company.anomaly.service;

import com.company.anomaly.domain.MetricSample;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.dto.request.MetricSampleRequest;
import com.company.anomaly.exception.InputErrorCode;
import com.company.anomaly.exception.InvalidSampleException;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Rejects malformed samples before they reach any store
 */
@Service
public class SampleValidator {

    public MetricSample toSample(MetricSampleRequest request) {
        if (request.getComponent() == null || request.getComponent().isBlank()) {
            throw new InvalidSampleException(InputErrorCode.MISSING_COMPONENT, "Component is required");
        }
        Component component = Component.fromString(request.getComponent())
                .orElseThrow(() -> new InvalidSampleException(InputErrorCode.UNKNOWN_COMPONENT,
                        "Unknown component: " + request.getComponent()));

        if (request.getValue() == null) {
            throw new InvalidSampleException(InputErrorCode.NON_FINITE_VALUE, "Value is required");
        }

        MetricSample sample = MetricSample.builder()
                .timestamp(request.getTimestamp())
                .component(component)
                .metricName(request.getMetricName())
                .value(request.getValue())
                .unit(request.getUnit())
                .host(request.getHost())
                .cluster(request.getCluster())
                .environment(request.getEnvironment())
                .tags(request.getTags() != null ? request.getTags() : Map.of())
                .build();

        validate(sample);
        return sample;
    }

    public void validate(MetricSample sample) {
        if (sample.getTimestamp() == null) {
            throw new InvalidSampleException(InputErrorCode.MISSING_TIMESTAMP, "Timestamp is required");
        }
        if (sample.getComponent() == null) {
            throw new InvalidSampleException(InputErrorCode.MISSING_COMPONENT, "Component is required");
        }
        if (sample.getMetricName() == null || sample.getMetricName().isBlank()) {
            throw new InvalidSampleException(InputErrorCode.MISSING_METRIC_NAME, "Metric name is required");
        }
        if (!Double.isFinite(sample.getValue())) {
            throw new InvalidSampleException(InputErrorCode.NON_FINITE_VALUE,
                    "Value must be finite, got " + sample.getValue());
        }
    }
}
