package com.company.anomaly.service;

import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.MetricSample;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of ingesting one sample. Rejected samples carry an error code and nothing else.
 */
@Value
@Builder
public class IngestResult {
    boolean accepted;
    MetricSample sample;
    Instant receivedAt;
    AnomalyEvent anomaly;
    RollupOutcome rollupOutcome;
    boolean evaluationFailed;
    String errorCode;
    String errorMessage;

    public Optional<AnomalyEvent> getAnomalyIfAny() {
        return Optional.ofNullable(anomaly);
    }

    public static IngestResult rejected(String errorCode, String errorMessage) {
        return IngestResult.builder()
                .accepted(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }
}
