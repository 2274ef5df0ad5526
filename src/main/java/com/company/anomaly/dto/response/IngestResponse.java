package com.company.anomaly.dto.response;

import lombok.*;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {
    private boolean accepted;
    private String component;
    private String metricName;
    private Instant timestamp;
    private Instant receivedAt;
    private AnomalyEventResponse anomaly;
    private String rollupOutcome;
    private boolean evaluationFailed;

    // Only set for rejected batch entries
    private String errorCode;
    private String errorMessage;
}
