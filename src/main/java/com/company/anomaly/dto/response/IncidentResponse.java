package com.company.anomaly.dto.response;

import lombok.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private String pattern;
    private Instant startTime;
    private Instant endTime;
    private double confidence;
    private Instant createdAt;
    // Ordered as linked: upstream first for cascades
    private List<AnomalyEventResponse> chain;
}
