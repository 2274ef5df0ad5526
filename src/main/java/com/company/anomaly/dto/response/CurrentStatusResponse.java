package com.company.anomaly.dto.response;

import lombok.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentStatusResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private Instant generatedAt;
    private int windowMinutes;
    private String overallStatus;
    // Most recently anomalous component first
    private List<ComponentStatusResponse> components;
}
