package com.company.anomaly.dto.response;

import lombok.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Anomaly counts per (component, severity). Closed whole hours listed in
 * {@code rollupHours} were read from the hourly rollup; the rest from raw events.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalySummaryResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private Instant from;
    private Instant to;
    private List<Instant> rollupHours;
    private List<SeverityCount> counts;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SeverityCount implements Serializable {
        private static final long serialVersionUID = 1L;

        private String component;
        private String severity;
        private long anomalyCount;
        private long resolvedCount;
        private Double meanResolutionSeconds;
        private String meanResolutionFormatted;
    }
}
