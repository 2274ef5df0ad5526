package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.IncidentPattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Correlated cluster of anomalies. Created only by the correlator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CascadeIncident {
    private String id;
    private String dedupeKey;
    private IncidentPattern pattern;
    private Instant startTime;
    private Instant endTime;
    private List<IncidentLink> links;
    private double confidence;
    private Instant createdAt;

    public String getPatternLabel() {
        return pattern != null ? pattern.getLabel() : null;
    }

    public boolean overlaps(Instant from, Instant to) {
        return !startTime.isAfter(to) && !endTime.isBefore(from);
    }
}
