package com.company.anomaly.dto.response;

import lombok.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Health of one component over the status window
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentStatusResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private String component;
    private String description;
    private long openCritical;
    private long openWarning;
    private Instant latestAnomaly;
    private List<AnomalyEventResponse> recentOpen;
}
