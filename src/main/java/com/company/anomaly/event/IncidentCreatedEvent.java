package com.company.anomaly.event;

import com.company.anomaly.domain.CascadeIncident;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class IncidentCreatedEvent {
    private final CascadeIncident incident;
}
