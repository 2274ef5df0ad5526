package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.Component;
import lombok.Value;

@Value
public class IncidentLink {
    int position;
    Component component;
    String eventId;
}
