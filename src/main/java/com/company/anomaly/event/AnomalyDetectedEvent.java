package com.company.anomaly.event;

import com.company.anomaly.domain.AnomalyEvent;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AnomalyDetectedEvent {
    private final AnomalyEvent anomaly;
    private final String ruleTableVersion;
}
