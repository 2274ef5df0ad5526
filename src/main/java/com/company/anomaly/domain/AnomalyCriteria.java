package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Anomaly store filter; null fields are not applied
 */
@Value
@Builder
public class AnomalyCriteria {
    Instant from;
    Instant to;
    Component component;
    Severity severity;
    boolean openOnly;
    @Builder.Default
    int limit = 500;
}
