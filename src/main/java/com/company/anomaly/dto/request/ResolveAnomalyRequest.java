package com.company.anomaly.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Manual resolution; a missing resolvedAt means now
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveAnomalyRequest {
    private Instant resolvedAt;
}
