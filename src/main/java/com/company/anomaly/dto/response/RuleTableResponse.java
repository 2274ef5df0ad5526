package com.company.anomaly.dto.response;

import lombok.*;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleTableResponse {
    private String version;
    private Instant loadedAt;
    private int tierCount;
    private List<TierInfo> tiers;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierInfo {
        private String component;
        private String metricName;
        private String comparison;
        private double threshold;
        private String severity;
        private String reasonTemplate;
        private Integer durationEstimateMinutes;
    }
}
