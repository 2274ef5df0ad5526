package com.company.anomaly.dto.response;

import lombok.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private String component;
    private String metricName;
    private String granularity;
    private Instant from;
    private Instant to;
    private List<TrendPoint> buckets;
    private boolean latestProvisional;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TrendPoint implements Serializable {
        private static final long serialVersionUID = 1L;

        private Instant bucketStart;
        private Instant bucketEnd;
        private double avg;
        private double min;
        private double max;
        private double stddev;
        private long sampleCount;
        private boolean provisional;
    }
}
