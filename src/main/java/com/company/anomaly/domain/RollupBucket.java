package com.company.anomaly.domain;

import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Granularity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Aggregate of the samples with timestamp in [bucketStart, bucketStart + granularity)
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RollupBucket {
    private Instant bucketStart;
    private Granularity granularity;
    private Component component;
    private String metricName;

    private double avg;
    private double min;
    private double max;
    private double stddev;
    // Sum of squared deviations from the mean; kept so merges can resume after reload
    private double m2;
    private long sampleCount;

    private Instant provisionalUntil;
    private Instant updatedAt;

    public Instant getBucketEnd() {
        return granularity.bucketEnd(bucketStart);
    }

    public boolean isProvisional(Instant now) {
        return provisionalUntil == null || now.isBefore(provisionalUntil);
    }
}
