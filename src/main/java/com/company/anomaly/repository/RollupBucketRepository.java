package com.company.anomaly.repository;

import com.company.anomaly.domain.RollupBucket;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Granularity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RollupBucketRepository {

    /**
     * Insert or overwrite the bucket identified by (granularity, component, metric, bucketStart)
     */
    void upsert(RollupBucket bucket);

    Optional<RollupBucket> find(Granularity granularity, Component component, String metricName, Instant bucketStart);

    /**
     * Buckets with bucketStart in [from, to), ascending
     */
    List<RollupBucket> findRange(Granularity granularity, Component component, String metricName,
                                 Instant from, Instant to);
}
