package com.company.anomaly.service;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.MetricSample;
import com.company.anomaly.domain.RollupBucket;
import com.company.anomaly.domain.enums.Component;
import com.company.anomaly.domain.enums.Granularity;
import com.company.anomaly.repository.RollupBucketRepository;
import com.company.anomaly.util.RunningStats;
import com.company.anomaly.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Incrementally maintained time-bucketed aggregates.
 * <p>
 * Merges into one bucket are serialized on that bucket's monitor. A sample touches one
 * bucket per granularity; the monitors are always taken in granularity order and all
 * rows are written in one transaction, so a sample is either merged at every
 * granularity still accepting it or at none.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RollupEngine {

    private final RollupBucketRepository rollupRepository;
    private final TransactionOperations transactionOperations;
    private final AnomalyProperties properties;
    private final MeterRegistry meterRegistry;

    private final Map<BucketKey, LiveBucket> liveBuckets = new ConcurrentHashMap<>();

    /**
     * Merges the sample into every configured granularity whose bucket still accepts it, that is
     * where {@code receivedAt} is no later than bucket end plus the maximum lateness. A sample too
     * late for the finest bucket may still land in a coarser one.
     */
    public RollupOutcome ingest(MetricSample sample, Instant receivedAt) {
        while (true) {
            List<LiveBucket> targets = acquireTargets(sample, receivedAt);
            if (targets.isEmpty()) {
                log.debug("Sample {}/{} at {} arrived {} late, skipping rollups",
                        sample.getComponent().getWireName(), sample.getMetricName(),
                        sample.getTimestamp(), Duration.between(sample.getTimestamp(), receivedAt));
                meterRegistry.counter("rollup.samples.late",
                        "component", sample.getComponent().getWireName()).increment();
                return RollupOutcome.SKIPPED_LATE;
            }
            if (mergeAll(targets, sample, receivedAt)) {
                return RollupOutcome.MERGED;
            }
            // A target was evicted between lookup and lock; look up again
        }
    }

    private List<LiveBucket> acquireTargets(MetricSample sample, Instant receivedAt) {
        Duration maxLateness = properties.getRollup().getMaxLateness();
        List<LiveBucket> targets = new ArrayList<>();
        for (Granularity granularity : properties.getRollup().getGranularities().stream().sorted().toList()) {
            Instant bucketStart = granularity.bucketStart(sample.getTimestamp());
            if (receivedAt.isAfter(granularity.bucketEnd(bucketStart).plus(maxLateness))) {
                meterRegistry.counter("rollup.granularity.late",
                        "granularity", granularity.getLabel()).increment();
                continue;
            }
            BucketKey key = new BucketKey(granularity, sample.getComponent(), sample.getMetricName(), bucketStart);
            targets.add(liveBuckets.computeIfAbsent(key, this::loadBucket));
        }
        return targets;
    }

    private boolean mergeAll(List<LiveBucket> targets, MetricSample sample, Instant receivedAt) {
        return lockAndMerge(targets, 0, sample, receivedAt);
    }

    // Nested monitors, taken in granularity order
    private boolean lockAndMerge(List<LiveBucket> targets, int index, MetricSample sample, Instant receivedAt) {
        if (index == targets.size()) {
            return commit(targets, sample, receivedAt);
        }
        LiveBucket bucket = targets.get(index);
        synchronized (bucket) {
            if (bucket.evicted) {
                return false;
            }
            return lockAndMerge(targets, index + 1, sample, receivedAt);
        }
    }

    private boolean commit(List<LiveBucket> targets, MetricSample sample, Instant receivedAt) {
        Duration grace = properties.getRollup().getGrace();
        List<RunningStats> nextStats = new ArrayList<>(targets.size());
        List<RollupBucket> rows = new ArrayList<>(targets.size());

        for (LiveBucket bucket : targets) {
            RunningStats next = bucket.stats.copy();
            next.add(sample.getValue());

            Instant provisionalUntil = bucket.provisionalUntil;
            if (!receivedAt.isBefore(provisionalUntil)) {
                // Revision of a closed bucket reopens it for another grace period
                provisionalUntil = receivedAt.plus(grace);
                log.debug("Late sample reopened {} bucket {} for {}/{}",
                        bucket.key.granularity.getLabel(), bucket.key.bucketStart,
                        bucket.key.component.getWireName(), bucket.key.metricName);
            }

            nextStats.add(next);
            rows.add(toRow(bucket.key, next, provisionalUntil, receivedAt));
        }

        transactionOperations.executeWithoutResult(status -> rows.forEach(rollupRepository::upsert));

        for (int i = 0; i < targets.size(); i++) {
            LiveBucket bucket = targets.get(i);
            bucket.stats = nextStats.get(i);
            bucket.provisionalUntil = rows.get(i).getProvisionalUntil();
        }
        return true;
    }

    private LiveBucket loadBucket(BucketKey key) {
        Instant defaultProvisionalUntil = key.granularity.bucketEnd(key.bucketStart)
                .plus(properties.getRollup().getGrace());

        return rollupRepository.find(key.granularity, key.component, key.metricName, key.bucketStart)
                .map(stored -> new LiveBucket(key,
                        RunningStats.resume(stored.getSampleCount(), stored.getAvg(), stored.getM2(),
                                stored.getMin(), stored.getMax()),
                        TimeUtils.max(stored.getProvisionalUntil(), defaultProvisionalUntil)))
                .orElseGet(() -> new LiveBucket(key, new RunningStats(), defaultProvisionalUntil));
    }

    private RollupBucket toRow(BucketKey key, RunningStats stats, Instant provisionalUntil, Instant updatedAt) {
        return RollupBucket.builder()
                .granularity(key.granularity)
                .bucketStart(key.bucketStart)
                .component(key.component)
                .metricName(key.metricName)
                .avg(stats.getMean())
                .min(stats.getMin())
                .max(stats.getMax())
                .stddev(stats.stddev())
                .m2(stats.getM2())
                .sampleCount(stats.getCount())
                .provisionalUntil(provisionalUntil)
                .updatedAt(updatedAt)
                .build();
    }

    /**
     * Drops in-memory buckets that can no longer receive samples: past bucket end plus
     * the maximum lateness, and no longer provisional. Their rows stay in the store.
     *
     * @return number of buckets evicted
     */
    public int evictExpired(Instant now) {
        Duration maxLateness = properties.getRollup().getMaxLateness();
        int evicted = 0;

        for (LiveBucket bucket : liveBuckets.values()) {
            Instant acceptsUntil = bucket.key.granularity.bucketEnd(bucket.key.bucketStart).plus(maxLateness);
            synchronized (bucket) {
                if (now.isAfter(acceptsUntil) && !now.isBefore(bucket.provisionalUntil)) {
                    bucket.evicted = true;
                    liveBuckets.remove(bucket.key, bucket);
                    evicted++;
                }
            }
        }
        return evicted;
    }

    public int liveBucketCount() {
        return liveBuckets.size();
    }

    @Value
    static class BucketKey {
        Granularity granularity;
        Component component;
        String metricName;
        Instant bucketStart;
    }

    private static final class LiveBucket {
        private final BucketKey key;
        private RunningStats stats;
        private Instant provisionalUntil;
        private boolean evicted;

        private LiveBucket(BucketKey key, RunningStats stats, Instant provisionalUntil) {
            this.key = key;
            this.stats = stats;
            this.provisionalUntil = provisionalUntil;
        }
    }
}
