package com.company.anomaly.repository;

import com.company.anomaly.domain.MetricSample;
import com.company.anomaly.domain.MetricSummary;
import com.company.anomaly.domain.enums.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only raw sample storage, partitioned by arrival time
 */
public interface MetricSampleRepository {

    void append(MetricSample sample, Instant receivedAt);

    List<MetricSample> findRange(Component component, String metricName, Instant from, Instant to);

    /**
     * Samples whose timestamp lies in the last N minutes, newest first.
     * A null component means all components.
     */
    List<MetricSample> findRecent(int lastMinutes, Component component, int limit);

    List<MetricSummary> summarizeRecent(int lastMinutes);

    /**
     * Creates daily partitions from today up to daysAhead days out
     *
     * @return number of partitions created
     */
    int createPartitions(int daysAhead);

    /**
     * @return number of partitions dropped
     */
    int dropPartitionsOlderThan(int retentionDays);

    /**
     * One row per partition: partition_name, row_count, total_size
     */
    List<Map<String, Object>> partitionStatistics();
}
