package com.company.anomaly.scheduled;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.repository.MetricSampleRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Daily partition upkeep for raw metric samples
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "anomaly.partitions.management.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class PartitionManagementJob {

    private final MetricSampleRepository sampleRepository;
    private final AnomalyProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Create upcoming partitions daily at 1 AM
     */
    @Scheduled(cron = "${anomaly.partitions.management.create-cron:0 0 1 * * *}")
    public void createPartitions() {
        int daysAhead = properties.getPartitions().getDaysAhead();
        log.info("Starting metric_samples partition creation ({} days ahead)", daysAhead);

        CompletableFuture.runAsync(() -> {
            try {
                int created = sampleRepository.createPartitions(daysAhead);

                log.info("Created {} metric_samples partitions", created);
                meterRegistry.counter("partitions.create.success").increment();
            } catch (Exception e) {
                log.error("Failed to create partitions", e);
                meterRegistry.counter("partitions.create.failures").increment();
            }
        });
    }

    /**
     * Drop raw sample partitions past retention daily at 2 AM
     */
    @Scheduled(cron = "${anomaly.partitions.management.drop-cron:0 0 2 * * *}")
    public void dropOldPartitions() {
        int retentionDays = properties.getPartitions().getRetentionDays();
        log.info("Starting metric_samples partition cleanup (retention {} days)", retentionDays);

        CompletableFuture.runAsync(() -> {
            try {
                int dropped = sampleRepository.dropPartitionsOlderThan(retentionDays);

                log.info("Dropped {} metric_samples partitions", dropped);
                meterRegistry.counter("partitions.drop.success").increment();
            } catch (Exception e) {
                log.error("Failed to drop old partitions", e);
                meterRegistry.counter("partitions.drop.failures").increment();
            }
        });
    }

    @Scheduled(cron = "${anomaly.partitions.monitoring.cron:0 0 6 * * *}")
    public void monitorPartitionHealth() {
        try {
            List<Map<String, Object>> stats = sampleRepository.partitionStatistics();

            long totalRows = 0;
            for (Map<String, Object> stat : stats) {
                long rowCount = ((Number) stat.get("row_count")).longValue();
                totalRows += rowCount;

                log.debug("Partition {}: {} rows, size: {}",
                        stat.get("partition_name"), rowCount, stat.get("total_size"));
            }

            log.info("Partition health: {} partitions, {} total rows", stats.size(), totalRows);

        } catch (Exception e) {
            log.error("Failed to monitor partition health", e);
            meterRegistry.counter("partitions.monitoring.failures").increment();
        }
    }
}
