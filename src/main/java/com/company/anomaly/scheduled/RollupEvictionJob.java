package com.company.anomaly.scheduled;

import com.company.anomaly.service.RollupEngine;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Releases in-memory rollup buckets that can no longer change
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RollupEvictionJob {

    private final RollupEngine rollupEngine;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${anomaly.rollup.eviction-interval-ms:60000}",
            initialDelayString = "${anomaly.rollup.eviction-initial-delay-ms:60000}"
    )
    public void evictClosedBuckets() {
        try {
            int evicted = rollupEngine.evictExpired(clock.instant());
            if (evicted > 0) {
                log.debug("Evicted {} closed rollup buckets, {} still live",
                        evicted, rollupEngine.liveBucketCount());
                meterRegistry.counter("rollup.buckets.evicted").increment(evicted);
            }
        } catch (Exception e) {
            log.error("Rollup bucket eviction failed", e);
            meterRegistry.counter("rollup.eviction.failures").increment();
        }
    }
}
