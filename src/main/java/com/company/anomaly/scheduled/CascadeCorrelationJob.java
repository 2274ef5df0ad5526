package com.company.anomaly.scheduled;

import com.company.anomaly.config.AnomalyProperties;
import com.company.anomaly.domain.CascadeIncident;
import com.company.anomaly.service.CascadeCorrelator;
import com.company.anomaly.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * CORRELATION PASS (every 60 seconds by default)
 * Runs the correlator over the trailing window. After failed passes the window is
 * widened back to the last covered instant, bounded by the catch-up cap.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "anomaly.correlation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class CascadeCorrelationJob {

    private final CascadeCorrelator correlator;
    private final AnomalyProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // End of the last window that was fully correlated
    private volatile Instant coveredUntil;

    @Scheduled(
            fixedDelayString = "${anomaly.correlation.interval-ms:60000}",
            initialDelayString = "${anomaly.correlation.initial-delay-ms:30000}"
    )
    public void runCorrelationPass() {
        Instant windowEnd = clock.instant();
        Instant windowStart = windowStart(windowEnd);
        Timer.Sample timer = Timer.start(meterRegistry);

        try {
            List<CascadeIncident> created = correlator.correlate(windowStart, windowEnd);
            coveredUntil = windowEnd;

            if (created.isEmpty()) {
                log.debug("Correlation pass [{}, {}]: no new incidents", windowStart, windowEnd);
            } else {
                log.info("Correlation pass [{}, {}]: {} new incidents", windowStart, windowEnd, created.size());
            }
            meterRegistry.counter("correlation.passes").increment();

        } catch (Exception e) {
            log.error("Correlation pass over [{}, {}] failed", windowStart, windowEnd, e);
            meterRegistry.counter("correlation.pass.failures").increment();

            if (coveredUntil == null) {
                // Nothing covered yet: make the next pass start no later than this one
                coveredUntil = windowStart.plus(properties.getCorrelation().getMaxLag());
            }
        } finally {
            timer.stop(meterRegistry.timer("correlation.pass.duration"));
        }
    }

    Instant windowStart(Instant windowEnd) {
        Instant trailing = windowEnd.minus(properties.getCorrelation().getWindow());
        if (coveredUntil == null) {
            return trailing;
        }

        Duration maxLag = properties.getCorrelation().getMaxLag();
        Instant catchUpFloor = windowEnd.minus(properties.getCorrelation().getMaxCatchUp());
        Instant resumeFrom = TimeUtils.max(coveredUntil.minus(maxLag), catchUpFloor);
        return TimeUtils.min(trailing, resumeFrom);
    }
}
