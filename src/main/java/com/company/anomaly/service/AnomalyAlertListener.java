package com.company.anomaly.service;

import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.CascadeIncident;
import com.company.anomaly.domain.IncidentLink;
import com.company.anomaly.domain.enums.Severity;
import com.company.anomaly.event.AnomalyDetectedEvent;
import com.company.anomaly.event.IncidentCreatedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.stream.Collectors;

/**
 * Surfaces critical anomalies and new incidents in the service log
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyAlertListener {

    private final MeterRegistry meterRegistry;

    @EventListener
    @Async
    public void onAnomalyDetected(AnomalyDetectedEvent event) {
        AnomalyEvent anomaly = event.getAnomaly();

        if (anomaly.getSeverity() != Severity.CRITICAL) {
            log.debug("Warning anomaly {} on {}/{}: {}", anomaly.getId(),
                    anomaly.getComponent().getWireName(), anomaly.getMetricName(), anomaly.getReason());
            return;
        }

        log.warn("CRITICAL anomaly {} on {}/{} = {} at {}: {} (rules {})",
                anomaly.getId(),
                anomaly.getComponent().getWireName(),
                anomaly.getMetricName(),
                anomaly.getObservedValue(),
                anomaly.getTimestamp(),
                anomaly.getReason(),
                event.getRuleTableVersion());

        meterRegistry.counter("anomaly.alerts.critical",
                "component", anomaly.getComponent().getWireName(),
                "metric", anomaly.getMetricName()
        ).increment();
    }

    @EventListener
    @Async
    public void onIncidentCreated(IncidentCreatedEvent event) {
        CascadeIncident incident = event.getIncident();

        String chain = incident.getLinks().stream()
                .map(IncidentLink::getComponent)
                .map(component -> component.getWireName())
                .collect(Collectors.joining(" -> "));

        log.warn("INCIDENT {} [{}] {} from {} to {}, confidence {}",
                incident.getId(),
                incident.getPatternLabel(),
                chain,
                incident.getStartTime(),
                incident.getEndTime(),
                incident.getConfidence());
    }
}
