package com.company.anomaly.controller;

import com.company.anomaly.dto.request.ResolveAnomalyRequest;
import com.company.anomaly.dto.response.*;
import com.company.anomaly.service.HealthQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Health Queries", description = "Query component health, anomaly summaries, trends and incidents")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class HealthQueryController {

    private final HealthQueryService queryService;
    private final MeterRegistry meterRegistry;

    @GetMapping("/status")
    @Operation(summary = "Current health per component",
            description = "Open critical and warning anomalies in the last N minutes, most recently affected component first")
    @PreAuthorize("hasAnyRole('READER', 'OPERATOR', 'ADMIN')")
    public ResponseEntity<CurrentStatusResponse> currentStatus(
            @RequestParam(defaultValue = "15") @Min(1) @Max(1440) int lastMinutes) {

        meterRegistry.counter("api.status.requests").increment();

        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(5, TimeUnit.SECONDS).cachePrivate())
                .body(queryService.currentStatus(lastMinutes));
    }

    @GetMapping("/anomalies/summary")
    @Operation(summary = "Anomaly counts and mean resolution time per component and severity")
    @PreAuthorize("hasAnyRole('READER', 'OPERATOR', 'ADMIN')")
    public ResponseEntity<AnomalySummaryResponse> summary(
            @RequestParam(defaultValue = "24") @Min(1) @Max(24 * 90) int hours) {

        meterRegistry.counter("api.anomalies.summary.requests").increment();

        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(30, TimeUnit.SECONDS).cachePrivate())
                .body(queryService.summary(hours));
    }

    @PostMapping("/anomalies/{anomalyId}/resolve")
    @Operation(summary = "Resolve an anomaly", description = "Idempotent; an already resolved anomaly is returned unchanged")
    @PreAuthorize("hasAnyRole('OPERATOR', 'ADMIN')")
    public ResponseEntity<AnomalyEventResponse> resolve(
            @PathVariable String anomalyId,
            @RequestBody(required = false) ResolveAnomalyRequest request) {

        log.info("Resolve request for anomaly {}", anomalyId);

        Instant resolvedAt = request != null ? request.getResolvedAt() : null;
        return ResponseEntity.ok(queryService.resolve(anomalyId, resolvedAt));
    }

    @GetMapping("/metrics/{component}/{metricName}/trend")
    @Operation(summary = "Rolled-up trend of one metric",
            description = "Ordered buckets; the trailing bucket may still be provisional")
    @PreAuthorize("hasAnyRole('READER', 'OPERATOR', 'ADMIN')")
    public ResponseEntity<TrendResponse> trend(
            @PathVariable String component,
            @PathVariable String metricName,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @Parameter(description = "1m, 5m or 1h")
            @RequestParam(defaultValue = "5m") String granularity) {

        meterRegistry.counter("api.metrics.trend.requests",
                "granularity", granularity
        ).increment();

        return ResponseEntity.ok(queryService.trend(component, metricName, from, to, granularity));
    }

    @GetMapping("/metrics/recent")
    @Operation(summary = "Raw sample summary per metric over the last N minutes")
    @PreAuthorize("hasAnyRole('READER', 'OPERATOR', 'ADMIN')")
    public ResponseEntity<List<MetricSummaryResponse>> recentMetrics(
            @RequestParam(defaultValue = "5") @Min(1) @Max(1440) int lastMinutes) {

        return ResponseEntity.ok(queryService.recentMetrics(lastMinutes));
    }

    @GetMapping("/incidents")
    @Operation(summary = "Cross-component incidents overlapping a time range",
            description = "Each incident carries its ordered chain of anomaly events")
    @PreAuthorize("hasAnyRole('READER', 'OPERATOR', 'ADMIN')")
    public ResponseEntity<List<IncidentResponse>> incidents(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        meterRegistry.counter("api.incidents.requests").increment();

        return ResponseEntity.ok(queryService.crossComponentIncidents(from, to));
    }
}
