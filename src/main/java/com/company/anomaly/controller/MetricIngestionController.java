package com.company.anomaly.controller;

import com.company.anomaly.dto.request.BatchIngestRequest;
import com.company.anomaly.dto.request.MetricSampleRequest;
import com.company.anomaly.dto.response.AnomalyEventResponse;
import com.company.anomaly.dto.response.BatchIngestResponse;
import com.company.anomaly.dto.response.IngestResponse;
import com.company.anomaly.service.IngestResult;
import com.company.anomaly.service.MetricIngestionService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/samples")
@Tag(name = "Sample Ingestion", description = "APIs for metric collectors to push samples")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class MetricIngestionController {

    private final MetricIngestionService ingestionService;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Ingest one metric sample",
            description = "Stores the sample, evaluates it against the rule table and updates rollups")
    @PreAuthorize("hasAnyRole('COLLECTOR', 'ADMIN')")
    public ResponseEntity<IngestResponse> ingest(@Valid @RequestBody MetricSampleRequest request) {
        meterRegistry.counter("api.samples.requests",
                "component", String.valueOf(request.getComponent())
        ).increment();

        IngestResult result = ingestionService.ingest(request);

        return ResponseEntity.accepted().body(toIngestResponse(result));
    }

    @PostMapping("/batch")
    @Operation(summary = "Ingest a batch of samples",
            description = "Each sample is processed independently; rejected samples are reported per entry")
    @PreAuthorize("hasAnyRole('COLLECTOR', 'ADMIN')")
    public ResponseEntity<BatchIngestResponse> ingestBatch(@Valid @RequestBody BatchIngestRequest request) {
        log.debug("Batch ingest of {} samples", request.getSamples().size());

        meterRegistry.counter("api.samples.batch.requests").increment();

        List<IngestResponse> results = ingestionService.ingestAll(request.getSamples()).stream()
                .map(this::toIngestResponse)
                .collect(Collectors.toList());

        int accepted = (int) results.stream().filter(IngestResponse::isAccepted).count();
        int anomalies = (int) results.stream().filter(r -> r.getAnomaly() != null).count();

        return ResponseEntity.accepted().body(BatchIngestResponse.builder()
                .accepted(accepted)
                .rejected(results.size() - accepted)
                .anomalies(anomalies)
                .results(results)
                .build());
    }

    private IngestResponse toIngestResponse(IngestResult result) {
        if (!result.isAccepted()) {
            return IngestResponse.builder()
                    .accepted(false)
                    .errorCode(result.getErrorCode())
                    .errorMessage(result.getErrorMessage())
                    .build();
        }

        return IngestResponse.builder()
                .accepted(true)
                .component(result.getSample().getComponent().getWireName())
                .metricName(result.getSample().getMetricName())
                .timestamp(result.getSample().getTimestamp())
                .receivedAt(result.getReceivedAt())
                .anomaly(result.getAnomalyIfAny().map(AnomalyEventResponse::from).orElse(null))
                .rollupOutcome(result.getRollupOutcome().name())
                .evaluationFailed(result.isEvaluationFailed())
                .build();
    }
}
