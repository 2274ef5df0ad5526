package com.company.anomaly.service;

import com.company.anomaly.domain.AnomalyEvent;
import com.company.anomaly.domain.MetricSample;
import com.company.anomaly.dto.request.MetricSampleRequest;
import com.company.anomaly.exception.InvalidSampleException;
import com.company.anomaly.exception.StorageWriteException;
import com.company.anomaly.repository.MetricSampleRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Single write entry point. Each accepted sample is stored raw, then evaluated and
 * rolled up on separate executors.
 * <p>
 * Evaluation is best-effort: a failure is logged and counted but the sample stays
 * accepted. A rollup failure is reported to the caller.
 */
@Service
@Slf4j
public class MetricIngestionService {

    private final SampleValidator sampleValidator;
    private final MetricSampleRepository sampleRepository;
    private final RuleEvaluator ruleEvaluator;
    private final RollupEngine rollupEngine;
    private final Executor evaluationExecutor;
    private final Executor rollupExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public MetricIngestionService(SampleValidator sampleValidator,
                                  MetricSampleRepository sampleRepository,
                                  RuleEvaluator ruleEvaluator,
                                  RollupEngine rollupEngine,
                                  @Qualifier("evaluationExecutor") Executor evaluationExecutor,
                                  @Qualifier("rollupExecutor") Executor rollupExecutor,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.sampleValidator = sampleValidator;
        this.sampleRepository = sampleRepository;
        this.ruleEvaluator = ruleEvaluator;
        this.rollupEngine = rollupEngine;
        this.evaluationExecutor = evaluationExecutor;
        this.rollupExecutor = rollupExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public IngestResult ingest(MetricSampleRequest request) {
        MetricSample sample;
        try {
            sample = sampleValidator.toSample(request);
        } catch (InvalidSampleException e) {
            recordRejection(e);
            throw e;
        }
        return store(sample);
    }

    public IngestResult ingest(MetricSample sample) {
        try {
            sampleValidator.validate(sample);
        } catch (InvalidSampleException e) {
            recordRejection(e);
            throw e;
        }
        return store(sample);
    }

    /**
     * Samples are processed independently; one bad sample does not fail the batch
     */
    public List<IngestResult> ingestAll(List<MetricSampleRequest> requests) {
        List<IngestResult> results = new ArrayList<>(requests.size());
        int rejected = 0;

        for (MetricSampleRequest request : requests) {
            try {
                results.add(ingest(request));
            } catch (InvalidSampleException e) {
                results.add(IngestResult.rejected(e.getCode().name(), e.getMessage()));
                rejected++;
            } catch (StorageWriteException e) {
                results.add(IngestResult.rejected("STORAGE_WRITE_FAILED", e.getMessage()));
                rejected++;
            }
        }

        log.info("Batch ingest: {} samples, {} rejected", requests.size(), rejected);
        return results;
    }

    private IngestResult store(MetricSample sample) {
        Instant receivedAt = clock.instant();

        try {
            sampleRepository.append(sample, receivedAt);
        } catch (DataAccessException e) {
            meterRegistry.counter("anomaly.samples.store_failures").increment();
            throw new StorageWriteException("metric store", e);
        }

        CompletableFuture<Optional<AnomalyEvent>> evaluation =
                CompletableFuture.supplyAsync(() -> ruleEvaluator.evaluate(sample), evaluationExecutor);
        CompletableFuture<RollupOutcome> rollup =
                CompletableFuture.supplyAsync(() -> rollupEngine.ingest(sample, receivedAt), rollupExecutor);

        Optional<AnomalyEvent> anomaly = Optional.empty();
        boolean evaluationFailed = false;
        try {
            anomaly = evaluation.join();
        } catch (CompletionException e) {
            evaluationFailed = true;
            log.error("Rule evaluation failed for {}/{} at {}",
                    sample.getComponent().getWireName(), sample.getMetricName(),
                    sample.getTimestamp(), e.getCause());
            meterRegistry.counter("anomaly.evaluation.failures",
                    "component", sample.getComponent().getWireName()).increment();
        }

        RollupOutcome outcome;
        try {
            outcome = rollup.join();
        } catch (CompletionException e) {
            meterRegistry.counter("rollup.failures",
                    "component", sample.getComponent().getWireName()).increment();
            if (e.getCause() instanceof StorageWriteException storageFailure) {
                throw storageFailure;
            }
            throw new StorageWriteException("rollup store", e.getCause());
        }

        meterRegistry.counter("anomaly.samples.ingested",
                "component", sample.getComponent().getWireName()).increment();

        return IngestResult.builder()
                .accepted(true)
                .sample(sample)
                .receivedAt(receivedAt)
                .anomaly(anomaly.orElse(null))
                .rollupOutcome(outcome)
                .evaluationFailed(evaluationFailed)
                .build();
    }

    private void recordRejection(InvalidSampleException e) {
        log.warn("Rejected sample ({}): {}", e.getCode(), e.getMessage());
        meterRegistry.counter("anomaly.samples.rejected", "code", e.getCode().name()).increment();
    }
}
