package com.di.healthnova.util;

import com.di.healthnova.exception.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for ingestion jobs and insight evaluation cycles.
 */
@Slf4j
@Component
public class IngestionMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter persistedCounter;
    private final Counter warningCounter;
    private final Counter unmappedCounter;
    private final Timer jobTimer;
    private final Timer evaluationTimer;
    private final Counter insightsEmittedCounter;

    public IngestionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.persistedCounter = Counter.builder("healthnova.ingestion.records")
                .description("Canonical records persisted by ingestion jobs")
                .tag("outcome", "persisted")
                .register(meterRegistry);

        this.warningCounter = Counter.builder("healthnova.ingestion.records")
                .description("Raw records skipped with a warning")
                .tag("outcome", "warning")
                .register(meterRegistry);

        this.unmappedCounter = Counter.builder("healthnova.ingestion.records")
                .description("Raw records dropped because their field has no mapping")
                .tag("outcome", "unmapped")
                .register(meterRegistry);

        this.jobTimer = Timer.builder("healthnova.ingestion.job.duration")
                .description("Time taken to execute one ingestion job")
                .register(meterRegistry);

        this.evaluationTimer = Timer.builder("healthnova.insights.evaluation.duration")
                .description("Time taken by one user's insight evaluation cycle")
                .register(meterRegistry);

        this.insightsEmittedCounter = Counter.builder("healthnova.insights.emitted")
                .description("Insight results emitted by evaluation cycles")
                .register(meterRegistry);
    }

    /**
     * Records a finished job.
     *
     * @param finalState Completed or Failed
     * @param category   error category of a failed job, null otherwise
     */
    public void recordJob(String finalState, ErrorCategory category, int persisted, int warnings, int unmapped,
                          Duration elapsed) {
        Counter.builder("healthnova.ingestion.jobs")
                .description("Ingestion jobs by final state")
                .tag("state", finalState)
                .tag("category", category == null ? "none" : category.name())
                .register(meterRegistry)
                .increment();
        persistedCounter.increment(persisted);
        warningCounter.increment(warnings);
        unmappedCounter.increment(unmapped);
        jobTimer.record(elapsed);
        log.debug("Recorded job: state={}, persisted={}, warnings={}, unmapped={}, elapsedMs={}",
                finalState, persisted, warnings, unmapped, elapsed.toMillis());
    }

    /**
     * Records one user's evaluation cycle.
     *
     * @param outcome completed, timeout or cancelled
     */
    public void recordEvaluation(String outcome, int emitted, Duration elapsed) {
        Counter.builder("healthnova.insights.evaluations")
                .description("Insight evaluation cycles by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
        insightsEmittedCounter.increment(emitted);
        evaluationTimer.record(elapsed);
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
