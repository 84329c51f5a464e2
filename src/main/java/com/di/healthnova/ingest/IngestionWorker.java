package com.di.healthnova.ingest;

import com.di.healthnova.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Local stand-in for the external worker pool: runs jobs on a bounded executor and applies the bounded
 * retry/backoff policy to Failed jobs. Used by the command-line runner and by tests.
 */
@Slf4j
public class IngestionWorker {

    private final IngestionJobContract pipeline;
    private final BackoffPolicy backoffPolicy;
    private final ExecutorService executor;

    public IngestionWorker(IngestionJobContract pipeline, BackoffPolicy backoffPolicy, ExecutorService executor) {
        this.pipeline = pipeline;
        this.backoffPolicy = backoffPolicy;
        this.executor = MdcPropagation.wrapExecutor(executor);
    }

    /** Enqueues the request and runs it asynchronously, retries included. */
    public CompletableFuture<IngestionJobResult> submit(IngestionJobRequest request) {
        IngestionJob job = pipeline.enqueue(request);
        return CompletableFuture.supplyAsync(() -> runWithRetries(job.getJobId()), executor);
    }

    /** Enqueues and runs in the calling thread. */
    public IngestionJobResult runNow(IngestionJobRequest request) {
        return runWithRetries(pipeline.enqueue(request).getJobId());
    }

    IngestionJobResult runWithRetries(String jobId) {
        IngestionJobResult result = pipeline.execute(jobId);
        while (result.getFinalState() == JobState.FAILED) {
            Optional<Duration> delay = backoffPolicy.nextDelay(result.getAttempts(), result.getErrorCategory());
            if (delay.isEmpty()) {
                log.warn("[WORKER] job={} stays FAILED after {} attempt(s): {}", jobId, result.getAttempts(),
                        result.getErrorLog());
                return result;
            }
            log.info("[WORKER] job={} retrying in {} ms ({})", jobId, delay.get().toMillis(), result.getErrorCategory());
            if (!sleep(delay.get())) {
                log.warn("[WORKER] job={} retry interrupted", jobId);
                return result;
            }
            result = pipeline.execute(jobId);
        }
        return result;
    }

    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
