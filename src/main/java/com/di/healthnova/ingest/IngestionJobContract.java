package com.di.healthnova.ingest;

import java.util.Optional;

/**
 * Job contract consumed by the external worker dispatcher: enqueue a file, execute the job (on a pool
 * thread, possibly again after a failure), report its outcome.
 */
public interface IngestionJobContract {

    /**
     * Registers a job in state Queued.
     *
     * @throws IllegalArgumentException if the request is invalid or the job id is already taken
     */
    IngestionJob enqueue(IngestionJobRequest request);

    /**
     * Runs the job to Completed or Failed. Executing a Failed job is a retry; executing a Completed job
     * returns its existing result.
     *
     * @throws IllegalArgumentException if the job does not exist
     */
    IngestionJobResult execute(String jobId);

    /** Latest result of the job; empty while it has not finished once. */
    Optional<IngestionJobResult> report(String jobId);
}
