package com.di.healthnova.exception;

import com.di.healthnova.ingest.JobState;

/**
 * An ingestion job was asked to move along an edge its state machine does not have.
 */
public class IllegalJobTransitionException extends IllegalStateException {

    public IllegalJobTransitionException(String jobId, JobState from, JobState to) {
        super(String.format("Job %s cannot transition %s -> %s", jobId, from, to));
    }
}
