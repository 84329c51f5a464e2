package com.di.healthnova.ingest;

import java.util.EnumSet;
import java.util.Set;

/**
 * Ingestion job state machine:
 * Queued → Parsing → Canonicalizing → Persisting → Completed, with Parsing, Canonicalizing and Persisting
 * each able to fail. A Failed job goes back to Queued when the worker pool retries it.
 */
public enum JobState {
    QUEUED,
    PARSING,
    CANONICALIZING,
    PERSISTING,
    COMPLETED,
    FAILED;

    public Set<JobState> successors() {
        switch (this) {
            case QUEUED: return EnumSet.of(PARSING);
            case PARSING: return EnumSet.of(CANONICALIZING, FAILED);
            case CANONICALIZING: return EnumSet.of(PERSISTING, FAILED);
            case PERSISTING: return EnumSet.of(COMPLETED, FAILED);
            case FAILED: return EnumSet.of(QUEUED);
            default: return EnumSet.noneOf(JobState.class);
        }
    }

    public boolean canTransitionTo(JobState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isRunning() {
        return this == PARSING || this == CANONICALIZING || this == PERSISTING;
    }
}
