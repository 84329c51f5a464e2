package com.di.healthnova.ingest;

import com.di.healthnova.exception.ErrorCategory;
import com.di.healthnova.exception.IllegalJobTransitionException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One ingestion job. Mutated only by {@link IngestionPipeline} transitions; readers get consistent values
 * because every accessor synchronizes on the job.
 */
public class IngestionJob {

    private final String jobId;
    private final String userId;
    private final String rawFileRef;
    private final String declaredProvider;
    private final ZoneOffset declaredOffset;
    private final Instant createdAt;

    private String provider;
    private JobState state = JobState.QUEUED;
    private int attempts;
    private Instant updatedAt;
    private ErrorCategory errorCategory;
    private final List<String> errorLog = new ArrayList<>();
    private final List<JobState> history = new ArrayList<>();
    private IngestionJobResult result;

    public IngestionJob(String jobId, String userId, String rawFileRef, String declaredProvider,
                        ZoneOffset declaredOffset, Instant createdAt) {
        this.jobId = jobId;
        this.userId = userId;
        this.rawFileRef = rawFileRef;
        this.declaredProvider = declaredProvider;
        this.declaredOffset = declaredOffset;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.history.add(JobState.QUEUED);
    }

    /**
     * @throws IllegalJobTransitionException if the state machine has no such edge
     */
    synchronized void transitionTo(JobState next, Instant at) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalJobTransitionException(jobId, state, next);
        }
        state = next;
        updatedAt = at;
        history.add(next);
        if (next == JobState.PARSING) {
            attempts++;
        }
    }

    synchronized void fail(ErrorCategory category, String message, Instant at) {
        transitionTo(JobState.FAILED, at);
        errorCategory = category;
        errorLog.add(message);
    }

    synchronized void setProvider(String provider) {
        this.provider = provider;
    }

    synchronized void setResult(IngestionJobResult result) {
        this.result = result;
    }

    public String getJobId() {
        return jobId;
    }

    public String getUserId() {
        return userId;
    }

    public String getRawFileRef() {
        return rawFileRef;
    }

    public String getDeclaredProvider() {
        return declaredProvider;
    }

    public ZoneOffset getDeclaredOffset() {
        return declaredOffset;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized String getProvider() {
        return provider != null ? provider : declaredProvider;
    }

    public synchronized JobState getState() {
        return state;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized ErrorCategory getErrorCategory() {
        return errorCategory;
    }

    public synchronized List<String> getErrorLog() {
        return Collections.unmodifiableList(new ArrayList<>(errorLog));
    }

    /** Every state the job has been in, in order. */
    public synchronized List<JobState> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public synchronized IngestionJobResult getResult() {
        return result;
    }

    @Override
    public synchronized String toString() {
        return "IngestionJob[" + jobId + ", user=" + userId + ", file=" + rawFileRef + ", state=" + state
                + ", attempts=" + attempts + "]";
    }
}
