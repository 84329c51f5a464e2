package com.di.healthnova.ingest;

import com.di.healthnova.exception.ErrorCategory;
import com.di.healthnova.model.PartialIngestionWarning;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Job output reported back to the worker dispatcher.
 * {@code retryable} tells the pool whether another attempt may succeed; it is false for Completed jobs.
 */
@Value
@Builder
public class IngestionJobResult {
    String jobId;
    JobState finalState;
    int persistedCount;
    /** Skipped rows plus records rejected by the mapper. */
    int warningCount;
    int unmappedCount;
    int skippedRows;
    @Builder.Default
    List<String> errorLog = List.of();
    ErrorCategory errorCategory;
    boolean retryable;
    int attempts;
    /** First warnings of the run, capped by healthnova.ingestion.max-recorded-warnings. */
    @Builder.Default
    List<PartialIngestionWarning> warnings = List.of();
    String provider;
    String sourceFileHash;
    String mappingVersion;
}
