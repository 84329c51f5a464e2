package com.di.healthnova.ingest;

import java.util.List;
import java.util.Optional;

/**
 * Keeps ingestion jobs for execution and reporting.
 */
public interface IngestionJobRepository {

    void save(IngestionJob job);

    Optional<IngestionJob> findById(String jobId);

    /** Jobs of a user, newest first. */
    List<IngestionJob> findByUser(String userId);
}
