package com.di.healthnova.ingest;

/**
 * Job input as received from the worker dispatcher.
 *
 * @param jobId             caller-chosen id; generated when null
 * @param declaredProvider  provider name; null to detect it from the file name
 * @param declaredUtcOffset offset for timestamps that carry none (e.g. "+02:00"); null to use the user's zone
 */
public record IngestionJobRequest(String jobId, String userId, String rawFileRef, String declaredProvider,
                                  String declaredUtcOffset) {

    public IngestionJobRequest {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (rawFileRef == null || rawFileRef.isBlank()) {
            throw new IllegalArgumentException("rawFileRef is required");
        }
    }

    public static IngestionJobRequest of(String userId, String rawFileRef, String declaredProvider) {
        return new IngestionJobRequest(null, userId, rawFileRef, declaredProvider, null);
    }
}
