package com.di.healthnova.ingest;

import com.di.healthnova.config.HealthNovaProperties;
import com.di.healthnova.exception.ErrorCategory;
import lombok.Value;

import java.time.Duration;
import java.util.Optional;

/**
 * Bounded exponential backoff for failed ingestion jobs: {@code initial * multiplier^(attempt-1)}, capped at
 * {@code max}, for at most {@code maxAttempts} attempts in total. Only retryable error categories are retried.
 */
@Value
public class BackoffPolicy {
    Duration initial;
    double multiplier;
    Duration max;
    int maxAttempts;

    public static BackoffPolicy from(HealthNovaProperties.Ingestion ingestion) {
        return new BackoffPolicy(ingestion.getBackoffInitial(), ingestion.getBackoffMultiplier(),
                ingestion.getBackoffMax(), ingestion.getMaxAttempts());
    }

    /**
     * Delay before the next attempt, or empty when the job must stay Failed.
     *
     * @param attemptsSoFar attempts already made, at least 1
     */
    public Optional<Duration> nextDelay(int attemptsSoFar, ErrorCategory category) {
        if (category == null || !category.isRetryable() || attemptsSoFar >= maxAttempts) {
            return Optional.empty();
        }
        double factor = Math.pow(multiplier, Math.max(0, attemptsSoFar - 1));
        long millis = (long) Math.min(initial.toMillis() * factor, (double) max.toMillis());
        return Optional.of(Duration.ofMillis(millis));
    }
}
