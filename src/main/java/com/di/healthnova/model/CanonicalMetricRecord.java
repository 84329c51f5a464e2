package com.di.healthnova.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * One normalized measurement: SI-normalized value at a UTC instant, tagged with the provider and the
 * hash of the file it came from. Immutable once built.
 */
@Value
@Builder(toBuilder = true)
public class CanonicalMetricRecord {
    @NonNull
    String userId;
    @NonNull
    MetricType metricType;
    /** Sub-kind (protein, deep, ...); null when the metric type has none. */
    String qualifier;
    double value;
    @NonNull
    Instant timestamp;
    @NonNull
    String sourceProvider;
    String sourceFileHash;

    public RecordKey key() {
        return new RecordKey(userId, metricType, qualifier, timestamp, sourceProvider);
    }
}
