package com.di.healthnova.model;

import java.time.Instant;

/**
 * Natural key of a {@link CanonicalMetricRecord}. Two records with the same key are the same
 * measurement; persisting the second overwrites the first. Distinct providers never share a key.
 *
 * @param qualifier sub-kind for metric types that need one (e.g. "protein" for macro_nutrient); empty when unused
 */
public record RecordKey(
        String userId,
        MetricType metricType,
        String qualifier,
        Instant timestamp,
        String sourceProvider
) {
    public RecordKey {
        qualifier = qualifier == null ? "" : qualifier;
    }
}
