package com.di.healthnova.store;

import com.di.healthnova.model.CanonicalMetricRecord;
import com.di.healthnova.model.MetricSeries;
import com.di.healthnova.model.MetricType;
import com.di.healthnova.model.SeriesSelector;
import com.di.healthnova.model.TimeRange;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of one user's records for a set of metric types.
 */
public final class StoreSnapshot {

    private final String userId;
    private final TimeRange range;
    private final Map<MetricType, List<CanonicalMetricRecord>> recordsByType;

    StoreSnapshot(String userId, TimeRange range, Map<MetricType, List<CanonicalMetricRecord>> recordsByType) {
        this.userId = userId;
        this.range = range;
        this.recordsByType = Map.copyOf(recordsByType);
    }

    public String getUserId() {
        return userId;
    }

    public TimeRange getRange() {
        return range;
    }

    /**
     * Series for the selector; empty when the metric type was not part of the snapshot.
     */
    public MetricSeries series(SeriesSelector selector) {
        return MetricSeries.of(userId, selector, recordsByType.getOrDefault(selector.metricType(), List.of()));
    }

    public int recordCount() {
        return recordsByType.values().stream().mapToInt(List::size).sum();
    }
}
