package com.di.healthnova.store;

import com.di.healthnova.model.CanonicalMetricRecord;
import com.di.healthnova.model.MetricSeries;
import com.di.healthnova.model.MetricType;
import com.di.healthnova.model.SeriesSelector;
import com.di.healthnova.model.TimeRange;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read/write contract of the canonical time-series store. Implementations can be in-memory or JDBC
 * (see db/schema.sql).
 *
 * <p>Writes are upserts on the natural key (user, metric type, qualifier, timestamp, provider): writing a key
 * twice keeps one record holding the last value, and records differing only in provider coexist.
 */
public interface TimeSeriesStore {

    void upsert(CanonicalMetricRecord record);

    /** Upserts every record; returns the number of records written. */
    int upsertAll(Collection<CanonicalMetricRecord> records);

    /** Records of one user and metric type in [from, to), ordered by timestamp then provider. */
    List<CanonicalMetricRecord> fetchRecords(String userId, MetricType metricType, TimeRange range);

    /** Removes every record of the user; returns how many were removed. */
    int deleteUser(String userId);

    long countRecords(String userId);

    /** Users holding at least one record, in ascending order. */
    List<String> listUsers();

    default MetricSeries fetchSeries(String userId, SeriesSelector selector, TimeRange range) {
        return MetricSeries.of(userId, selector, fetchRecords(userId, selector.metricType(), range));
    }

    default MetricSeries fetchSeries(String userId, MetricType metricType, TimeRange range) {
        return fetchSeries(userId, SeriesSelector.of(metricType), range);
    }

    /**
     * Reads the given metric types once and returns an immutable view. Evaluation cycles work on a snapshot
     * so that records ingested mid-cycle are not seen.
     */
    default StoreSnapshot snapshot(String userId, Set<MetricType> metricTypes, TimeRange range) {
        Map<MetricType, List<CanonicalMetricRecord>> byType = new EnumMap<>(MetricType.class);
        for (MetricType type : metricTypes) {
            byType.put(type, List.copyOf(fetchRecords(userId, type, range)));
        }
        return new StoreSnapshot(userId, range, byType);
    }
}
