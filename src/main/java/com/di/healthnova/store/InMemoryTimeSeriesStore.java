package com.di.healthnova.store;

import com.di.healthnova.model.CanonicalMetricRecord;
import com.di.healthnova.model.MetricType;
import com.di.healthnova.model.RecordKey;
import com.di.healthnova.model.TimeRange;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TimeSeriesStore, partitioned by user. Suitable for single-node and testing.
 * When healthnova.store.type=jdbc, JdbcTimeSeriesStore is used instead.
 */
@Component
@ConditionalOnProperty(name = "healthnova.store.type", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryTimeSeriesStore implements TimeSeriesStore {

    private static final Comparator<CanonicalMetricRecord> SERIES_ORDER = Comparator
            .comparing(CanonicalMetricRecord::getTimestamp)
            .thenComparing(CanonicalMetricRecord::getSourceProvider)
            .thenComparing(r -> r.getQualifier() == null ? "" : r.getQualifier());

    private final Map<String, Map<RecordKey, CanonicalMetricRecord>> recordsByUser = new ConcurrentHashMap<>();

    @Override
    public void upsert(CanonicalMetricRecord record) {
        if (record == null) return;
        recordsByUser.computeIfAbsent(record.getUserId(), u -> new ConcurrentHashMap<>())
                .put(record.key(), record);
    }

    @Override
    public int upsertAll(Collection<CanonicalMetricRecord> records) {
        int written = 0;
        for (CanonicalMetricRecord record : records) {
            if (record == null) continue;
            upsert(record);
            written++;
        }
        return written;
    }

    @Override
    public List<CanonicalMetricRecord> fetchRecords(String userId, MetricType metricType, TimeRange range) {
        Map<RecordKey, CanonicalMetricRecord> partition = recordsByUser.get(userId);
        if (partition == null) return List.of();
        return partition.values().stream()
                .filter(r -> r.getMetricType() == metricType && range.contains(r.getTimestamp()))
                .sorted(SERIES_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public int deleteUser(String userId) {
        Map<RecordKey, CanonicalMetricRecord> removed = recordsByUser.remove(userId);
        return removed == null ? 0 : removed.size();
    }

    @Override
    public long countRecords(String userId) {
        Map<RecordKey, CanonicalMetricRecord> partition = recordsByUser.get(userId);
        return partition == null ? 0 : partition.size();
    }

    @Override
    public List<String> listUsers() {
        return recordsByUser.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());
    }
}
