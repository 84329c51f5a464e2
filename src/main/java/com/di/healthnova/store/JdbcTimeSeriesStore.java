package com.di.healthnova.store;

import com.di.healthnova.exception.StorageException;
import com.di.healthnova.model.CanonicalMetricRecord;
import com.di.healthnova.model.MetricType;
import com.di.healthnova.model.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * JDBC implementation of TimeSeriesStore over canonical_metric_record (see db/schema.sql).
 * Enable with healthnova.store.type=jdbc and a configured datasource. Atomicity of concurrent writes to one
 * key comes from the database's upsert statement.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "healthnova.store.type", havingValue = "jdbc")
public class JdbcTimeSeriesStore implements TimeSeriesStore {

    private final JdbcTemplate jdbc;
    private final StoreSqlProperties sql;

    public JdbcTimeSeriesStore(JdbcTemplate jdbcTemplate, StoreSqlProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    private static final RowMapper<CanonicalMetricRecord> RECORD_ROW_MAPPER = (rs, rowNum) -> CanonicalMetricRecord.builder()
            .userId(rs.getString("user_id"))
            .metricType(MetricType.fromCode(rs.getString("metric_type")))
            .qualifier(emptyToNull(rs.getString("qualifier")))
            .timestamp(rs.getObject("recorded_at", OffsetDateTime.class).toInstant())
            .sourceProvider(rs.getString("source_provider"))
            .value(rs.getDouble("metric_value"))
            .sourceFileHash(rs.getString("source_file_hash"))
            .build();

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    /** Instants are bound with an explicit UTC offset, never as zone-less wall time. */
    private static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Object[] upsertArgs(CanonicalMetricRecord r) {
        return new Object[] {
                r.getUserId(),
                r.getMetricType().getCode(),
                r.getQualifier() == null ? "" : r.getQualifier(),
                utc(r.getTimestamp()),
                r.getSourceProvider(),
                r.getValue(),
                r.getSourceFileHash()};
    }

    @Override
    public void upsert(CanonicalMetricRecord record) {
        if (record == null) return;
        try {
            jdbc.update(sql.getRecords().getUpsert(), upsertArgs(record));
        } catch (DataAccessException e) {
            throw new StorageException("Upsert failed for " + record.key(), e);
        }
    }

    @Override
    public int upsertAll(Collection<CanonicalMetricRecord> records) {
        List<Object[]> batch = new ArrayList<>(records.size());
        for (CanonicalMetricRecord r : records) {
            if (r != null) batch.add(upsertArgs(r));
        }
        if (batch.isEmpty()) return 0;
        try {
            jdbc.batchUpdate(sql.getRecords().getUpsert(), batch);
            log.debug("[STORE] Upserted {} record(s)", batch.size());
            return batch.size();
        } catch (DataAccessException e) {
            throw new StorageException("Batch upsert of " + batch.size() + " record(s) failed", e);
        }
    }

    @Override
    public List<CanonicalMetricRecord> fetchRecords(String userId, MetricType metricType, TimeRange range) {
        try {
            return jdbc.query(sql.getRecords().getFindSeries(), RECORD_ROW_MAPPER,
                    userId, metricType.getCode(), utc(range.from()), utc(range.to()));
        } catch (DataAccessException e) {
            throw new StorageException("Series read failed for " + userId + "/" + metricType.getCode(), e);
        }
    }

    @Override
    public int deleteUser(String userId) {
        try {
            return jdbc.update(sql.getRecords().getDeleteByUser(), userId);
        } catch (DataAccessException e) {
            throw new StorageException("Delete failed for user " + userId, e);
        }
    }

    @Override
    public long countRecords(String userId) {
        try {
            Long count = jdbc.queryForObject(sql.getRecords().getCountByUser(), Long.class, userId);
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new StorageException("Count failed for user " + userId, e);
        }
    }

    @Override
    public List<String> listUsers() {
        try {
            return jdbc.queryForList(sql.getRecords().getListUsers(), String.class);
        } catch (DataAccessException e) {
            throw new StorageException("User listing failed", e);
        }
    }
}
