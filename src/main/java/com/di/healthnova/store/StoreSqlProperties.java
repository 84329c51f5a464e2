package com.di.healthnova.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL used by the JDBC store, loaded from sql-queries.yml (healthnova.sql.*).
 * No SQL is hardcoded in JdbcTimeSeriesStore; the upsert statement is dialect-specific and can be swapped per
 * database without code changes.
 */
@Component
@ConfigurationProperties(prefix = "healthnova.sql")
public class StoreSqlProperties {

    private Records records = new Records();

    public Records getRecords() { return records; }
    public void setRecords(Records records) { this.records = records; }

    /**
     * Statements on canonical_metric_record. Parameter order of {@code upsert}:
     * user_id, metric_type, qualifier, recorded_at, source_provider, metric_value, source_file_hash.
     */
    public static class Records {
        private String upsert;
        private String findSeries;
        private String deleteByUser;
        private String countByUser;
        private String listUsers;

        public String getUpsert() { return upsert; }
        public void setUpsert(String upsert) { this.upsert = upsert; }
        public String getFindSeries() { return findSeries; }
        public void setFindSeries(String findSeries) { this.findSeries = findSeries; }
        public String getDeleteByUser() { return deleteByUser; }
        public void setDeleteByUser(String deleteByUser) { this.deleteByUser = deleteByUser; }
        public String getCountByUser() { return countByUser; }
        public void setCountByUser(String countByUser) { this.countByUser = countByUser; }
        public String getListUsers() { return listUsers; }
        public void setListUsers(String listUsers) { this.listUsers = listUsers; }
    }
}
