package com.di.healthnova.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single binding for all HealthNova configuration.
 *
 * <pre>
 * healthnova:
 *   ingestion:
 *     raw-file-root: /var/healthnova/uploads
 *     max-attempts: 3
 *     backoff-initial: 2s
 *     backoff-multiplier: 2.0
 *     backoff-max: 1m
 *     worker-threads: 4
 *   mapping:
 *     table-location: classpath:mapping/canonical-mappings.yml
 *   insights:
 *     rules-location: classpath:insights/insight-rules.yml
 *     evaluation-budget: 30s
 *     schedule-enabled: false
 *     schedule-interval: PT6H
 *   statistics:
 *     consistency-threshold-minutes: 30
 *     acute-days: 7
 *     chronic-days: 28
 *     elevated-ratio: 1.3
 *     anomaly-baseline-days: 30
 *     anomaly-z-threshold: 2.0
 *   profiles:
 *     default-zone: UTC
 *     zones:
 *       alice: Europe/Berlin
 *   store:
 *     type: jdbc
 *     jdbc-url: jdbc:postgresql://localhost:5432/healthnova
 *     username: healthnova
 *     initialize-schema: true
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "healthnova")
public class HealthNovaProperties {

    private Ingestion ingestion = new Ingestion();
    private Mapping mapping = new Mapping();
    private Insights insights = new Insights();
    private Statistics statistics = new Statistics();
    private Profiles profiles = new Profiles();
    private Store store = new Store();

    @Data
    public static class Ingestion {
        /** Directory that raw_file_ref values are resolved against. */
        private String rawFileRoot = "./uploads";
        /** Total attempts (first run included) before a Failed job is left Failed. */
        private int maxAttempts = 3;
        private Duration backoffInitial = Duration.ofSeconds(2);
        private double backoffMultiplier = 2.0;
        private Duration backoffMax = Duration.ofMinutes(1);
        /** Threads of the local ingestion worker. */
        private int workerThreads = 4;
        /** Maximum number of PartialIngestionWarning entries kept on a job result. */
        private int maxRecordedWarnings = 100;
    }

    @Data
    public static class Mapping {
        private String tableLocation = "classpath:mapping/canonical-mappings.yml";
    }

    @Data
    public static class Insights {
        private String rulesLocation = "classpath:insights/insight-rules.yml";
        private Duration evaluationBudget = Duration.ofSeconds(30);
        /** Users evaluated in parallel. */
        private int evaluationThreads = 2;
        private boolean scheduleEnabled = false;
        private Duration scheduleInterval = Duration.ofHours(6);
    }

    @Data
    public static class Statistics {
        private double consistencyThresholdMinutes = 30;
        private int consistencyWindowDays = 7;
        private int acuteDays = 7;
        private int chronicDays = 28;
        /** Acute:chronic ratio above which training load is flagged as elevated risk. */
        private double elevatedRatio = 1.3;
        private int anomalyBaselineDays = 30;
        private double anomalyZThreshold = 2.0;
    }

    @Data
    public static class Profiles {
        /** Zone applied when a user has no zone of their own and the file declares no offset. */
        private String defaultZone = "UTC";
        private Map<String, String> zones = new LinkedHashMap<>();
    }

    @Data
    public static class Store {
        /** in-memory or jdbc */
        private String type = "in-memory";
        private String jdbcUrl;
        private String username;
        private String password;
        private String driverClassName = "org.postgresql.Driver";
        private int maximumPoolSize = 8;
        private long connectionTimeoutMs = 30_000;
        /** Runs db/schema.sql at startup when true. */
        private boolean initializeSchema = false;
    }
}
