package com.di.healthnova.config;

import com.di.healthnova.ingest.BackoffPolicy;
import com.di.healthnova.ingest.IngestionJobContract;
import com.di.healthnova.ingest.IngestionWorker;
import com.di.healthnova.insight.InsightRuleCatalog;
import com.di.healthnova.insight.InsightRuleLoader;
import com.di.healthnova.mapping.CanonicalMappingTable;
import com.di.healthnova.mapping.CanonicalizationMapper;
import com.di.healthnova.mapping.MappingTableLoader;
import com.di.healthnova.mapping.TimestampResolver;
import com.di.healthnova.mapping.UnitConverter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the loaded mapping table and rule catalog, the retry policy and the two executors
 * (ingestion jobs, insight evaluation cycles).
 */
@Configuration
@EnableScheduling
public class NormalizationConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CanonicalMappingTable canonicalMappingTable(MappingTableLoader loader) {
        return loader.load();
    }

    @Bean
    public CanonicalizationMapper canonicalizationMapper(CanonicalMappingTable table, UnitConverter unitConverter,
                                                         TimestampResolver timestampResolver) {
        return new CanonicalizationMapper(table, unitConverter, timestampResolver);
    }

    @Bean
    public InsightRuleCatalog insightRuleCatalog(InsightRuleLoader loader) {
        return loader.load();
    }

    @Bean
    public BackoffPolicy backoffPolicy(HealthNovaProperties properties) {
        return BackoffPolicy.from(properties.getIngestion());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService ingestionExecutor(HealthNovaProperties properties) {
        return Executors.newFixedThreadPool(properties.getIngestion().getWorkerThreads(), named("ingest-worker"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService insightExecutor(HealthNovaProperties properties) {
        return Executors.newFixedThreadPool(properties.getInsights().getEvaluationThreads(), named("insight-eval"));
    }

    @Bean
    public IngestionWorker ingestionWorker(IngestionJobContract pipeline, BackoffPolicy backoffPolicy,
                                           @Qualifier("ingestionExecutor") ExecutorService executor) {
        return new IngestionWorker(pipeline, backoffPolicy, executor);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
