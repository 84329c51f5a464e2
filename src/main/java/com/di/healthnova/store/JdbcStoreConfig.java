package com.di.healthnova.store;

import com.di.healthnova.config.HealthNovaProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Connection pool and JdbcTemplate for the JDBC store (healthnova.store.type=jdbc).
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "healthnova.store.type", havingValue = "jdbc")
public class JdbcStoreConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(DataSource.class)
    public HikariDataSource storeDataSource(HealthNovaProperties properties) {
        HealthNovaProperties.Store store = properties.getStore();
        if (store.getJdbcUrl() == null || store.getJdbcUrl().isBlank()) {
            throw new IllegalStateException("healthnova.store.jdbc-url is required when healthnova.store.type=jdbc");
        }
        HikariConfig config = new HikariConfig();
        config.setPoolName("healthnova-store");
        config.setJdbcUrl(store.getJdbcUrl());
        config.setUsername(store.getUsername());
        config.setPassword(store.getPassword());
        config.setDriverClassName(store.getDriverClassName());
        config.setMaximumPoolSize(store.getMaximumPoolSize());
        config.setConnectionTimeout(store.getConnectionTimeoutMs());
        if (store.getJdbcUrl().contains("postgresql")) {
            config.addDataSourceProperty("tcpKeepAlive", "true");
        }
        log.info("[STORE] Creating pool for {} (user: {}, maxPool={})", sanitizeUrl(store.getJdbcUrl()),
                store.getUsername(), store.getMaximumPoolSize());
        HikariDataSource dataSource = new HikariDataSource(config);
        if (store.isInitializeSchema()) {
            DatabasePopulatorUtils.execute(new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")), dataSource);
            log.info("[STORE] Applied db/schema.sql");
        }
        return dataSource;
    }

    @Bean
    @ConditionalOnMissingBean(JdbcTemplate.class)
    public JdbcTemplate storeJdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    static String sanitizeUrl(String url) {
        int q = url.indexOf('?');
        return q < 0 ? url : url.substring(0, q);
    }
}
