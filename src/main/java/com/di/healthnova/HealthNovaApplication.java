package com.di.healthnova;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;

/**
 * The JDBC store builds its own pool (store.JdbcStoreConfig); the in-memory store needs no datasource.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
public class HealthNovaApplication {

	public static void main(String[] args) {
		SpringApplication.run(HealthNovaApplication.class, args);
	}
}
