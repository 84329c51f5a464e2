package com.di.healthnova;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test for HealthNovaApplication without starting a Spring context.
 */
@DisplayName("HealthNovaApplication Tests")
class HealthNovaApplicationTests {

	@Test
	@DisplayName("Should have a public static main method")
	void testMainMethodExists() throws NoSuchMethodException {
		Method mainMethod = HealthNovaApplication.class.getMethod("main", String[].class);
		assertTrue(Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(Modifier.isPublic(mainMethod.getModifiers()));
	}

	@Test
	@DisplayName("Should leave datasource creation to the JDBC store configuration")
	void testDataSourceAutoConfigurationExcluded() {
		SpringBootApplication annotation = HealthNovaApplication.class.getAnnotation(SpringBootApplication.class);
		assertNotNull(annotation);
		assertTrue(Arrays.asList(annotation.exclude()).contains(DataSourceAutoConfiguration.class));
	}

}
