package com.di.healthnova.mapping;

import com.di.healthnova.config.HealthNovaProperties;
import com.di.healthnova.model.MetricType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MappingTableLoader Tests")
class MappingTableLoaderTest {

    @TempDir
    Path tempDir;

    private MappingTableLoader loader;

    @BeforeEach
    void setUp() {
        loader = new MappingTableLoader(new DefaultResourceLoader(), new HealthNovaProperties(), new UnitConverter());
    }

    @Test
    @DisplayName("Should load the bundled mapping table")
    void testLoad_Bundled() {
        CanonicalMappingTable table = loader.load();

        assertEquals("2024.07.1", table.getVersion());
        assertTrue(table.size() > 30);
        CanonicalMapping protein = table.find("cronometer", "protein").orElseThrow();
        assertEquals(MetricType.MACRO_NUTRIENT, protein.getMetricType());
        assertEquals("protein", protein.getQualifier());
        assertEquals(TimestampPolicy.EMBEDDED_OR_DECLARED, protein.getTimestampPolicy());
    }

    @Test
    @DisplayName("Should give time-of-day mappings the clock unit")
    void testLoad_ClockUnit() {
        CanonicalMapping bedtime = loader.load().find("GARMIN", "Bedtime").orElseThrow();

        assertEquals(MetricType.SLEEP_ONSET, bedtime.getMetricType());
        assertEquals(UnitConverter.CLOCK, bedtime.getSourceUnit());
    }

    @Test
    @DisplayName("Should return empty for unmapped fields")
    void testFind_Unmapped() {
        CanonicalMappingTable table = loader.load();
        assertTrue(table.find("garmin", "Stress Level").isEmpty());
        assertTrue(table.find("whoop", "strain").isEmpty());
        assertTrue(table.find(null, "steps").isEmpty());
    }

    @Test
    @DisplayName("Should read timestamp policies")
    void testLoad_TimestampPolicy() throws IOException {
        CanonicalMappingTable table = loader.load(write("version: t1\nmappings:\n"
                + "  - { provider: oura, field: steps, metric: steps, unit: count, timestamp_policy: utc }\n"));

        assertEquals(TimestampPolicy.UTC, table.find("oura", "steps").orElseThrow().getTimestampPolicy());
    }

    @Test
    @DisplayName("Should fail on a unit the metric cannot take")
    void testLoad_IncompatibleUnit() throws IOException {
        String location = write("version: t1\nmappings:\n  - { provider: garmin, field: Steps, metric: steps, unit: kg }\n");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> loader.load(location));
        assertTrue(e.getMessage().contains("kg"));
    }

    @Test
    @DisplayName("Should fail when a qualified metric has no qualifier")
    void testLoad_MissingQualifier() throws IOException {
        String location = write("version: t1\nmappings:\n  - { provider: fitbit, field: calories, metric: calories, unit: kcal }\n");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> loader.load(location));
        assertTrue(e.getMessage().contains("needs a qualifier"));
    }

    @Test
    @DisplayName("Should fail when an unqualified metric is given a qualifier")
    void testLoad_UnexpectedQualifier() throws IOException {
        String location = write("version: t1\nmappings:\n"
                + "  - { provider: garmin, field: Steps, metric: steps, unit: count, qualifier: walking }\n");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> loader.load(location));
        assertTrue(e.getMessage().contains("takes no qualifier"));
    }

    @Test
    @DisplayName("Should qualify every calories mapping of the bundled table")
    void testLoad_BundledCaloriesQualified() {
        CanonicalMappingTable table = loader.load();

        assertEquals("burned", table.find("fitbit", "calories").orElseThrow().getQualifier());
        assertEquals("intake", table.find("cronometer", "Energy").orElseThrow().getQualifier());
        assertEquals("intake", table.find("apple_health", "HKQuantityTypeIdentifierDietaryEnergyConsumed")
                .orElseThrow().getQualifier());
    }

    @Test
    @DisplayName("Should fail on duplicate entries")
    void testLoad_Duplicate() throws IOException {
        String location = write("version: t1\nmappings:\n"
                + "  - { provider: garmin, field: Steps, metric: steps }\n"
                + "  - { provider: Garmin, field: steps, metric: steps }\n");
        assertThrows(IllegalStateException.class, () -> loader.load(location));
    }

    @Test
    @DisplayName("Should fail without version")
    void testLoad_NoVersion() throws IOException {
        String location = write("mappings:\n  - { provider: garmin, field: Steps, metric: steps }\n");
        assertThrows(IllegalStateException.class, () -> loader.load(location));
    }

    @Test
    @DisplayName("Should fail on an unknown metric type")
    void testLoad_UnknownMetric() throws IOException {
        String location = write("version: t1\nmappings:\n  - { provider: garmin, field: Stress, metric: stress }\n");
        assertThrows(IllegalStateException.class, () -> loader.load(location));
    }

    @Test
    @DisplayName("Should fail when the table does not exist")
    void testLoad_Missing() {
        assertThrows(IllegalStateException.class, () -> loader.load("classpath:mapping/missing.yml"));
    }

    private String write(String yaml) throws IOException {
        Path file = tempDir.resolve("mappings-" + System.nanoTime() + ".yml");
        Files.writeString(file, yaml, StandardCharsets.UTF_8);
        return file.toUri().toString();
    }
}
