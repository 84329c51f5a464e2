package com.di.healthnova.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricSeries Tests")
class MetricSeriesTest {

    private static final Instant T1 = Instant.parse("2024-01-01T07:00:00Z");
    private static final Instant T2 = Instant.parse("2024-01-01T08:00:00Z");

    private static CanonicalMetricRecord record(String user, MetricType type, String qualifier, Instant at,
                                                String provider, double value) {
        return CanonicalMetricRecord.builder()
                .userId(user).metricType(type).qualifier(qualifier).timestamp(at).sourceProvider(provider).value(value)
                .build();
    }

    @Test
    @DisplayName("Should order points strictly by time and average same-instant values")
    void testOf_OrderedAndAveraged() {
        MetricSeries series = MetricSeries.of("u1", MetricType.HEART_RATE, List.of(
                record("u1", MetricType.HEART_RATE, null, T2, "garmin", 70),
                record("u1", MetricType.HEART_RATE, null, T1, "garmin", 60),
                record("u1", MetricType.HEART_RATE, null, T1, "apple_health", 66)));

        assertEquals(List.of(T1, T2), series.getPoints().stream().map(SeriesPoint::timestamp).collect(Collectors.toList()));
        assertEquals(63.0, series.getPoints().get(0).value(), 1e-9);
    }

    @Test
    @DisplayName("Should keep only records of the user and selector")
    void testOf_Selector() {
        List<CanonicalMetricRecord> records = List.of(
                record("u1", MetricType.MACRO_NUTRIENT, "protein", T1, "cronometer", 100),
                record("u1", MetricType.MACRO_NUTRIENT, "fat", T1, "cronometer", 60),
                record("u2", MetricType.MACRO_NUTRIENT, "protein", T2, "cronometer", 90),
                record("u1", MetricType.STEPS, null, T2, "garmin", 9000));

        MetricSeries protein = MetricSeries.of("u1", new SeriesSelector(MetricType.MACRO_NUTRIENT, "protein", null), records);

        assertEquals(1, protein.size());
        assertEquals(100, protein.getPoints().get(0).value(), 1e-9);
        assertEquals(MetricType.MACRO_NUTRIENT, protein.getMetricType());
        assertTrue(MetricSeries.of("u3", MetricType.STEPS, records).isEmpty());
    }

    @Test
    @DisplayName("Should refuse to select a qualified metric without its qualifier")
    void testSelector_QualifierRequired() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SeriesSelector.of(MetricType.CALORIES));
        assertTrue(e.getMessage().contains("calories"));
        assertThrows(IllegalArgumentException.class, () -> new SeriesSelector(MetricType.SLEEP_STAGE, " ", "fitbit"));

        List<CanonicalMetricRecord> records = List.of(
                record("u1", MetricType.CALORIES, "intake", T1, "cronometer", 8000),
                record("u1", MetricType.CALORIES, "burned", T1, "garmin", 2000));
        MetricSeries intake = MetricSeries.of("u1", new SeriesSelector(MetricType.CALORIES, "intake", null), records);
        assertEquals(1, intake.size());
        assertEquals(8000, intake.getPoints().get(0).value(), 1e-9);
    }

    @Test
    @DisplayName("Should reject duplicate timestamps in explicit points")
    void testOfPoints_Duplicate() {
        assertThrows(IllegalArgumentException.class, () -> MetricSeries.ofPoints("u1", MetricType.STEPS,
                List.of(new SeriesPoint(T1, 1), new SeriesPoint(T1, 2))));
    }

    @Test
    @DisplayName("Should be read-only")
    void testPoints_Unmodifiable() {
        MetricSeries series = MetricSeries.ofPoints("u1", MetricType.STEPS, List.of(new SeriesPoint(T1, 1)));
        assertThrows(UnsupportedOperationException.class, () -> series.getPoints().add(new SeriesPoint(T2, 2)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"heart_rate", "HEART_RATE", " Heart_Rate "})
    @DisplayName("Should resolve metric types by code or name")
    void testMetricType_FromCode(String code) {
        assertEquals(MetricType.HEART_RATE, MetricType.fromCode(code));
    }

    @Test
    @DisplayName("Should reject unknown metric types and implausible values")
    void testMetricType_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> MetricType.fromCode("stress"));
        assertFalse(MetricType.HEART_RATE.isPlausible(400));
        assertTrue(MetricType.SLEEP_ONSET.isPlausible(-1800));
    }

    @Test
    @DisplayName("Should fold a missing qualifier into the empty key part")
    void testRecordKey_NullQualifier() {
        assertEquals(new RecordKey("u1", MetricType.STEPS, "", T1, "garmin"),
                record("u1", MetricType.STEPS, null, T1, "garmin", 1).key());
    }
}
