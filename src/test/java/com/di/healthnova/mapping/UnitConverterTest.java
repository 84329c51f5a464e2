package com.di.healthnova.mapping;

import com.di.healthnova.exception.SchemaMismatchException;
import com.di.healthnova.exception.UnitConversionException;
import com.di.healthnova.model.MetricType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UnitConverter Tests")
class UnitConverterTest {

    private final UnitConverter converter = new UnitConverter();

    @ParameterizedTest(name = "{0} {1} as {2} = {3}")
    @CsvSource({
            "1,       mi,        distance,       1609.344",
            "6.2,     km,        distance,       6200",
            "250000,  cm,        distance,       2500",
            "3,       ft,        distance,       0.9144",
            "165,     lb,        weight,         74.84274105",
            "72500,   g,         weight,         72.5",
            "100,     kcal,      calories,       418.4",
            "100,     Cal,       calories,       418.4",
            "2000,    J,         calories,       2",
            "7.5,     h,         sleep_duration, 27000",
            "45,      min,       active_minutes, 2700",
            "62,      ms,        hrv,            62",
            "0.97,    fraction,  spo2,           97",
            "61,      count/min, heart_rate,     61"
    })
    @DisplayName("Should convert linear units exactly")
    void testToCanonical(String value, String unit, String metric, String expected) {
        BigDecimal converted = converter.toCanonical(new BigDecimal(value), unit, MetricType.fromCode(metric));
        assertEquals(0, new BigDecimal(expected).compareTo(converted), () -> "got " + converted);
    }

    @Test
    @DisplayName("Should keep the value unchanged when already canonical")
    void testToCanonical_Identity() {
        BigDecimal value = new BigDecimal("8500");
        assertSame(value, converter.toCanonical(value, "count", MetricType.STEPS));
    }

    @Test
    @DisplayName("Should fold case after an exact miss")
    void testToCanonical_CaseFolded() {
        assertEquals(0, new BigDecimal("5000").compareTo(converter.toCanonical(BigDecimal.valueOf(5), "KM", MetricType.DISTANCE)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"cal", "oz", "ton", "cup"})
    @DisplayName("Should refuse ambiguous units")
    void testToCanonical_Ambiguous(String unit) {
        MetricType metric = unit.equals("cal") ? MetricType.CALORIES : MetricType.WEIGHT;
        assertThrows(SchemaMismatchException.class, () -> converter.toCanonical(BigDecimal.ONE, unit, metric));
    }

    @Test
    @DisplayName("Should refuse a unit of another dimension")
    void testToCanonical_WrongDimension() {
        SchemaMismatchException e = assertThrows(SchemaMismatchException.class,
                () -> converter.toCanonical(BigDecimal.ONE, "kg", MetricType.DISTANCE));
        assertTrue(e.getMessage().contains("MASS"));
    }

    @Test
    @DisplayName("Should refuse unknown and missing units")
    void testToCanonical_UnknownOrMissing() {
        assertThrows(SchemaMismatchException.class, () -> converter.toCanonical(BigDecimal.ONE, "furlong", MetricType.DISTANCE));
        assertThrows(SchemaMismatchException.class, () -> converter.toCanonical(BigDecimal.ONE, null, MetricType.WEIGHT));
    }

    @Test
    @DisplayName("Should refuse numeric conversion of time-of-day metrics")
    void testToCanonical_TimeOfDay() {
        assertThrows(SchemaMismatchException.class, () -> converter.toCanonical(BigDecimal.ONE, "s", MetricType.SLEEP_ONSET));
        assertTrue(converter.supports(UnitConverter.CLOCK, MetricType.SLEEP_ONSET));
        assertFalse(converter.supports("s", MetricType.SLEEP_ONSET));
    }

    @Test
    @DisplayName("Should parse numbers and reject non-numeric values")
    void testParse() {
        assertEquals(0, new BigDecimal("58.2").compareTo(converter.parse(" 58.2 ")));
        assertThrows(UnitConversionException.class, () -> converter.parse("n/a"));
        assertThrows(UnitConversionException.class, () -> converter.parse(""));
    }
}
