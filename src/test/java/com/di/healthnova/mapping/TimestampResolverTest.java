package com.di.healthnova.mapping;

import com.di.healthnova.exception.SchemaMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimestampResolver Tests")
class TimestampResolverTest {

    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

    private final TimestampResolver resolver = new TimestampResolver();

    @ParameterizedTest(name = "{0}")
    @CsvSource({
            "2024-01-01T07:00:00Z,          2024-01-01T07:00:00Z",
            "2024-01-01T07:00:00+02:00,     2024-01-01T05:00:00Z",
            "2024-01-01 09:00:00 +0100,     2024-01-01T08:00:00Z",
            "2024-07-01 09:00:00-04:00,     2024-07-01T13:00:00Z"
    })
    @DisplayName("Should take embedded offsets as-is")
    void testResolve_EmbeddedOffset(String raw, String expected) {
        assertEquals(Instant.parse(expected), resolver.resolve(raw, TimestampPolicy.EMBEDDED_OR_DECLARED,
                ZoneOffset.ofHours(5), BERLIN));
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource({
            "2024-01-01 07:00:00,   2024-01-01T06:00:00Z",
            "2024-01-01T07:00:00,   2024-01-01T06:00:00Z",
            "01/01/24 07:00:00,     2024-01-01T06:00:00Z",
            "07/01/2024 07:00,      2024-07-01T05:00:00Z",
            "2024-01-01,            2023-12-31T23:00:00Z"
    })
    @DisplayName("Should place local values in the user's zone when no offset is declared")
    void testResolve_UserZone(String raw, String expected) {
        assertEquals(Instant.parse(expected), resolver.resolve(raw, TimestampPolicy.EMBEDDED_OR_DECLARED, null, BERLIN));
    }

    @Test
    @DisplayName("Should prefer the declared file offset over the user's zone")
    void testResolve_DeclaredOffset() {
        assertEquals(Instant.parse("2024-01-01T09:00:00Z"),
                resolver.resolve("2024-01-01 07:00:00", TimestampPolicy.EMBEDDED_OR_DECLARED, ZoneOffset.ofHours(-2), BERLIN));
    }

    @Test
    @DisplayName("Should read local values as UTC under the UTC policy")
    void testResolve_UtcPolicy() {
        assertEquals(Instant.parse("2024-01-01T07:00:00Z"),
                resolver.resolve("2024-01-01 07:00:00", TimestampPolicy.UTC, ZoneOffset.ofHours(-2), BERLIN));
    }

    @Test
    @DisplayName("Should reject unknown layouts")
    void testResolve_Unrecognized() {
        assertThrows(SchemaMismatchException.class,
                () -> resolver.resolve("yesterday", TimestampPolicy.EMBEDDED_OR_DECLARED, null, BERLIN));
        assertThrows(SchemaMismatchException.class,
                () -> resolver.resolve(" ", TimestampPolicy.EMBEDDED_OR_DECLARED, null, BERLIN));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "23:00,                      -3600",
            "00:30,                      1800",
            "22:15:30,                   -6270",
            "11:59:59,                   43199",
            "12:00,                      -43200",
            "2024-01-01T23:30:00.000,    -1800",
            "2024-01-02 07:10:00 +0100,  25800",
            "11:45 PM,                   -900"
    })
    @DisplayName("Should read clock values as signed seconds from the nearest midnight")
    void testClockSeconds(String raw, int expected) {
        assertEquals(expected, resolver.clockSeconds(raw));
    }

    @Test
    @DisplayName("Should reject unreadable clock values")
    void testClockSeconds_Unrecognized() {
        assertThrows(SchemaMismatchException.class, () -> resolver.clockSeconds("late"));
    }
}
