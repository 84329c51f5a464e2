package com.di.healthnova.handler;

import com.di.healthnova.exception.UnsupportedFormatException;
import com.di.healthnova.handler.delimited.GarminCsvAdapter;
import com.di.healthnova.model.RawFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ProviderAdapterRegistry.
 * Note: the registry is initialized manually; no Spring context is started.
 */
@DisplayName("ProviderAdapterRegistry Tests")
class ProviderAdapterRegistryTest {

    private ProviderAdapterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = TestAdapters.registry();
    }

    @Test
    @DisplayName("Should register one adapter per provider")
    void testRegisteredProviders() {
        assertEquals(Set.of("fitbit", "cronometer", "garmin", "apple_health"), registry.getRegisteredProviders());
    }

    @Test
    @DisplayName("Should look providers up case-insensitively")
    void testGetAdapter_CaseInsensitive() {
        assertEquals(RawFormat.DELIMITED_TEXT, registry.getAdapter(" Garmin ").format());
        assertEquals(RawFormat.TAGGED_MARKUP, registry.getAdapter("APPLE_HEALTH").format());
        assertTrue(registry.hasAdapter("Fitbit"));
    }

    @Test
    @DisplayName("Should throw UnsupportedFormatException for an unknown provider")
    void testGetAdapter_Unknown() {
        assertThrows(UnsupportedFormatException.class, () -> registry.getAdapter("whoop"));
        assertThrows(UnsupportedFormatException.class, () -> registry.getAdapter(null));
        assertThrows(UnsupportedFormatException.class, () -> registry.getAdapter(""));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "steps-2024-01-01.json, fitbit",
            "sleep-2024-03-01.json, fitbit",
            "resting_heart_rate-2024-01-01.json, fitbit",
            "dailysummary.csv, cronometer",
            "cronometer_export.csv, cronometer",
            "garmin_daily.csv, garmin",
            "export.xml, apple_health",
            "apple_health_export/export.xml, apple_health"
    })
    @DisplayName("Should detect the provider from the file name")
    void testResolve_DetectsFromFileName(String fileName, String provider) {
        assertEquals(provider, registry.resolve(null, fileName).provider());
    }

    @Test
    @DisplayName("Should prefer the declared provider over detection")
    void testResolve_DeclaredProviderWins() {
        assertEquals("garmin", registry.resolve("garmin", "steps-2024-01-01.json").provider());
    }

    @Test
    @DisplayName("Should reject files no adapter recognizes")
    void testResolve_Unrecognized() {
        assertThrows(UnsupportedFormatException.class, () -> registry.resolve(null, "notes.txt"));
        assertThrows(UnsupportedFormatException.class, () -> registry.resolve(null, "route.gpx"));
    }

    @Test
    @DisplayName("Should fail initialization when two adapters claim the same provider")
    void testInitialize_DuplicateProvider() {
        ProviderAdapterRegistry duplicate = new ProviderAdapterRegistry(List.of(new GarminCsvAdapter(), new GarminCsvAdapter()));
        IllegalStateException e = assertThrows(IllegalStateException.class, duplicate::initialize);
        assertTrue(e.getMessage().contains("garmin"));
    }

    @Test
    @DisplayName("Should fail initialization for an adapter without provider name")
    void testInitialize_BlankProvider() {
        ProviderAdapter blank = new ProviderAdapter() {
            @Override
            public String provider() {
                return " ";
            }

            @Override
            public RawFormat format() {
                return RawFormat.DELIMITED_TEXT;
            }

            @Override
            public boolean canHandle(String fileName) {
                return false;
            }

            @Override
            public AdapterParseResult parse(RawFile file) {
                return new AdapterParseResult.Collector().build();
            }
        };
        assertThrows(IllegalStateException.class, () -> TestAdapters.registry(List.of(blank)));
    }

    @Test
    @DisplayName("Should return empty set when no adapters registered")
    void testRegisteredProviders_Empty() {
        ProviderAdapterRegistry empty = TestAdapters.registry(Collections.emptyList());
        assertTrue(empty.getRegisteredProviders().isEmpty());
        assertThrows(UnsupportedFormatException.class, () -> empty.resolve(null, "garmin.csv"));
    }
}
