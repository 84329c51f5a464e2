package com.di.healthnova.profile;

import com.di.healthnova.config.HealthNovaProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfiguredUserProfileProvider Tests")
class ConfiguredUserProfileProviderTest {

    @Test
    @DisplayName("Should return a user's configured zone and the default otherwise")
    void testZoneFor() {
        HealthNovaProperties properties = new HealthNovaProperties();
        properties.getProfiles().setDefaultZone("America/New_York");
        properties.getProfiles().getZones().put("alice", "Europe/Berlin");

        ConfiguredUserProfileProvider provider = new ConfiguredUserProfileProvider(properties);

        assertEquals(ZoneId.of("Europe/Berlin"), provider.zoneFor("alice"));
        assertEquals(ZoneId.of("America/New_York"), provider.zoneFor("bob"));
        assertEquals(ZoneId.of("America/New_York"), provider.zoneFor(null));
    }

    @Test
    @DisplayName("Should fail at startup on an invalid zone")
    void testInvalidZone() {
        HealthNovaProperties properties = new HealthNovaProperties();
        properties.getProfiles().getZones().put("alice", "Mars/Olympus");

        assertThrows(IllegalStateException.class, () -> new ConfiguredUserProfileProvider(properties));
    }
}
