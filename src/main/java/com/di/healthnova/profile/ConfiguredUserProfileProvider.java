package com.di.healthnova.profile;

import com.di.healthnova.config.HealthNovaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves user zones from {@code healthnova.profiles}. Unknown users get the default zone.
 */
@Slf4j
@Component
public class ConfiguredUserProfileProvider implements UserProfileProvider {

    private final ZoneId defaultZone;
    private final Map<String, ZoneId> zones = new ConcurrentHashMap<>();

    public ConfiguredUserProfileProvider(HealthNovaProperties properties) {
        this.defaultZone = ZoneId.of(properties.getProfiles().getDefaultZone());
        properties.getProfiles().getZones().forEach((user, zone) -> {
            try {
                zones.put(user, ZoneId.of(zone));
            } catch (DateTimeException e) {
                throw new IllegalStateException("Invalid zone '" + zone + "' configured for user '" + user + "'", e);
            }
        });
        log.info("[PROFILE] default zone {}, {} user override(s)", defaultZone, zones.size());
    }

    @Override
    public ZoneId zoneFor(String userId) {
        return userId == null ? defaultZone : zones.getOrDefault(userId, defaultZone);
    }
}
