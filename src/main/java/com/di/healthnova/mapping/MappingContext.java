package com.di.healthnova.mapping;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Per-file facts the mapper needs besides the raw record itself.
 *
 * @param declaredOffset offset declared for the file; null when the file declares none
 */
public record MappingContext(String userId, ZoneOffset declaredOffset, ZoneId userZone, String sourceFileHash) {

    public MappingContext {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(userZone, "userZone");
    }
}
