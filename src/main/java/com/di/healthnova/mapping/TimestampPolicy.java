package com.di.healthnova.mapping;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * How a raw timestamp without its own offset is placed on the UTC timeline.
 */
public enum TimestampPolicy {

    /** Offset in the raw value, else the offset declared for the file, else the user's profile zone. */
    EMBEDDED_OR_DECLARED,

    /** Offset in the raw value, else UTC. For providers that export UTC wall-clock values. */
    UTC;

    @JsonCreator
    public static TimestampPolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            return EMBEDDED_OR_DECLARED;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
