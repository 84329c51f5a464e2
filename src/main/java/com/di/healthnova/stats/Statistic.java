package com.di.healthnova.stats;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Aggregate computed over a rolling window of daily values.
 */
public enum Statistic {
    MEAN,
    /** Sample standard deviation (n-1); needs at least two values. */
    STDDEV,
    SUM,
    /** Number of days in the window that have a value. */
    COUNT;

    @JsonCreator
    public static Statistic fromString(String value) {
        if (value == null || value.isBlank()) {
            return MEAN;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
