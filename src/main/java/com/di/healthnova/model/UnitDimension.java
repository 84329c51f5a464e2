package com.di.healthnova.model;

/**
 * Physical dimension of a metric. Unit conversion is only defined between units of the same dimension.
 */
public enum UnitDimension {
    COUNT,
    FREQUENCY,
    DURATION,
    LENGTH,
    MASS,
    ENERGY,
    PERCENT,
    SCORE,
    /** Local clock time of an event (sleep onset / end), read from a clock value rather than converted. */
    TIME_OF_DAY
}
