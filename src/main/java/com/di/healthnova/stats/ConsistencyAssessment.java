package com.di.healthnova.stats;

import lombok.Value;

import java.time.LocalDate;

/**
 * Day-to-day spread of a timing or duration metric (e.g. bedtime) over a window, in minutes.
 */
@Value
public class ConsistencyAssessment {
    LocalDate windowStart;
    LocalDate windowEnd;
    int days;
    /** Mean of the daily values, minutes (for time-of-day metrics: minutes from midnight, negative before). */
    double meanMinutes;
    double stddevMinutes;
    double thresholdMinutes;

    public boolean isConsistent() {
        return stddevMinutes < thresholdMinutes;
    }
}
