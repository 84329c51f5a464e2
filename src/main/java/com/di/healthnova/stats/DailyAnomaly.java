package com.di.healthnova.stats;

import java.time.LocalDate;

/**
 * A day whose value deviates from the baseline of its window by at least the z threshold.
 */
public record DailyAnomaly(LocalDate date, double value, double baselineMean, double zScore) {

    public String direction() {
        return value > baselineMean ? "high" : "low";
    }
}
