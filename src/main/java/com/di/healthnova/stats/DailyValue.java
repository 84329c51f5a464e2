package com.di.healthnova.stats;

import java.time.LocalDate;

/**
 * One calendar day's aggregate (or rolling statistic) of a series, in the user's zone.
 */
public record DailyValue(LocalDate date, double value) {
}
