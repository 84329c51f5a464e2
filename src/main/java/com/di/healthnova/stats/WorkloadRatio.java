package com.di.healthnova.stats;

import lombok.Value;

import java.time.LocalDate;

/**
 * Acute:chronic workload ratio: the acute window's total against the chronic window's average per
 * acute-length period (e.g. 7-day total vs 28-day total / 4).
 */
@Value
public class WorkloadRatio {
    LocalDate asOf;
    double acuteTotal;
    double chronicAveragePerPeriod;
    double ratio;
    double elevatedThreshold;

    public boolean isElevated() {
        return ratio > elevatedThreshold;
    }
}
