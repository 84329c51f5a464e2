package com.di.healthnova.insight;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One finding of one rule for one user over one window.
 */
@Value
@Builder
public class InsightResult {
    String ruleId;
    String userId;
    LocalDate windowStart;
    LocalDate windowEnd;
    /** Pearson coefficient at the selected lag. */
    double effectSize;
    double confidence;
    int sampleCount;
    int lagDays;
    String renderedText;
    Instant computedAt;

    public boolean overlaps(InsightResult other) {
        return !windowStart.isAfter(other.windowEnd) && !other.windowStart.isAfter(windowEnd);
    }
}
