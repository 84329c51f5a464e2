package com.di.healthnova.model;

import java.time.Instant;

/**
 * A single (instant, value) point of a {@link MetricSeries}.
 */
public record SeriesPoint(Instant timestamp, double value) {
}
