package com.di.healthnova.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only, strictly time-ordered view of one user's records for one metric type.
 *
 * <p>Records from distinct providers may share an instant. The series holds one point per instant:
 * same-instant values are averaged, with no provider taking precedence. A {@link SeriesSelector} with a
 * provider restricts the view to a single source.
 */
public final class MetricSeries {

    private final String userId;
    private final MetricType metricType;
    private final List<SeriesPoint> points;

    private MetricSeries(String userId, MetricType metricType, List<SeriesPoint> points) {
        this.userId = userId;
        this.metricType = metricType;
        this.points = Collections.unmodifiableList(points);
    }

    public static MetricSeries of(String userId, MetricType metricType, Collection<CanonicalMetricRecord> records) {
        return of(userId, SeriesSelector.of(metricType), records);
    }

    /**
     * Builds a series from the records of the given user that match the selector; other records are ignored.
     */
    public static MetricSeries of(String userId, SeriesSelector selector, Collection<CanonicalMetricRecord> records) {
        Map<Instant, double[]> byInstant = new TreeMap<>();
        for (CanonicalMetricRecord r : records) {
            if (!r.getUserId().equals(userId) || !selector.matches(r)) continue;
            double[] acc = byInstant.computeIfAbsent(r.getTimestamp(), k -> new double[2]);
            acc[0] += r.getValue();
            acc[1] += 1;
        }
        List<SeriesPoint> points = new ArrayList<>(byInstant.size());
        byInstant.forEach((instant, acc) -> points.add(new SeriesPoint(instant, acc[0] / acc[1])));
        return new MetricSeries(userId, selector.metricType(), points);
    }

    public static MetricSeries ofPoints(String userId, MetricType metricType, List<SeriesPoint> points) {
        List<SeriesPoint> sorted = new ArrayList<>(points);
        sorted.sort((a, b) -> a.timestamp().compareTo(b.timestamp()));
        for (int i = 1; i < sorted.size(); i++) {
            if (!sorted.get(i).timestamp().isAfter(sorted.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("Duplicate timestamp in series: " + sorted.get(i).timestamp());
            }
        }
        return new MetricSeries(userId, metricType, sorted);
    }

    public String getUserId() {
        return userId;
    }

    public MetricType getMetricType() {
        return metricType;
    }

    public List<SeriesPoint> getPoints() {
        return points;
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }
}
