package com.di.healthnova.stats;

import com.di.healthnova.model.MetricSeries;
import com.di.healthnova.model.SeriesPoint;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collapses a series into one value per calendar day of the user's zone: the sum for additive metric types,
 * the mean otherwise. Additive series get an explicit zero for every empty day between their first and last
 * day; other series simply have no entry for empty days.
 */
public final class DailyAggregator {

    private DailyAggregator() {
    }

    public static List<DailyValue> aggregate(MetricSeries series, ZoneId zone) {
        Map<LocalDate, double[]> byDay = new TreeMap<>();
        for (SeriesPoint point : series.getPoints()) {
            LocalDate day = point.timestamp().atZone(zone).toLocalDate();
            double[] acc = byDay.computeIfAbsent(day, d -> new double[2]);
            acc[0] += point.value();
            acc[1] += 1;
        }
        boolean additive = series.getMetricType().isAdditive();
        List<DailyValue> days = new ArrayList<>(byDay.size());
        LocalDate previous = null;
        for (Map.Entry<LocalDate, double[]> e : byDay.entrySet()) {
            if (additive && previous != null) {
                for (LocalDate gap = previous.plusDays(1); gap.isBefore(e.getKey()); gap = gap.plusDays(1)) {
                    days.add(new DailyValue(gap, 0));
                }
            }
            double[] acc = e.getValue();
            days.add(new DailyValue(e.getKey(), additive ? acc[0] : acc[0] / acc[1]));
            previous = e.getKey();
        }
        return days;
    }
}
