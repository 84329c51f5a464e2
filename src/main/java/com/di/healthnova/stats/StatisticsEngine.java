package com.di.healthnova.stats;

import com.di.healthnova.config.HealthNovaProperties;
import com.di.healthnova.exception.InsufficientDataException;
import com.di.healthnova.model.MetricSeries;
import com.di.healthnova.model.MetricType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Windowed statistics over daily aggregates of metric series.
 *
 * <p>Windows are right-aligned trailing windows of calendar days. Days without a value contribute nothing;
 * additive series have already been zero-filled between their first and last day by {@link DailyAggregator}.
 * All methods are pure; the engine holds configuration only.
 */
@Slf4j
@Component
public class StatisticsEngine {

    private final HealthNovaProperties.Statistics settings;

    public StatisticsEngine(HealthNovaProperties properties) {
        this.settings = properties.getStatistics();
    }

    public List<DailyValue> daily(MetricSeries series, ZoneId zone) {
        return DailyAggregator.aggregate(series, zone);
    }

    public List<DailyValue> rolling(MetricSeries series, int windowDays, Statistic stat, ZoneId zone) {
        return rolling(daily(series, zone), windowDays, stat);
    }

    /**
     * One output per day between the first and last input day whose window holds enough values
     * (one, or two for {@link Statistic#STDDEV}).
     */
    public List<DailyValue> rolling(List<DailyValue> daily, int windowDays, Statistic stat) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be >= 1, was " + windowDays);
        }
        NavigableMap<LocalDate, Double> byDay = index(daily);
        List<DailyValue> out = new ArrayList<>();
        if (byDay.isEmpty()) {
            return out;
        }
        for (LocalDate day = byDay.firstKey(); !day.isAfter(byDay.lastKey()); day = day.plusDays(1)) {
            NavigableMap<LocalDate, Double> window = byDay.subMap(day.minusDays(windowDays - 1L), true, day, true);
            if (window.isEmpty() || (stat == Statistic.STDDEV && window.size() < 2)) {
                continue;
            }
            out.add(new DailyValue(day, compute(window.values(), stat)));
        }
        return out;
    }

    public CorrelationResult laggedCorrelation(MetricSeries a, MetricSeries b, int lagDays, int windowDays, ZoneId zone)
            throws InsufficientDataException {
        return laggedCorrelation(daily(a, zone), daily(b, zone), lagDays, windowDays, null);
    }

    /**
     * Pearson correlation of {@code a} at day d against {@code b} at day d + lagDays, for every such pair whose
     * {@code b} day lies in the {@code windowDays} days ending at {@code endDate}.
     *
     * @param endDate last day of the window; null for the last day of {@code b}
     * @throws InsufficientDataException if fewer than two pairs exist or either side has zero variance
     */
    public CorrelationResult laggedCorrelation(List<DailyValue> a, List<DailyValue> b, int lagDays, int windowDays,
                                               LocalDate endDate) throws InsufficientDataException {
        if (lagDays < 0 || windowDays < 1) {
            throw new IllegalArgumentException("lagDays must be >= 0 and windowDays >= 1");
        }
        NavigableMap<LocalDate, Double> effect = index(b);
        if (effect.isEmpty() || a.isEmpty()) {
            throw new InsufficientDataException("Empty series", 0);
        }
        LocalDate end = endDate != null ? endDate : effect.lastKey();
        LocalDate start = end.minusDays(windowDays - 1L);

        List<double[]> pairs = new ArrayList<>();
        for (DailyValue predicate : a) {
            LocalDate effectDay = predicate.date().plusDays(lagDays);
            Double effectValue = effect.get(effectDay);
            if (effectValue != null && !effectDay.isBefore(start) && !effectDay.isAfter(end)) {
                pairs.add(new double[] {predicate.value(), effectValue});
            }
        }
        int n = pairs.size();
        if (n < 2) {
            throw new InsufficientDataException("Only " + n + " paired day(s) at lag " + lagDays, n);
        }
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = pairs.get(i)[0];
            y[i] = pairs.get(i)[1];
        }
        if (new DescriptiveStatistics(x).getVariance() == 0.0 || new DescriptiveStatistics(y).getVariance() == 0.0) {
            throw new InsufficientDataException("Series without variance at lag " + lagDays, n);
        }
        double r = new PearsonsCorrelation().correlation(x, y);
        return CorrelationResult.of(r, n, lagDays, start, end);
    }

    public ConsistencyAssessment consistency(MetricSeries series, ZoneId zone) throws InsufficientDataException {
        return consistency(series, zone, settings.getConsistencyWindowDays(), settings.getConsistencyThresholdMinutes());
    }

    /**
     * Spread of the daily values of a seconds-based metric (bedtime, wake time, sleep duration) over the last
     * {@code windowDays} days of the series.
     *
     * @throws InsufficientDataException with fewer than two days in the window
     */
    public ConsistencyAssessment consistency(MetricSeries series, ZoneId zone, int windowDays, double thresholdMinutes)
            throws InsufficientDataException {
        if (!"s".equals(series.getMetricType().getCanonicalUnit())) {
            throw new IllegalArgumentException("Consistency needs a seconds-based metric, got " + series.getMetricType().getCode());
        }
        NavigableMap<LocalDate, Double> byDay = index(daily(series, zone));
        if (byDay.isEmpty()) {
            throw new InsufficientDataException("No data for " + series.getMetricType().getCode(), 0);
        }
        LocalDate end = byDay.lastKey();
        LocalDate start = end.minusDays(windowDays - 1L);
        NavigableMap<LocalDate, Double> window = byDay.subMap(start, true, end, true);
        if (window.size() < 2) {
            throw new InsufficientDataException("Consistency needs two days, found " + window.size(), window.size());
        }
        DescriptiveStatistics stats = new DescriptiveStatistics();
        window.values().forEach(v -> stats.addValue(v / 60.0));
        return new ConsistencyAssessment(start, end, window.size(), stats.getMean(), stats.getStandardDeviation(),
                thresholdMinutes);
    }

    public WorkloadRatio acuteChronicRatio(MetricSeries series, ZoneId zone, LocalDate asOf) throws InsufficientDataException {
        return acuteChronicRatio(series, zone, asOf, settings.getAcuteDays(), settings.getChronicDays(),
                settings.getElevatedRatio());
    }

    /**
     * Acute total against the chronic window's average per acute-length period. The series must cover the
     * whole chronic window; days without data inside it count as zero.
     *
     * @param asOf last day of both windows; null for the last day of the series
     * @throws InsufficientDataException if the series starts inside the chronic window or the chronic load is zero
     */
    public WorkloadRatio acuteChronicRatio(MetricSeries series, ZoneId zone, LocalDate asOf, int acuteDays,
                                           int chronicDays, double elevatedThreshold) throws InsufficientDataException {
        MetricType type = series.getMetricType();
        if (!type.isAdditive()) {
            throw new IllegalArgumentException("Workload ratio needs an additive metric, got " + type.getCode());
        }
        if (acuteDays < 1 || chronicDays < acuteDays) {
            throw new IllegalArgumentException("Need 1 <= acuteDays <= chronicDays");
        }
        NavigableMap<LocalDate, Double> byDay = index(daily(series, zone));
        if (byDay.isEmpty()) {
            throw new InsufficientDataException("No data for " + type.getCode(), 0);
        }
        LocalDate end = asOf != null ? asOf : byDay.lastKey();
        LocalDate chronicStart = end.minusDays(chronicDays - 1L);
        if (byDay.firstKey().isAfter(chronicStart)) {
            throw new InsufficientDataException("History starts " + byDay.firstKey() + ", chronic window needs " + chronicStart,
                    byDay.headMap(end, true).size());
        }
        double acute = sum(byDay.subMap(end.minusDays(acuteDays - 1L), true, end, true));
        double chronic = sum(byDay.subMap(chronicStart, true, end, true));
        double chronicPerPeriod = chronic * acuteDays / chronicDays;
        if (chronicPerPeriod == 0.0) {
            throw new InsufficientDataException("Chronic load is zero", chronicDays);
        }
        return new WorkloadRatio(end, acute, chronicPerPeriod, acute / chronicPerPeriod, elevatedThreshold);
    }

    public List<DailyAnomaly> anomalies(MetricSeries series, ZoneId zone) {
        return anomalies(series, zone, settings.getAnomalyBaselineDays(), settings.getAnomalyZThreshold());
    }

    /**
     * Days of the last {@code baselineDays} days whose value lies at least {@code zThreshold} standard deviations
     * from that window's mean. Empty when the window has fewer than three days or no spread.
     */
    public List<DailyAnomaly> anomalies(MetricSeries series, ZoneId zone, int baselineDays, double zThreshold) {
        NavigableMap<LocalDate, Double> byDay = index(daily(series, zone));
        List<DailyAnomaly> out = new ArrayList<>();
        if (byDay.isEmpty()) {
            return out;
        }
        NavigableMap<LocalDate, Double> window = byDay.subMap(byDay.lastKey().minusDays(baselineDays - 1L), true,
                byDay.lastKey(), true);
        DescriptiveStatistics stats = new DescriptiveStatistics();
        window.values().forEach(stats::addValue);
        double sd = stats.getStandardDeviation();
        if (window.size() < 3 || sd == 0.0) {
            log.debug("No anomaly baseline for {}: {} day(s), sd={}", series.getMetricType().getCode(), window.size(), sd);
            return out;
        }
        double mean = stats.getMean();
        window.forEach((day, value) -> {
            double z = (value - mean) / sd;
            if (Math.abs(z) >= zThreshold) {
                out.add(new DailyAnomaly(day, value, mean, z));
            }
        });
        return out;
    }

    private static NavigableMap<LocalDate, Double> index(List<DailyValue> daily) {
        NavigableMap<LocalDate, Double> byDay = new TreeMap<>();
        for (DailyValue v : daily) {
            byDay.put(v.date(), v.value());
        }
        return byDay;
    }

    private static double compute(Iterable<Double> values, Statistic stat) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        values.forEach(stats::addValue);
        switch (stat) {
            case MEAN: return stats.getMean();
            case STDDEV: return stats.getStandardDeviation();
            case SUM: return stats.getSum();
            case COUNT: return stats.getN();
            default: throw new IllegalArgumentException("Unsupported statistic " + stat);
        }
    }

    private static double sum(NavigableMap<LocalDate, Double> window) {
        double total = 0;
        for (double v : window.values()) {
            total += v;
        }
        return total;
    }
}
