package com.di.healthnova.insight;

import com.di.healthnova.exception.InsufficientDataException;
import com.di.healthnova.model.MetricSeries;
import com.di.healthnova.stats.CorrelationResult;
import com.di.healthnova.stats.DailyValue;
import com.di.healthnova.stats.Statistic;
import com.di.healthnova.stats.StatisticsEngine;
import com.di.healthnova.store.StoreSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates one rule against a snapshot of a user's data.
 *
 * <p>Both metrics are reduced to daily values (optionally smoothed), then correlated for every lag from 0 to
 * max_lag_days over the rule's window, which ends on the last day of the effect series. Among the lags that
 * reach min_samples and the significance threshold, the strongest |r| wins; ties go to the shorter lag.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InsightEngine {

    private final StatisticsEngine statistics;
    private final Clock clock;

    /**
     * @return the rule's finding, or empty when data is insufficient or nothing is significant
     */
    public Optional<InsightResult> evaluate(InsightRule rule, StoreSnapshot snapshot, ZoneId zone, CancellationToken token) {
        List<DailyValue> predicate = prepare(snapshot.series(rule.predicateSelector()), rule, zone);
        List<DailyValue> effect = prepare(snapshot.series(rule.effectSelector()), rule, zone);
        if (predicate.isEmpty() || effect.isEmpty()) {
            log.debug("[INSIGHT] rule={} user={}: no data", rule.getRuleId(), snapshot.getUserId());
            return Optional.empty();
        }
        LocalDate end = effect.get(effect.size() - 1).date();

        CorrelationResult best = null;
        for (int lag = 0; lag <= rule.getMaxLagDays(); lag++) {
            token.checkpoint();
            CorrelationResult candidate;
            try {
                candidate = statistics.laggedCorrelation(predicate, effect, lag, rule.getWindowDays(), end);
            } catch (InsufficientDataException e) {
                log.debug("[INSIGHT] rule={} lag={}: {}", rule.getRuleId(), lag, e.getMessage());
                continue;
            }
            if (candidate.getSampleCount() < rule.getMinSamples()
                    || candidate.getConfidence() < rule.getSignificanceThreshold()) {
                continue;
            }
            if (best == null || Math.abs(candidate.getCoefficient()) > Math.abs(best.getCoefficient())) {
                best = candidate;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(InsightResult.builder()
                .ruleId(rule.getRuleId())
                .userId(snapshot.getUserId())
                .windowStart(best.getWindowStart())
                .windowEnd(best.getWindowEnd())
                .effectSize(best.getCoefficient())
                .confidence(best.getConfidence())
                .sampleCount(best.getSampleCount())
                .lagDays(best.getLagDays())
                .renderedText(render(rule, best))
                .computedAt(clock.instant())
                .build());
    }

    private List<DailyValue> prepare(MetricSeries series, InsightRule rule, ZoneId zone) {
        List<DailyValue> daily = statistics.daily(series, zone);
        return rule.getSmoothingDays() > 1 ? statistics.rolling(daily, rule.getSmoothingDays(), Statistic.MEAN) : daily;
    }

    static String render(InsightRule rule, CorrelationResult result) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("predicate", rule.predicateDisplayName());
        values.put("effect", rule.effectDisplayName());
        values.put("direction", result.getCoefficient() >= 0 ? "higher" : "lower");
        values.put("lag", Integer.toString(result.getLagDays()));
        values.put("coefficient", String.format(Locale.ROOT, "%.2f", result.getCoefficient()));
        values.put("confidence", String.format(Locale.ROOT, "%.0f%%", result.getConfidence() * 100));
        values.put("samples", Integer.toString(result.getSampleCount()));
        values.put("window_days", Integer.toString(rule.getWindowDays()));
        return TemplateRenderer.render(rule.getTemplate(), values);
    }
}
