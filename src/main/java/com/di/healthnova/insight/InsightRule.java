package com.di.healthnova.insight;

import com.di.healthnova.model.MetricType;
import com.di.healthnova.model.SeriesSelector;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Declarative insight rule, one entry of {@code insight-rules.yml}. Static configuration.
 */
@Data
@NoArgsConstructor
public class InsightRule {
    @JsonProperty("rule_id")
    private String ruleId;

    @JsonProperty("predicate_metric")
    private MetricType predicateMetric;
    @JsonProperty("predicate_qualifier")
    private String predicateQualifier;
    @JsonProperty("predicate_label")
    private String predicateLabel;

    @JsonProperty("effect_metric")
    private MetricType effectMetric;
    @JsonProperty("effect_qualifier")
    private String effectQualifier;
    @JsonProperty("effect_label")
    private String effectLabel;

    /** Restricts both series to one provider; null uses every provider. */
    private String provider;

    @JsonProperty("window_days")
    private int windowDays = 28;
    @JsonProperty("max_lag_days")
    private int maxLagDays;
    @JsonProperty("min_samples")
    private int minSamples = 10;
    /** Minimum confidence (1 - p) a correlation needs to be reported. */
    @JsonProperty("significance_threshold")
    private double significanceThreshold = 0.95;
    /** Trailing mean applied to both daily series before correlating; 1 means none. */
    @JsonProperty("smoothing_days")
    private int smoothingDays = 1;

    private String template;

    public SeriesSelector predicateSelector() {
        return new SeriesSelector(predicateMetric, predicateQualifier, provider);
    }

    public SeriesSelector effectSelector() {
        return new SeriesSelector(effectMetric, effectQualifier, provider);
    }

    public String predicateDisplayName() {
        return predicateLabel != null && !predicateLabel.isBlank() ? predicateLabel : predicateSelector().describe();
    }

    public String effectDisplayName() {
        return effectLabel != null && !effectLabel.isBlank() ? effectLabel : effectSelector().describe();
    }
}
