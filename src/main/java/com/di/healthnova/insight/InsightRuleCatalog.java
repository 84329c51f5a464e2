package com.di.healthnova.insight;

import com.di.healthnova.model.MetricType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validated, immutable set of insight rules.
 */
public final class InsightRuleCatalog {

    private final String version;
    private final List<InsightRule> rules;

    private InsightRuleCatalog(String version, List<InsightRule> rules) {
        this.version = version;
        this.rules = Collections.unmodifiableList(rules);
    }

    /**
     * @throws IllegalStateException if a rule is incomplete or out of bounds, or two rules share an id
     */
    public static InsightRuleCatalog from(InsightRulesDocument document) {
        String version = document == null || document.getVersion() == null ? "unversioned" : document.getVersion();
        List<InsightRule> rules = document == null || document.getRules() == null ? List.of() : List.copyOf(document.getRules());
        Set<String> ids = new HashSet<>();
        for (InsightRule rule : rules) {
            validate(rule);
            if (!ids.add(rule.getRuleId())) {
                throw new IllegalStateException("Duplicate insight rule id: " + rule.getRuleId());
            }
        }
        return new InsightRuleCatalog(version, rules);
    }

    public static InsightRuleCatalog of(InsightRule... rules) {
        InsightRulesDocument document = new InsightRulesDocument();
        document.setVersion("inline");
        document.setRules(List.of(rules));
        return from(document);
    }

    private static void validate(InsightRule rule) {
        String id = rule.getRuleId();
        if (id == null || id.isBlank()) {
            throw new IllegalStateException("Insight rule without rule_id: " + rule);
        }
        if (rule.getPredicateMetric() == null || rule.getEffectMetric() == null) {
            throw new IllegalStateException("Rule " + id + " needs predicate_metric and effect_metric");
        }
        if (rule.getPredicateMetric().isQualified() && isBlank(rule.getPredicateQualifier())) {
            throw new IllegalStateException("Rule " + id + ": predicate_metric " + rule.getPredicateMetric().getCode()
                    + " needs predicate_qualifier");
        }
        if (rule.getEffectMetric().isQualified() && isBlank(rule.getEffectQualifier())) {
            throw new IllegalStateException("Rule " + id + ": effect_metric " + rule.getEffectMetric().getCode()
                    + " needs effect_qualifier");
        }
        if (rule.getWindowDays() < 2) {
            throw new IllegalStateException("Rule " + id + ": window_days must be >= 2");
        }
        if (rule.getMaxLagDays() < 0) {
            throw new IllegalStateException("Rule " + id + ": max_lag_days must be >= 0");
        }
        if (rule.getMinSamples() < 2) {
            throw new IllegalStateException("Rule " + id + ": min_samples must be >= 2");
        }
        if (rule.getSignificanceThreshold() <= 0 || rule.getSignificanceThreshold() > 1) {
            throw new IllegalStateException("Rule " + id + ": significance_threshold must be in (0, 1]");
        }
        if (rule.getSmoothingDays() < 1) {
            throw new IllegalStateException("Rule " + id + ": smoothing_days must be >= 1");
        }
        if (rule.getTemplate() == null || rule.getTemplate().isBlank()) {
            throw new IllegalStateException("Rule " + id + " has no template");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public String getVersion() {
        return version;
    }

    public List<InsightRule> getRules() {
        return rules;
    }

    /** Metric types any rule reads; the evaluation snapshot covers exactly these. */
    public Set<MetricType> referencedMetricTypes() {
        Set<MetricType> types = EnumSet.noneOf(MetricType.class);
        for (InsightRule rule : rules) {
            types.add(rule.getPredicateMetric());
            types.add(rule.getEffectMetric());
        }
        return types;
    }
}
