package com.di.healthnova.model;

/**
 * Selects which records of a user form a series: the metric type, its qualifier (e.g. protein) and
 * optionally a single provider. A qualified metric type needs a qualifier, so that protein and fat, or
 * intake and burned calories, never average into one series; a null provider matches every provider.
 */
public record SeriesSelector(MetricType metricType, String qualifier, String provider) {

    public SeriesSelector {
        if (metricType == null) {
            throw new IllegalArgumentException("Metric type cannot be null");
        }
        qualifier = blankToNull(qualifier);
        provider = blankToNull(provider);
        if (metricType.isQualified() && qualifier == null) {
            throw new IllegalArgumentException("Metric type " + metricType.getCode() + " needs a qualifier");
        }
    }

    public static SeriesSelector of(MetricType metricType) {
        return new SeriesSelector(metricType, null, null);
    }

    public boolean matches(CanonicalMetricRecord record) {
        return record.getMetricType() == metricType
                && (qualifier == null || qualifier.equalsIgnoreCase(record.getQualifier()))
                && (provider == null || provider.equalsIgnoreCase(record.getSourceProvider()));
    }

    public String describe() {
        StringBuilder sb = new StringBuilder(metricType.getCode());
        if (qualifier != null) sb.append(':').append(qualifier);
        if (provider != null) sb.append('@').append(provider);
        return sb.toString();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
