package com.di.healthnova.exception;

import com.di.healthnova.model.MetricType;

/**
 * Converted value lies outside the plausible range of its metric type (e.g. 400 bpm).
 */
public class ValueOutOfRangeException extends UnitConversionException {

    private final MetricType metricType;
    private final double value;

    public ValueOutOfRangeException(MetricType metricType, double value) {
        super(String.format("Implausible %s value %s %s (allowed %s..%s)", metricType.getCode(), value,
                metricType.getCanonicalUnit(), metricType.getMinPlausible(), metricType.getMaxPlausible()));
        this.metricType = metricType;
        this.value = value;
    }

    public MetricType getMetricType() {
        return metricType;
    }

    public double getValue() {
        return value;
    }
}
