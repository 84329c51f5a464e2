package com.di.healthnova.mapping;

import com.di.healthnova.model.MetricType;
import lombok.Value;

/**
 * Immutable, validated form of a {@link FieldMapping}.
 */
@Value
public class CanonicalMapping {
    String provider;
    String field;
    MetricType metricType;
    String sourceUnit;
    String qualifier;
    TimestampPolicy timestampPolicy;
}
