package com.di.healthnova.mapping;

import com.di.healthnova.model.MetricType;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the mapping table YAML ({@code mappings[*]}).
 */
@Data
@NoArgsConstructor
public class FieldMapping {
    /** Provider name as registered by its adapter (fitbit, cronometer, garmin, apple_health). */
    private String provider;
    /** Raw field name as the adapter emits it. Matched case-insensitively. */
    private String field;
    private MetricType metric;
    /** Source unit used when the raw record carries no unit hint. */
    private String unit;
    /** Sub-kind folded into the natural key (protein, deep, …). */
    private String qualifier;
    @JsonProperty("timestamp_policy")
    private TimestampPolicy timestampPolicy = TimestampPolicy.EMBEDDED_OR_DECLARED;
}
