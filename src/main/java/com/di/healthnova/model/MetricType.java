package com.di.healthnova.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Canonical metric vocabulary shared by every provider.
 *
 * <p>Each type declares its canonical (SI-normalized) unit, whether it is additive (daily values are
 * sums and missing days count as zero) and the range of values considered physically plausible.
 * Records of a qualified type always carry a qualifier (calories: intake or burned; macro nutrients:
 * protein, carbs, ...; sleep stages: deep, light, rem, wake), and values of different qualifiers never
 * mix in one series.
 */
public enum MetricType {

    HEART_RATE("heart_rate", UnitDimension.FREQUENCY, "bpm", false, 25, 250, false),
    RESTING_HEART_RATE("resting_heart_rate", UnitDimension.FREQUENCY, "bpm", false, 25, 200, false),
    HRV("hrv", UnitDimension.DURATION, "ms", false, 1, 500, false),
    STEPS("steps", UnitDimension.COUNT, "count", true, 0, 100_000, false),
    DISTANCE("distance", UnitDimension.LENGTH, "m", true, 0, 250_000, false),
    CALORIES("calories", UnitDimension.ENERGY, "kJ", true, 0, 41_840, true),
    ACTIVE_MINUTES("active_minutes", UnitDimension.DURATION, "s", true, 0, 86_400, false),
    SLEEP_STAGE("sleep_stage", UnitDimension.DURATION, "s", true, 0, 86_400, true),
    SLEEP_DURATION("sleep_duration", UnitDimension.DURATION, "s", false, 0, 86_400, false),
    SLEEP_ONSET("sleep_onset", UnitDimension.TIME_OF_DAY, "s", false, -43_200, 43_200, false),
    SLEEP_END("sleep_end", UnitDimension.TIME_OF_DAY, "s", false, -43_200, 43_200, false),
    MACRO_NUTRIENT("macro_nutrient", UnitDimension.MASS, "g", true, 0, 5_000, true),
    WEIGHT("weight", UnitDimension.MASS, "kg", false, 2, 500, false),
    SPO2("spo2", UnitDimension.PERCENT, "%", false, 70, 100, false),
    READINESS_SCORE("readiness_score", UnitDimension.SCORE, "score", false, 0, 100, false);

    private final String code;
    private final UnitDimension dimension;
    private final String canonicalUnit;
    private final boolean additive;
    private final double minPlausible;
    private final double maxPlausible;
    private final boolean qualified;

    MetricType(String code, UnitDimension dimension, String canonicalUnit, boolean additive,
               double minPlausible, double maxPlausible, boolean qualified) {
        this.code = code;
        this.dimension = dimension;
        this.canonicalUnit = canonicalUnit;
        this.additive = additive;
        this.minPlausible = minPlausible;
        this.maxPlausible = maxPlausible;
        this.qualified = qualified;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public UnitDimension getDimension() {
        return dimension;
    }

    public String getCanonicalUnit() {
        return canonicalUnit;
    }

    public boolean isAdditive() {
        return additive;
    }

    public boolean isQualified() {
        return qualified;
    }

    public boolean isPlausible(double value) {
        return value >= minPlausible && value <= maxPlausible;
    }

    public double getMinPlausible() {
        return minPlausible;
    }

    public double getMaxPlausible() {
        return maxPlausible;
    }

    /**
     * Resolves a metric type from its snake_case code or enum name (case-insensitive).
     *
     * @throws IllegalArgumentException if no metric type matches
     */
    @JsonCreator
    public static MetricType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Metric type cannot be null or blank");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (MetricType type : values()) {
            if (type.code.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown metric type: '" + code + "'");
    }
}
