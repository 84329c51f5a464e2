package com.di.healthnova.mapping;

import com.di.healthnova.exception.SchemaMismatchException;
import com.di.healthnova.exception.UnitConversionException;
import com.di.healthnova.model.MetricType;
import com.di.healthnova.model.UnitDimension;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts raw values to the canonical unit of their metric type.
 *
 * <p>Every unit is a linear factor against its dimension's base unit (seconds, metres, grams, kilojoules),
 * held as {@link BigDecimal} so that conversions such as miles to metres are exact. Unit names are looked up
 * case-sensitively first ({@code Cal} is the food calorie) and then case-insensitively. Units that mean
 * different things to different providers are refused rather than guessed.
 */
@Component
public class UnitConverter {

    /** Source unit of time-of-day metrics: the raw value is a clock reading, not a number. */
    public static final String CLOCK = "clock";

    private static final Set<String> AMBIGUOUS = Set.of("cal", "oz", "ton", "tons", "t", "pt", "gal", "cup");

    private static final Map<UnitDimension, Map<String, BigDecimal>> FACTORS = new EnumMap<>(UnitDimension.class);

    static {
        unit(UnitDimension.COUNT, "1", "count", "steps", "step", "");
        unit(UnitDimension.FREQUENCY, "1", "bpm", "count/min", "beats/min", "/min");
        unit(UnitDimension.DURATION, "0.001", "ms");
        unit(UnitDimension.DURATION, "1", "s", "sec", "second", "seconds");
        unit(UnitDimension.DURATION, "60", "min", "mins", "minute", "minutes");
        unit(UnitDimension.DURATION, "3600", "h", "hr", "hour", "hours");
        unit(UnitDimension.LENGTH, "1", "m", "meter", "meters", "metre", "metres");
        unit(UnitDimension.LENGTH, "1000", "km");
        unit(UnitDimension.LENGTH, "0.01", "cm");
        unit(UnitDimension.LENGTH, "0.001", "mm");
        unit(UnitDimension.LENGTH, "1609.344", "mi", "mile", "miles");
        unit(UnitDimension.LENGTH, "0.9144", "yd");
        unit(UnitDimension.LENGTH, "0.3048", "ft");
        unit(UnitDimension.MASS, "1", "g", "gram", "grams");
        unit(UnitDimension.MASS, "0.001", "mg");
        unit(UnitDimension.MASS, "1000", "kg");
        unit(UnitDimension.MASS, "453.59237", "lb", "lbs");
        unit(UnitDimension.ENERGY, "1", "kJ", "kj");
        unit(UnitDimension.ENERGY, "0.001", "J", "j");
        unit(UnitDimension.ENERGY, "4.184", "kcal", "Cal", "Calories");
        unit(UnitDimension.PERCENT, "1", "%", "percent");
        unit(UnitDimension.PERCENT, "100", "fraction");
        unit(UnitDimension.SCORE, "1", "score", "points", "");
    }

    private static void unit(UnitDimension dimension, String factor, String... names) {
        Map<String, BigDecimal> byName = FACTORS.computeIfAbsent(dimension, d -> new HashMap<>());
        for (String name : names) {
            byName.put(name, new BigDecimal(factor));
        }
    }

    /**
     * Converts {@code value}, expressed in {@code sourceUnit}, to the canonical unit of {@code metricType}.
     *
     * @throws SchemaMismatchException if the unit is unknown, ambiguous or of another dimension
     */
    public BigDecimal toCanonical(BigDecimal value, String sourceUnit, MetricType metricType) {
        BigDecimal from = factor(sourceUnit, metricType);
        BigDecimal to = factor(metricType.getCanonicalUnit(), metricType);
        if (from.compareTo(to) == 0) {
            return value;
        }
        BigDecimal base = value.multiply(from);
        try {
            return base.divide(to);
        } catch (ArithmeticException nonTerminating) {
            return base.divide(to, MathContext.DECIMAL64);
        }
    }

    /**
     * Parses a raw numeric value.
     *
     * @throws UnitConversionException if the value is not a number
     */
    public BigDecimal parse(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new UnitConversionException("Empty value");
        }
        try {
            return new BigDecimal(rawValue.trim());
        } catch (NumberFormatException e) {
            throw new UnitConversionException("Not a number: '" + rawValue + "'", e);
        }
    }

    /** True when {@code unit} is an unambiguous unit of the metric's dimension. */
    public boolean supports(String unit, MetricType metricType) {
        if (metricType.getDimension() == UnitDimension.TIME_OF_DAY) {
            return CLOCK.equals(unit);
        }
        try {
            factor(unit, metricType);
            return true;
        } catch (SchemaMismatchException e) {
            return false;
        }
    }

    private BigDecimal factor(String unit, MetricType metricType) {
        UnitDimension dimension = metricType.getDimension();
        if (dimension == UnitDimension.TIME_OF_DAY) {
            throw new SchemaMismatchException(metricType.getCode() + " takes clock readings, not numeric units");
        }
        String name = unit == null ? "" : unit.trim();
        Map<String, BigDecimal> byName = FACTORS.getOrDefault(dimension, Map.of());
        BigDecimal exact = byName.get(name);
        if (exact != null) {
            return exact;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (AMBIGUOUS.contains(lower)) {
            throw new SchemaMismatchException("Ambiguous unit '" + name + "' for " + metricType.getCode());
        }
        BigDecimal folded = byName.get(lower);
        if (folded != null) {
            return folded;
        }
        if (name.isEmpty()) {
            throw new SchemaMismatchException("No unit given for " + metricType.getCode());
        }
        for (Map.Entry<UnitDimension, Map<String, BigDecimal>> other : FACTORS.entrySet()) {
            if (other.getKey() != dimension && (other.getValue().containsKey(name) || other.getValue().containsKey(lower))) {
                throw new SchemaMismatchException(String.format("Unit '%s' is a %s unit, %s expects %s",
                        name, other.getKey(), metricType.getCode(), dimension));
            }
        }
        throw new SchemaMismatchException("Unknown unit '" + name + "' for " + metricType.getCode());
    }
}
