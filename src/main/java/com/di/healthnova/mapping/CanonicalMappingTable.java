package com.di.healthnova.mapping;

import com.di.healthnova.model.MetricType;
import com.di.healthnova.model.UnitDimension;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Versioned lookup (provider, raw field) → canonical mapping. Built once from the YAML document and
 * never mutated afterwards.
 */
public final class CanonicalMappingTable {

    private final String version;
    private final Map<String, CanonicalMapping> byKey;

    private CanonicalMappingTable(String version, Map<String, CanonicalMapping> byKey) {
        this.version = version;
        this.byKey = Collections.unmodifiableMap(byKey);
    }

    /**
     * Validates and freezes a parsed document.
     *
     * @throws IllegalStateException on missing fields, duplicate keys, a unit the metric cannot take or a
     *         qualifier missing from (or given to) a metric type
     */
    public static CanonicalMappingTable from(MappingTableDocument document, UnitConverter units) {
        if (document == null || document.getVersion() == null || document.getVersion().isBlank()) {
            throw new IllegalStateException("Mapping table has no version");
        }
        Map<String, CanonicalMapping> byKey = new LinkedHashMap<>();
        List<FieldMapping> mappings = document.getMappings() == null ? List.of() : document.getMappings();
        for (int i = 0; i < mappings.size(); i++) {
            FieldMapping m = mappings.get(i);
            if (blank(m.getProvider()) || blank(m.getField()) || m.getMetric() == null) {
                throw new IllegalStateException("Mapping #" + i + " needs provider, field and metric: " + m);
            }
            MetricType metric = m.getMetric();
            String unit = blank(m.getUnit()) ? null : m.getUnit().trim();
            if (metric.getDimension() == UnitDimension.TIME_OF_DAY) {
                unit = UnitConverter.CLOCK;
            } else if (unit != null && !units.supports(unit, metric)) {
                throw new IllegalStateException(String.format("Mapping #%d (%s/%s): unit '%s' does not fit %s",
                        i, m.getProvider(), m.getField(), unit, metric.getCode()));
            }
            String qualifier = blank(m.getQualifier()) ? null : m.getQualifier().trim().toLowerCase(Locale.ROOT);
            if (metric.isQualified() != (qualifier != null)) {
                throw new IllegalStateException(String.format("Mapping #%d (%s/%s): %s %s a qualifier",
                        i, m.getProvider(), m.getField(), metric.getCode(), metric.isQualified() ? "needs" : "takes no"));
            }
            CanonicalMapping mapping = new CanonicalMapping(normalize(m.getProvider()), m.getField().trim(), metric, unit,
                    qualifier,
                    m.getTimestampPolicy() == null ? TimestampPolicy.EMBEDDED_OR_DECLARED : m.getTimestampPolicy());
            String key = key(mapping.getProvider(), mapping.getField());
            if (byKey.putIfAbsent(key, mapping) != null) {
                throw new IllegalStateException("Duplicate mapping for " + m.getProvider() + "/" + m.getField());
            }
        }
        return new CanonicalMappingTable(document.getVersion().trim(), byKey);
    }

    public Optional<CanonicalMapping> find(String provider, String field) {
        if (provider == null || field == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(key(normalize(provider), field)));
    }

    public String getVersion() {
        return version;
    }

    public int size() {
        return byKey.size();
    }

    private static String key(String provider, String field) {
        return provider + '\u0000' + field.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalize(String provider) {
        return provider.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
