package com.di.healthnova.mapping;

import com.di.healthnova.exception.ValueOutOfRangeException;
import com.di.healthnova.model.CanonicalMetricRecord;
import com.di.healthnova.model.MetricType;
import com.di.healthnova.model.RawRecord;
import com.di.healthnova.model.UnitDimension;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Translates provider raw records into canonical metric records using the mapping table.
 *
 * <p>Fields the table does not know yield {@code null}. Unit hints on the record take precedence over the
 * unit declared in the table. Time-of-day metrics (sleep onset/end) read their raw value as a clock time.
 * Stateless and safe for concurrent use.
 */
@Slf4j
public class CanonicalizationMapper {

    private final CanonicalMappingTable table;
    private final UnitConverter unitConverter;
    private final TimestampResolver timestampResolver;

    public CanonicalizationMapper(CanonicalMappingTable table, UnitConverter unitConverter, TimestampResolver timestampResolver) {
        this.table = table;
        this.unitConverter = unitConverter;
        this.timestampResolver = timestampResolver;
    }

    /**
     * @return the canonical record, or {@code null} when the field has no mapping
     * @throws com.di.healthnova.exception.SchemaMismatchException  on unknown/ambiguous units or unreadable timestamps
     * @throws com.di.healthnova.exception.UnitConversionException  on non-numeric values
     * @throws ValueOutOfRangeException on implausible converted values
     */
    public CanonicalMetricRecord map(RawRecord raw, MappingContext context) {
        Optional<CanonicalMapping> found = table.find(raw.provider(), raw.fieldName());
        if (found.isEmpty()) {
            log.debug("[MAPPING] No mapping for {}/{} (record {})", raw.provider(), raw.fieldName(), raw.position());
            return null;
        }
        CanonicalMapping mapping = found.get();
        MetricType metric = mapping.getMetricType();

        Instant timestamp = timestampResolver.resolve(raw.timestampRaw(), mapping.getTimestampPolicy(),
                context.declaredOffset(), context.userZone());

        double value;
        if (metric.getDimension() == UnitDimension.TIME_OF_DAY) {
            value = timestampResolver.clockSeconds(raw.rawValue());
        } else {
            String unit = raw.unitHint() != null && !raw.unitHint().isBlank() ? raw.unitHint() : mapping.getSourceUnit();
            BigDecimal canonical = unitConverter.toCanonical(unitConverter.parse(raw.rawValue()), unit, metric);
            value = canonical.doubleValue();
        }
        if (!metric.isPlausible(value)) {
            throw new ValueOutOfRangeException(metric, value);
        }

        return CanonicalMetricRecord.builder()
                .userId(context.userId())
                .metricType(metric)
                .qualifier(mapping.getQualifier())
                .value(value)
                .timestamp(timestamp)
                .sourceProvider(mapping.getProvider())
                .sourceFileHash(context.sourceFileHash())
                .build();
    }

    public String getTableVersion() {
        return table.getVersion();
    }
}
