package com.di.healthnova.handler.delimited;

import com.di.healthnova.handler.AbstractDelimitedTextAdapter;
import com.di.healthnova.handler.AdapterParseResult;
import com.di.healthnova.handler.MalformedRecordException;
import com.di.healthnova.model.RawRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Garmin long-format export: {@code Timestamp,Metric,Value,Unit}, one measurement per row.
 * The unit column is optional.
 */
@Component
public class GarminCsvAdapter extends AbstractDelimitedTextAdapter {

    public static final String PROVIDER = "garmin";

    private static final List<String> TIMESTAMP = List.of("timestamp", "time", "date");
    private static final List<String> METRIC = List.of("metric", "type");
    private static final List<String> VALUE = List.of("value");
    private static final List<String> UNIT = List.of("unit", "units");

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public boolean canHandle(String fileName) {
        String name = fileName.toLowerCase(Locale.ROOT);
        return name.endsWith(".csv") && name.contains("garmin");
    }

    @Override
    protected boolean acceptsHeader(String[] header) {
        return indexOf(header, TIMESTAMP) >= 0 && indexOf(header, METRIC) >= 0 && indexOf(header, VALUE) >= 0;
    }

    @Override
    protected void readRow(String[] header, String[] row, int position,
                           AdapterParseResult.Collector collector) throws MalformedRecordException {
        String timestamp = row[indexOf(header, TIMESTAMP)];
        String metric = row[indexOf(header, METRIC)];
        String value = row[indexOf(header, VALUE)];
        int unitIndex = indexOf(header, UNIT);
        String unit = unitIndex >= 0 && !isBlank(row[unitIndex]) ? row[unitIndex].trim() : null;

        if (isBlank(timestamp)) throw new MalformedRecordException("missing timestamp");
        if (isBlank(metric)) throw new MalformedRecordException("missing metric name");
        if (isBlank(value)) throw new MalformedRecordException("missing value");

        collector.add(new RawRecord(metric.trim(), value.trim(), unit, timestamp.trim(), PROVIDER, position));
    }
}
