package com.di.healthnova.handler.structured;

import com.di.healthnova.handler.AbstractDelimitedTextAdapter;
import com.di.healthnova.handler.AdapterParseResult;
import com.di.healthnova.handler.MalformedRecordException;
import com.di.healthnova.model.RawRecord;

import java.util.List;
import java.util.Locale;

/**
 * The CSV side of a Fitbit Takeout: daily HRV, SpO2 and readiness summaries, and Active Zone Minutes.
 * Each layout has one date column and one reading column; the reading column name is the emitted field.
 *
 * <p>Not a bean of its own: {@link FitbitJsonAdapter} is the single adapter for the {@code fitbit} provider
 * and hands these files over by name.
 */
class FitbitDailySummaryReader extends AbstractDelimitedTextAdapter {

    private enum Layout {
        HRV("daily heart rate variability summary", List.of("timestamp", "date"), List.of("rmssd")),
        SPO2("daily spo2", List.of("timestamp", "date"), List.of("average_value")),
        READINESS("daily readiness score", List.of("date", "timestamp"),
                List.of("readiness_score_value", "score")),
        ACTIVE_ZONE_MINUTES("active zone minutes", List.of("date_time", "timestamp"), List.of("total_minutes"));

        private final String namePrefix;
        private final List<String> dateColumns;
        private final List<String> readingColumns;

        Layout(String namePrefix, List<String> dateColumns, List<String> readingColumns) {
            this.namePrefix = namePrefix;
            this.dateColumns = dateColumns;
            this.readingColumns = readingColumns;
        }
    }

    @Override
    public String provider() {
        return FitbitJsonAdapter.PROVIDER;
    }

    @Override
    public boolean canHandle(String fileName) {
        return fileLayout(fileName) != null;
    }

    @Override
    protected boolean acceptsHeader(String[] header) {
        return headerLayout(header) != null;
    }

    @Override
    protected void readRow(String[] header, String[] row, int position,
                           AdapterParseResult.Collector collector) throws MalformedRecordException {
        Layout layout = headerLayout(header);
        int dateIndex = indexOf(header, layout.dateColumns);
        int readingIndex = indexOf(header, layout.readingColumns);
        if (isBlank(row[dateIndex])) {
            throw new MalformedRecordException("missing " + header[dateIndex].trim());
        }
        // Fitbit leaves the reading empty for nights without enough data
        if (isBlank(row[readingIndex])) {
            throw new MalformedRecordException("missing " + header[readingIndex].trim());
        }
        String field = header[readingIndex].trim().toLowerCase(Locale.ROOT);
        collector.add(new RawRecord(field, row[readingIndex].trim(), null, row[dateIndex].trim(),
                FitbitJsonAdapter.PROVIDER, position));
    }

    private static Layout headerLayout(String[] header) {
        for (Layout layout : Layout.values()) {
            if (indexOf(header, layout.dateColumns) >= 0 && indexOf(header, layout.readingColumns) >= 0) {
                return layout;
            }
        }
        return null;
    }

    private static Layout fileLayout(String fileName) {
        String name = fileName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        if (!name.endsWith(".csv")) {
            return null;
        }
        for (Layout layout : Layout.values()) {
            if (name.startsWith(layout.namePrefix)) {
                return layout;
            }
        }
        return null;
    }
}
