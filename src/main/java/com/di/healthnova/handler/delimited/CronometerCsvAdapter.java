package com.di.healthnova.handler.delimited;

import com.di.healthnova.handler.AbstractDelimitedTextAdapter;
import com.di.healthnova.handler.AdapterParseResult;
import com.di.healthnova.handler.MalformedRecordException;
import com.di.healthnova.model.RawRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Cronometer "Daily Nutrition" export: one row per day, one column per nutrient with the unit in
 * parentheses, e.g. {@code Date,Energy (kcal),Protein (g),Carbs (g),Fat (g),Completed}.
 * Every non-blank cell other than the date becomes one raw record.
 */
@Component
public class CronometerCsvAdapter extends AbstractDelimitedTextAdapter {

    public static final String PROVIDER = "cronometer";

    private static final List<String> DATE_COLUMNS = List.of("date", "day");

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public boolean canHandle(String fileName) {
        String name = fileName.toLowerCase(Locale.ROOT);
        return name.endsWith(".csv") && (name.contains("cronometer") || name.startsWith("dailysummary")
                || name.startsWith("daily nutrition") || name.startsWith("servings"));
    }

    @Override
    protected boolean acceptsHeader(String[] header) {
        if (indexOf(header, DATE_COLUMNS) < 0) {
            return false;
        }
        for (String cell : header) {
            if (splitNameAndUnit(cell)[1] != null) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void readRow(String[] header, String[] row, int position,
                           AdapterParseResult.Collector collector) throws MalformedRecordException {
        int dateIndex = indexOf(header, DATE_COLUMNS);
        String date = row[dateIndex];
        if (isBlank(date)) {
            throw new MalformedRecordException("missing date");
        }
        for (int i = 0; i < header.length; i++) {
            if (i == dateIndex || isBlank(row[i])) continue;
            String[] nameAndUnit = splitNameAndUnit(header[i]);
            collector.add(new RawRecord(nameAndUnit[0], row[i].trim(), nameAndUnit[1], date.trim(), PROVIDER, position));
        }
    }
}
