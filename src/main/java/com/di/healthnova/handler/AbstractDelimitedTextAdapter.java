package com.di.healthnova.handler;

import com.di.healthnova.exception.ErrorCategory;
import com.di.healthnova.exception.RawFileReadException;
import com.di.healthnova.exception.UnsupportedFormatException;
import com.di.healthnova.model.PartialIngestionWarning;
import com.di.healthnova.model.RawFile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for {@link RawFormat#DELIMITED_TEXT} adapters: a header row followed by data rows.
 * Subclasses validate the header and turn each data row into raw records. Each record is parsed on its own,
 * so a row with broken quoting is skipped like any other malformed row.
 */
@Slf4j
public abstract class AbstractDelimitedTextAdapter implements ProviderAdapter {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();

    private static final ObjectReader ROW_READER = CSV_MAPPER.readerFor(String[].class);

    private static final String BOM = "\uFEFF";

    private static final Pattern NAME_WITH_UNIT = Pattern.compile("^(.*?)\\s*\\(([^)]*)\\)\\s*$");

    @Override
    public final RawFormat format() {
        return RawFormat.DELIMITED_TEXT;
    }

    @Override
    public AdapterParseResult parse(RawFile file) {
        List<String> records = readRecords(file);
        if (records.isEmpty()) {
            throw new UnsupportedFormatException(provider() + ": '" + file.getFileName() + "' has no header row");
        }
        String[] header;
        try {
            header = parseRecord(records.get(0));
        } catch (MalformedRecordException e) {
            throw new UnsupportedFormatException(String.format("%s: unreadable header in '%s': %s",
                    provider(), file.getFileName(), e.getMessage()));
        }
        if (!acceptsHeader(header)) {
            throw new UnsupportedFormatException(String.format("%s: unrecognized header in '%s': %s",
                    provider(), file.getFileName(), Arrays.toString(header)));
        }
        AdapterParseResult.Collector collector = new AdapterParseResult.Collector();
        for (int position = 1; position < records.size(); position++) {
            try {
                String[] row = parseRecord(records.get(position));
                if (row.length != header.length) {
                    throw new MalformedRecordException("expected " + header.length + " columns, found " + row.length);
                }
                readRow(header, row, position, collector);
            } catch (MalformedRecordException e) {
                log.warn("[{}] skipping row {} of '{}': {}", provider(), position, file.getFileName(), e.getMessage());
                collector.skip(new PartialIngestionWarning(position, ErrorCategory.MALFORMED_RECORD, e.getMessage()));
            }
        }
        return collector.build();
    }

    /**
     * Splits the file into logical CSV records: blank and '#' comment lines are dropped, and a line with an
     * open quote continues on the next one. A quote left open at end of file yields one last record that
     * fails to parse.
     */
    private List<String> readRecords(RawFile file) {
        List<String> records = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(file.openStream(), StandardCharsets.UTF_8))) {
            StringBuilder pending = null;
            boolean first = true;
            String line;
            while ((line = reader.readLine()) != null) {
                if (first && line.startsWith(BOM)) {
                    line = line.substring(1);
                }
                first = false;
                if (pending == null) {
                    if (line.isBlank() || line.startsWith("#")) continue;
                    pending = new StringBuilder(line);
                } else {
                    pending.append('\n').append(line);
                }
                if (quotesBalanced(pending)) {
                    records.add(pending.toString());
                    pending = null;
                }
            }
            if (pending != null) {
                records.add(pending.toString());
            }
        } catch (IOException e) {
            throw new RawFileReadException(provider() + ": cannot read '" + file.getFileName() + "'", e);
        }
        return records;
    }

    private static String[] parseRecord(String record) throws MalformedRecordException {
        try (MappingIterator<String[]> cells = ROW_READER.readValues(record)) {
            return cells.hasNextValue() ? cells.nextValue() : new String[0];
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("unparseable row: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static boolean quotesBalanced(CharSequence text) {
        int quotes = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '"') quotes++;
        }
        return quotes % 2 == 0;
    }

    /** True when the header row identifies this provider's layout. */
    protected abstract boolean acceptsHeader(String[] header);

    /**
     * Converts one data row (already checked to have as many cells as the header).
     *
     * @throws MalformedRecordException if the row must be skipped
     */
    protected abstract void readRow(String[] header, String[] row, int position,
                                    AdapterParseResult.Collector collector) throws MalformedRecordException;

    /** Splits "Protein (g)" into ["Protein", "g"]; a header without unit yields [name, null]. */
    protected static String[] splitNameAndUnit(String headerCell) {
        Matcher m = NAME_WITH_UNIT.matcher(headerCell.trim());
        if (m.matches()) {
            return new String[] {m.group(1).trim(), m.group(2).trim()};
        }
        return new String[] {headerCell.trim(), null};
    }

    protected static int indexOf(String[] header, List<String> candidates) {
        for (int i = 0; i < header.length; i++) {
            String cell = header[i].trim().toLowerCase(Locale.ROOT);
            if (candidates.contains(cell)) {
                return i;
            }
        }
        return -1;
    }

    protected static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
