package com.di.healthnova.handler.structured;

import com.di.healthnova.exception.ErrorCategory;
import com.di.healthnova.exception.RawFileReadException;
import com.di.healthnova.exception.UnsupportedFormatException;
import com.di.healthnova.handler.AdapterParseResult;
import com.di.healthnova.handler.MalformedRecordException;
import com.di.healthnova.handler.ProviderAdapter;
import com.di.healthnova.handler.RawFormat;
import com.di.healthnova.model.PartialIngestionWarning;
import com.di.healthnova.model.RawFile;
import com.di.healthnova.model.RawRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fitbit Takeout "Global Export Data" JSON files.
 *
 * <p>Every file is a JSON array. The data kind comes from the file name prefix
 * ({@code steps-2024-01-01.json}, {@code heart_rate-…}, {@code sleep-…}). Measurement entries look like
 * {@code {"dateTime": "07/27/24 06:53:41", "value": …}} where the value is either a scalar or an object
 * ({@code {"bpm": 61, "confidence": 2}} for heart rate, {@code {"value": 58.2}} for resting heart rate).
 * Sleep entries carry {@code startTime}, {@code endTime}, {@code dateOfSleep}, {@code minutesAsleep}
 * and a stage summary under {@code levels.summary}. Food log entries ({@code food_logs-…}) are meals and are
 * summed per day.
 *
 * <p>The daily summary CSVs of the same export (HRV, SpO2, readiness, Active Zone Minutes) are read by
 * {@link FitbitDailySummaryReader}.
 */
@Slf4j
@Component
public class FitbitJsonAdapter implements ProviderAdapter {

    public static final String PROVIDER = "fitbit";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** File name prefix to the field name emitted for measurement entries; sleep is handled separately. */
    private static final Map<String, String> MEASUREMENT_KINDS = new LinkedHashMap<>();

    static {
        MEASUREMENT_KINDS.put("resting_heart_rate-", "resting_heart_rate");
        MEASUREMENT_KINDS.put("heart_rate-", "heart_rate");
        MEASUREMENT_KINDS.put("steps-", "steps");
        MEASUREMENT_KINDS.put("distance-", "distance");
        MEASUREMENT_KINDS.put("calories-", "calories");
    }

    private static final String SLEEP_PREFIX = "sleep-";
    private static final String FOOD_PREFIX = "food_logs-";
    private static final String[] NUTRIENTS = {"calories", "protein", "carbs", "fat", "fiber", "sodium"};
    private static final String[] SLEEP_STAGES = {"deep", "light", "rem", "wake"};

    private final FitbitDailySummaryReader dailySummaries = new FitbitDailySummaryReader();

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public RawFormat format() {
        return RawFormat.NESTED_STRUCTURED;
    }

    @Override
    public boolean canHandle(String fileName) {
        String name = baseName(fileName);
        if (dailySummaries.canHandle(name)) {
            return true;
        }
        return name.endsWith(".json")
                && (name.startsWith(SLEEP_PREFIX) || name.startsWith(FOOD_PREFIX) || kindOf(name) != null);
    }

    @Override
    public AdapterParseResult parse(RawFile file) {
        if (dailySummaries.canHandle(file.getFileName())) {
            return dailySummaries.parse(file);
        }
        String name = baseName(file.getFileName());
        boolean sleep = name.startsWith(SLEEP_PREFIX);
        boolean food = name.startsWith(FOOD_PREFIX);
        String kind = sleep || food ? null : kindOf(name);
        if (!sleep && !food && kind == null) {
            throw new UnsupportedFormatException("fitbit: cannot tell the data kind of '" + file.getFileName() + "'");
        }

        JsonNode root = readTree(file);
        if (root == null || !root.isArray()) {
            throw new UnsupportedFormatException("fitbit: '" + file.getFileName() + "' is not a JSON array");
        }

        AdapterParseResult.Collector collector = new AdapterParseResult.Collector();
        Map<String, DailyNutrition> nutrition = new LinkedHashMap<>();
        int position = 0;
        for (JsonNode entry : root) {
            position++;
            try {
                if (!entry.isObject()) {
                    throw new MalformedRecordException("entry is not an object");
                }
                if (sleep) {
                    readSleep(entry, position, collector);
                } else if (food) {
                    readFoodLog(entry, position, nutrition);
                } else {
                    readMeasurement(kind, entry, position, collector);
                }
            } catch (MalformedRecordException e) {
                log.warn("[fitbit] skipping entry {} of '{}': {}", position, file.getFileName(), e.getMessage());
                collector.skip(new PartialIngestionWarning(position, ErrorCategory.MALFORMED_RECORD, e.getMessage()));
            }
        }
        nutrition.forEach((date, day) -> day.totals.forEach((nutrient, total) -> collector.add(new RawRecord(
                "food_" + nutrient, total.toPlainString(), null, date, PROVIDER, day.firstPosition))));
        return collector.build();
    }

    /**
     * Food log entries are single meals ({@code logDate} plus {@code nutritionalValues}); they are summed
     * per day so each nutrient yields one daily record.
     */
    private void readFoodLog(JsonNode entry, int position, Map<String, DailyNutrition> nutrition)
            throws MalformedRecordException {
        String logDate = requiredText(entry, "logDate");
        JsonNode values = entry.get("nutritionalValues");
        if (values == null || !values.isObject()) {
            throw new MalformedRecordException("missing nutritionalValues");
        }
        DailyNutrition day = nutrition.computeIfAbsent(logDate, d -> new DailyNutrition(position));
        for (String nutrient : NUTRIENTS) {
            JsonNode amount = values.get(nutrient);
            if (amount != null && amount.isNumber()) {
                day.totals.merge(nutrient, amount.decimalValue(), BigDecimal::add);
            }
        }
    }

    private void readMeasurement(String kind, JsonNode entry, int position,
                                 AdapterParseResult.Collector collector) throws MalformedRecordException {
        String dateTime = requiredText(entry, "dateTime");
        JsonNode value = entry.get("value");
        if (value == null || value.isNull()) {
            throw new MalformedRecordException("missing value");
        }
        if (value.isObject()) {
            value = firstPresent(value, "bpm", "value", "restingHeartRate");
            if (value == null) {
                throw new MalformedRecordException("value object has no reading");
            }
        }
        if (!value.isValueNode() || value.asText().isBlank()) {
            throw new MalformedRecordException("value is not a scalar");
        }
        if ("resting_heart_rate".equals(kind) && value.isNumber() && value.asDouble() == 0) {
            throw new MalformedRecordException("empty resting heart rate reading");
        }
        collector.add(new RawRecord(kind, value.asText().trim(), null, dateTime, PROVIDER, position));
    }

    private void readSleep(JsonNode entry, int position, AdapterParseResult.Collector collector)
            throws MalformedRecordException {
        String start = requiredText(entry, "startTime");
        String end = requiredText(entry, "endTime");
        String dateOfSleep = requiredText(entry, "dateOfSleep");

        collector.add(new RawRecord("sleep_start", start, null, dateOfSleep, PROVIDER, position));
        collector.add(new RawRecord("sleep_end", end, null, dateOfSleep, PROVIDER, position));

        JsonNode asleep = entry.get("minutesAsleep");
        if (asleep != null && asleep.isNumber()) {
            collector.add(new RawRecord("minutesAsleep", asleep.asText(), "min", dateOfSleep, PROVIDER, position));
        }

        JsonNode summary = entry.path("levels").path("summary");
        for (String stage : SLEEP_STAGES) {
            JsonNode minutes = summary.path(stage).get("minutes");
            if (minutes != null && minutes.isNumber()) {
                collector.add(new RawRecord("sleep_" + stage, minutes.asText(), "min", dateOfSleep, PROVIDER, position));
            }
        }
    }

    private static final class DailyNutrition {
        private final int firstPosition;
        private final Map<String, BigDecimal> totals = new LinkedHashMap<>();

        private DailyNutrition(int firstPosition) {
            this.firstPosition = firstPosition;
        }
    }

    private static JsonNode readTree(RawFile file) {
        try (InputStream in = file.openStream()) {
            return MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new UnsupportedFormatException("fitbit: '" + file.getFileName() + "' is not valid JSON: "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RawFileReadException("fitbit: cannot read '" + file.getFileName() + "'", e);
        }
    }

    private static String requiredText(JsonNode entry, String field) throws MalformedRecordException {
        JsonNode node = entry.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new MalformedRecordException("missing " + field);
        }
        return node.asText().trim();
    }

    private static JsonNode firstPresent(JsonNode object, String... fields) {
        for (String field : fields) {
            JsonNode node = object.get(field);
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return null;
    }

    private static String kindOf(String baseName) {
        for (Map.Entry<String, String> e : MEASUREMENT_KINDS.entrySet()) {
            if (baseName.startsWith(e.getKey())) {
                return e.getValue();
            }
        }
        return null;
    }

    private static String baseName(String fileName) {
        String name = fileName.replace('\\', '/');
        return name.substring(name.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
    }
}
