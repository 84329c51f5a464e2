package com.di.healthnova.mapping;

import com.di.healthnova.exception.SchemaMismatchException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Resolves provider timestamps to UTC instants.
 *
 * <p>Providers use several layouts (Fitbit alone has three). Values carrying an offset are taken as-is;
 * local values are placed using the offset declared for the file or, failing that, the user's zone.
 * A date without a time means local midnight.
 */
@Component
public class TimestampResolver {

    private static final List<DateTimeFormatter> WITH_OFFSET = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssXXX"));

    private static final List<DateTimeFormatter> LOCAL_DATE_TIME = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]"),
            DateTimeFormatter.ofPattern("MM/dd/yy HH:mm[:ss]"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm[:ss]"));

    private static final List<DateTimeFormatter> LOCAL_DATE = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("MM/dd/yy"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"));

    private static final List<DateTimeFormatter> LOCAL_TIME = List.of(
            DateTimeFormatter.ISO_LOCAL_TIME,
            DateTimeFormatter.ofPattern("H:mm[:ss]"),
            DateTimeFormatter.ofPattern("h:mm[:ss] a", Locale.US));

    /**
     * @param declaredOffset offset declared for the whole file, may be null
     * @param userZone       the user's profile zone, never null
     * @throws SchemaMismatchException if the value matches none of the known layouts
     */
    public Instant resolve(String raw, TimestampPolicy policy, ZoneOffset declaredOffset, ZoneId userZone) {
        if (raw == null || raw.isBlank()) {
            throw new SchemaMismatchException("Missing timestamp");
        }
        String value = raw.trim();
        OffsetDateTime withOffset = parseOffset(value);
        if (withOffset != null) {
            return withOffset.toInstant();
        }
        LocalDateTime local = parseLocal(value);
        if (local == null) {
            throw new SchemaMismatchException("Unrecognized timestamp '" + raw + "'");
        }
        return local.atZone(zoneFor(policy, declaredOffset, userZone)).toInstant();
    }

    /**
     * Reads the wall-clock time of a clock value (a full timestamp or a bare time) as signed seconds from the
     * nearest midnight, in [-12h, +12h): 23:00 is -3600, 00:30 is 1800.
     */
    public int clockSeconds(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new SchemaMismatchException("Missing clock value");
        }
        String value = raw.trim();
        LocalTime time = null;
        OffsetDateTime withOffset = parseOffset(value);
        if (withOffset != null) {
            time = withOffset.toLocalTime();
        } else {
            LocalDateTime local = parseLocal(value);
            if (local != null) {
                time = local.toLocalTime();
            } else {
                for (DateTimeFormatter f : LOCAL_TIME) {
                    try {
                        time = LocalTime.parse(value, f);
                        break;
                    } catch (DateTimeParseException ignored) {
                        // next layout
                    }
                }
            }
        }
        if (time == null) {
            throw new SchemaMismatchException("Unrecognized clock value '" + raw + "'");
        }
        int seconds = time.toSecondOfDay();
        return seconds >= 12 * 3600 ? seconds - 24 * 3600 : seconds;
    }

    static ZoneId zoneFor(TimestampPolicy policy, ZoneOffset declaredOffset, ZoneId userZone) {
        if (policy == TimestampPolicy.UTC) {
            return ZoneOffset.UTC;
        }
        return declaredOffset != null ? declaredOffset : userZone;
    }

    private static OffsetDateTime parseOffset(String value) {
        for (DateTimeFormatter f : WITH_OFFSET) {
            try {
                return OffsetDateTime.parse(value, f);
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        return null;
    }

    private static LocalDateTime parseLocal(String value) {
        for (DateTimeFormatter f : LOCAL_DATE_TIME) {
            try {
                return LocalDateTime.parse(value, f);
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        for (DateTimeFormatter f : LOCAL_DATE) {
            try {
                return LocalDate.parse(value, f).atStartOfDay();
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        return null;
    }
}
