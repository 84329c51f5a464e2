package com.di.healthnova.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Half-open instant range [from, to).
 */
public record TimeRange(Instant from, Instant to) {

    public TimeRange {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Range bounds cannot be null");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Range end " + to + " is before start " + from);
        }
    }

    /** Calendar days [startDay, endDay] inclusive, in the given zone. */
    public static TimeRange ofDays(LocalDate startDay, LocalDate endDay, ZoneId zone) {
        return new TimeRange(startDay.atStartOfDay(zone).toInstant(), endDay.plusDays(1).atStartOfDay(zone).toInstant());
    }

    public static TimeRange all() {
        return new TimeRange(Instant.EPOCH, Instant.parse("9999-12-31T23:59:59Z"));
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(from) && instant.isBefore(to);
    }
}
