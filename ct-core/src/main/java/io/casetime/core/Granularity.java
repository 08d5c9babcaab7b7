package io.casetime.core;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Precision a fact's timestamps were recorded at, finest first.
 * Buckets are computed in UTC; weeks start on Monday.
 */
public enum Granularity {
    SECONDS,
    MINUTES,
    HOURS,
    DAYS,
    WEEKS,
    MONTHS,
    YEARS;

    /** Start of the bucket {@code t} falls into at this granularity. */
    public Instant truncate(Instant t) {
        return switch (this) {
            case SECONDS -> t.truncatedTo(ChronoUnit.SECONDS);
            case MINUTES -> t.truncatedTo(ChronoUnit.MINUTES);
            case HOURS -> t.truncatedTo(ChronoUnit.HOURS);
            case DAYS -> t.truncatedTo(ChronoUnit.DAYS);
            case WEEKS -> t.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toInstant();
            case MONTHS -> t.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS)
                    .withDayOfMonth(1).toInstant();
            case YEARS -> t.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS)
                    .withDayOfYear(1).toInstant();
        };
    }

    public static Granularity coarser(Granularity a, Granularity b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    public String wireName() { return name().toLowerCase(Locale.ROOT); }

    public static Granularity parse(String s) {
        if (s == null || s.isBlank()) return MINUTES;
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
