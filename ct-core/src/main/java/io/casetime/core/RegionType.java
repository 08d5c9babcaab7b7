package io.casetime.core;

import java.util.Locale;

/** Whether a fact is a durationless instant or a (possibly open) interval. */
public enum RegionType {
    INSTANT,
    INTERVAL;

    public static RegionType parse(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("region type is required");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
