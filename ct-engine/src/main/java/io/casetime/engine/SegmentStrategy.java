package io.casetime.engine;

import java.util.Arrays;
import java.util.Locale;

public enum SegmentStrategy {
    BY_ACTOR("by_actor"),
    BY_GAP("by_gap"),
    BY_KIND("by_kind"),
    AUTO("auto");

    private final String wireName;

    SegmentStrategy(String wireName) { this.wireName = wireName; }

    public String wireName() { return wireName; }

    /** Blank means {@link #AUTO}. */
    public static SegmentStrategy parse(String s) {
        if (s == null || s.isBlank()) return AUTO;
        var t = s.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(v -> v.wireName.equals(t))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown segment strategy: " + s));
    }
}
