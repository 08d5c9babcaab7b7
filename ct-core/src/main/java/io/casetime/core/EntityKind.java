package io.casetime.core;

import java.util.Locale;

/** Kind of domain object a temporal fact describes. */
public enum EntityKind {
    EVENT("events"),
    ACTION("actions"),
    DECISION("decisions");

    private final String bucket;

    EntityKind(String bucket) { this.bucket = bucket; }

    /** Plural name used for grouping and timeline sections. */
    public String bucket() { return bucket; }

    /** Upper-case tag used in narrative lines (EVENT, ACTION, DECISION). */
    public String tag() { return name(); }

    /** Capitalized label used in relation sentences (Event, Action, Decision). */
    public String label() {
        var n = name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(n.charAt(0)) + n.substring(1);
    }

    public static EntityKind parse(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("entity kind is required");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
