package io.casetime.core;

import java.util.Locale;
import java.util.Objects;

/** Reference to the domain object (event, action or decision) a fact is about. */
public record OwnerRef(EntityKind kind, String entityId) {
    public OwnerRef {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(entityId);
        if (entityId.isBlank()) throw new IllegalArgumentException("entityId must not be blank");
    }

    public static OwnerRef event(String id) { return new OwnerRef(EntityKind.EVENT, id); }
    public static OwnerRef action(String id) { return new OwnerRef(EntityKind.ACTION, id); }
    public static OwnerRef decision(String id) { return new OwnerRef(EntityKind.DECISION, id); }

    @Override public String toString() { return kind.name().toLowerCase(Locale.ROOT) + ":" + entityId; }
}
