package io.casetime.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.UUID;

public record FactId(UUID value) {
    public FactId {
        Objects.requireNonNull(value);
    }

    public static FactId random() { return new FactId(UUID.randomUUID()); }

    @JsonCreator
    public static FactId parse(String s) { return new FactId(UUID.fromString(s.trim())); }

    @JsonValue public String json() { return value.toString(); }
    @Override public String toString(){ return value.toString(); }
}
