package io.casetime.core;

import java.util.Objects;

/** The single outgoing relation a fact holds. */
public record FactRelation(RelationType type, FactId target, double confidence) {
    public static final double ASSERTED = 1.0;

    public FactRelation {
        Objects.requireNonNull(type);
        Objects.requireNonNull(target);
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
    }

    public static FactRelation asserted(RelationType type, FactId target) {
        return new FactRelation(type, target, ASSERTED);
    }

    /** Inferred relations carry a confidence below 1.0. */
    public boolean inferred() { return confidence < ASSERTED; }
}
