package io.casetime.core;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Allowed relation types between temporal facts.
 *
 * Each type knows its wire name, its inverse (if one is defined) and the phrase used to
 * render it in a narrative. {@code causedBy}, {@code enabledBy} and {@code preventedBy}
 * are one-directional annotations without an inverse.
 */
public enum RelationType {
    PRECEDES("precedes", "happens before"),
    FOLLOWS("follows", "happens after"),
    COINCIDES_WITH("coincidesWith", "happens at the same time as"),
    OVERLAPS("overlaps", "overlaps with"),
    NECESSITATES("necessitates", "necessitates"),
    IS_NECESSITATED_BY("isNecessitatedBy", "is necessitated by"),
    HAS_CONSEQUENCE("hasConsequence", "leads to"),
    IS_CONSEQUENCE_OF("isConsequenceOf", "is a consequence of"),
    CAUSED_BY("causedBy", "was caused by"),
    ENABLED_BY("enabledBy", "was enabled by"),
    PREVENTED_BY("preventedBy", "was prevented by");

    private static final Set<RelationType> CAUSAL =
            EnumSet.of(CAUSED_BY, ENABLED_BY, PREVENTED_BY, HAS_CONSEQUENCE);

    private final String wireName;
    private final String phrase;

    RelationType(String wireName, String phrase) {
        this.wireName = wireName;
        this.phrase = phrase;
    }

    public String wireName() { return wireName; }

    public Optional<RelationType> inverse() {
        return Optional.ofNullable(switch (this) {
            case PRECEDES -> FOLLOWS;
            case FOLLOWS -> PRECEDES;
            case COINCIDES_WITH -> COINCIDES_WITH;
            case OVERLAPS -> OVERLAPS;
            case NECESSITATES -> IS_NECESSITATED_BY;
            case IS_NECESSITATED_BY -> NECESSITATES;
            case HAS_CONSEQUENCE -> IS_CONSEQUENCE_OF;
            case IS_CONSEQUENCE_OF -> HAS_CONSEQUENCE;
            case CAUSED_BY, ENABLED_BY, PREVENTED_BY -> null;
        });
    }

    public boolean symmetric() { return inverse().filter(i -> i == this).isPresent(); }

    public boolean causal() { return CAUSAL.contains(this); }

    /** "{@code <from>} happens before {@code <to>}" and friends. */
    public String sentence(String from, String to) {
        return from + " " + phrase + " " + to;
    }

    @Override public String toString() { return wireName; }

    /** Accepts the wire name ({@code hasConsequence}) or the constant name ({@code HAS_CONSEQUENCE}). */
    public static RelationType parse(String s) {
        if (s != null) {
            var t = s.trim();
            var found = Arrays.stream(values())
                    .filter(r -> r.wireName.equals(t) || r.name().equals(t))
                    .findFirst();
            if (found.isPresent()) return found.get();
        }
        throw new InvalidRelationTypeException("Invalid relation type: " + s, null, s);
    }
}
