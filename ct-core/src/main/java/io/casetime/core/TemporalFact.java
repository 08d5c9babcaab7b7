package io.casetime.core;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * One temporal claim about an owning entity.
 *
 * Region invariants are enforced on construction: an instant never has an end, and a
 * closed interval never ends before it starts. {@code end == null} on an interval means
 * the interval is still ongoing. {@code relation} and {@code timelineOrder} are optional.
 */
public record TemporalFact(
        FactId id,
        OwnerRef owner,
        String scopeId,
        RegionType regionType,
        Instant start,
        Instant end,
        Granularity granularity,
        double confidence,
        FactRelation relation,
        Integer timelineOrder
) {
    /** Ascending start, ties broken by id (string order, which matches uuid byte order). */
    public static final Comparator<TemporalFact> CHRONOLOGICAL =
            Comparator.comparing(TemporalFact::start).thenComparing(f -> f.id().toString());

    /** Assigned timeline order first (unordered facts last), then chronological. */
    public static final Comparator<TemporalFact> TIMELINE_ORDER =
            Comparator.comparing(TemporalFact::timelineOrder, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(CHRONOLOGICAL);

    public TemporalFact {
        Objects.requireNonNull(id);
        Objects.requireNonNull(owner);
        Objects.requireNonNull(scopeId);
        Objects.requireNonNull(regionType);
        Objects.requireNonNull(start);
        if (granularity == null) granularity = Granularity.MINUTES;
        if (regionType == RegionType.INSTANT && end != null) {
            throw new InvalidRegionException(
                    "Instant fact for " + owner + " must not have an end", scopeId, owner);
        }
        if (end != null && end.isBefore(start)) {
            throw new InvalidIntervalException(
                    "Interval for " + owner + " ends (" + end + ") before it starts (" + start + ")",
                    scopeId, owner);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
    }

    public EntityKind kind() { return owner.kind(); }

    public boolean isInstant() { return regionType == RegionType.INSTANT; }

    /** An interval without an end. */
    public boolean isOpen() { return regionType == RegionType.INTERVAL && end == null; }

    public boolean hasRelation() { return relation != null; }

    public TemporalFact withRelation(FactRelation r) {
        return new TemporalFact(id, owner, scopeId, regionType, start, end, granularity, confidence, r, timelineOrder);
    }

    public TemporalFact withTimelineOrder(Integer order) {
        return new TemporalFact(id, owner, scopeId, regionType, start, end, granularity, confidence, relation, order);
    }

    /** Same id and relation; new temporal fields. The timeline order is cleared until the next recompute. */
    public TemporalFact withTemporal(RegionType region, Instant newStart, Instant newEnd,
                                     Granularity g, double c) {
        return new TemporalFact(id, owner, scopeId, region, newStart, newEnd, g, c, relation, null);
    }
}
