package io.casetime.api;

import io.casetime.core.TemporalFact;

import java.time.Instant;
import java.util.Locale;

public record FactView(
        String id,
        String scopeId,
        String kind,
        String entityId,
        String regionType,
        Instant start,
        Instant end,
        String granularity,
        double confidence,
        RelationView relation,
        Integer timelineOrder
) {
    public record RelationView(String type, String target, double confidence) {}

    static FactView of(TemporalFact f) {
        var r = f.relation();
        return new FactView(
                f.id().toString(),
                f.scopeId(),
                f.kind().name().toLowerCase(Locale.ROOT),
                f.owner().entityId(),
                f.regionType().name().toLowerCase(Locale.ROOT),
                f.start(),
                f.end(),
                f.granularity().wireName(),
                f.confidence(),
                r == null ? null : new RelationView(r.type().wireName(), r.target().toString(), r.confidence()),
                f.timelineOrder()
        );
    }
}
