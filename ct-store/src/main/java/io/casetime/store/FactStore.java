package io.casetime.store;

import io.casetime.core.EntityKind;
import io.casetime.core.FactId;
import io.casetime.core.OwnerRef;
import io.casetime.core.TemporalFact;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent backing of temporal facts. Every query is scope filtered; list results are
 * ordered by {@link TemporalFact#CHRONOLOGICAL}.
 */
public interface FactStore {
    /** Upserts by fact id. A batch is written as one unit: all or nothing. */
    void save(List<TemporalFact> facts);

    Optional<TemporalFact> find(FactId id);

    Optional<TemporalFact> findByOwner(String scopeId, OwnerRef owner);

    List<TemporalFact> read(String scopeId);

    /**
     * Facts of a scope, optionally restricted to a kind, to a time frame and to a maximum
     * count. When both {@code from} and {@code to} are given, instants match if they fall
     * inside the frame and intervals match if they intersect it (an open interval extends
     * forever).
     */
    List<TemporalFact> search(String scopeId, EntityKind kind, Instant from, Instant to, Integer limit);

    /** Removes every fact of the scope and returns how many were removed. */
    int deleteScope(String scopeId);
}
