package io.casetime.engine;

import io.casetime.core.*;
import io.casetime.store.FactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed storage and query of temporal facts. One fact per owner and scope: a second
 * upsert for the same owner replaces the temporal fields in place and keeps the id.
 */
public class TemporalStore {
    private static final Logger log = LoggerFactory.getLogger(TemporalStore.class);

    private final FactStore facts;
    private final EntityResolver resolver;
    private final ScopeLocks locks;

    public TemporalStore(FactStore facts, EntityResolver resolver) {
        this(facts, resolver, new ScopeLocks());
    }

    public TemporalStore(FactStore facts, EntityResolver resolver, ScopeLocks locks) {
        this.facts = Objects.requireNonNull(facts);
        this.resolver = Objects.requireNonNull(resolver);
        this.locks = Objects.requireNonNull(locks);
    }

    public FactId upsertFact(OwnerRef owner, String scopeId, RegionType region,
                             Instant start, Instant end, Granularity granularity) {
        return upsertFact(owner, scopeId, region, start, end, granularity, FactRelation.ASSERTED);
    }

    public FactId upsertFact(OwnerRef owner, String scopeId, RegionType region,
                             Instant start, Instant end, Granularity granularity, double confidence) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(scopeId, "scopeId");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(start, "start");

        // the record constructor raises InvalidRegion / InvalidInterval before anything is written
        var candidate = new TemporalFact(FactId.random(), owner, scopeId, region, start, end,
                granularity, confidence, null, null);

        if (resolver.resolve(owner).isEmpty()) {
            throw NotFoundException.owner(scopeId, owner);
        }

        return locks.withLock(scopeId, () -> {
            var fact = facts.findByOwner(scopeId, owner)
                    .map(prior -> prior.withTemporal(region, start, end, candidate.granularity(), confidence))
                    .orElse(candidate);
            facts.save(List.of(fact));
            log.debug("Upserted fact {} for {} in scope {}", fact.id(), owner, scopeId);
            return fact.id();
        });
    }

    public TemporalFact get(FactId id) {
        return facts.find(id).orElseThrow(() -> NotFoundException.fact(null, id));
    }

    public List<TemporalFact> findInTimeframe(String scopeId, Instant start, Instant end, EntityKind kindFilter) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new InvalidIntervalException(
                    "Time frame ends (" + end + ") before it starts (" + start + ")", scopeId, null);
        }
        return facts.search(scopeId, kindFilter, start, end, null);
    }

    public List<TemporalFact> findSequence(String scopeId, EntityKind kindFilter, Integer limit) {
        return facts.search(scopeId, kindFilter, null, null, limit);
    }

    public List<TemporalFact> readScope(String scopeId) {
        return facts.read(scopeId);
    }

    /**
     * The scope's facts in timeline order. The stored order is used only while every fact
     * carries one; otherwise the facts are sorted chronologically, which is the order a
     * recompute would assign.
     */
    public List<TemporalFact> readTimeline(String scopeId) {
        var all = new ArrayList<>(facts.read(scopeId));
        var ordered = all.stream().allMatch(f -> f.timelineOrder() != null);
        all.sort(ordered ? TemporalFact.TIMELINE_ORDER : TemporalFact.CHRONOLOGICAL);
        return all;
    }

    public int deleteScope(String scopeId) {
        return locks.withLock(scopeId, () -> facts.deleteScope(scopeId));
    }

    ScopeLocks locks() {
        return locks;
    }

    void write(List<TemporalFact> changed) {
        facts.save(changed);
    }
}
