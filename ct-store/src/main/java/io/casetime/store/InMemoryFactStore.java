package io.casetime.store;

import io.casetime.core.EntityKind;
import io.casetime.core.FactId;
import io.casetime.core.OwnerRef;
import io.casetime.core.TemporalFact;

import java.time.Instant;
import java.util.*;
import java.util.stream.Stream;

public final class InMemoryFactStore implements FactStore {
    private final Map<String, Map<FactId, TemporalFact>> byScope = new HashMap<>();
    private final Map<FactId, String> scopeOf = new HashMap<>();

    @Override
    public synchronized void save(List<TemporalFact> facts) {
        if (facts == null || facts.isEmpty()) return;
        // validate ownership first so a bad batch leaves nothing behind
        for (var f : facts) {
            var existing = scopeOf.get(f.id());
            if (existing != null && !existing.equals(f.scopeId())) {
                throw new IllegalStateException("Fact " + f.id() + " belongs to scope " + existing);
            }
            var clash = findByOwner(f.scopeId(), f.owner());
            if (clash.isPresent() && !clash.get().id().equals(f.id())) {
                throw new IllegalStateException("Owner " + f.owner() + " already has fact " + clash.get().id());
            }
        }
        for (var f : facts) {
            byScope.computeIfAbsent(f.scopeId(), k -> new LinkedHashMap<>()).put(f.id(), f);
            scopeOf.put(f.id(), f.scopeId());
        }
    }

    @Override
    public synchronized Optional<TemporalFact> find(FactId id) {
        var scope = scopeOf.get(id);
        return scope == null ? Optional.empty() : Optional.ofNullable(byScope.get(scope).get(id));
    }

    @Override
    public synchronized Optional<TemporalFact> findByOwner(String scopeId, OwnerRef owner) {
        return byScope.getOrDefault(scopeId, Map.of()).values().stream()
                .filter(f -> f.owner().equals(owner))
                .findFirst();
    }

    @Override
    public synchronized List<TemporalFact> read(String scopeId) {
        return byScope.getOrDefault(scopeId, Map.of()).values().stream()
                .sorted(TemporalFact.CHRONOLOGICAL)
                .toList();
    }

    @Override
    public synchronized List<TemporalFact> search(
            String scopeId, EntityKind kind, Instant from, Instant to, Integer limit) {

        Stream<TemporalFact> stream = byScope.getOrDefault(scopeId, Map.of()).values().stream();

        if (kind != null) {
            stream = stream.filter(f -> f.kind() == kind);
        }
        if (from != null && to != null) {
            stream = stream.filter(f -> inFrame(f, from, to));
        }

        stream = stream.sorted(TemporalFact.CHRONOLOGICAL);

        if (limit != null && limit > 0) {
            stream = stream.limit(limit);
        }

        return stream.toList();
    }

    @Override
    public synchronized int deleteScope(String scopeId) {
        var removed = byScope.remove(scopeId);
        if (removed == null) return 0;
        removed.keySet().forEach(scopeOf::remove);
        return removed.size();
    }

    static boolean inFrame(TemporalFact f, Instant from, Instant to) {
        if (f.isInstant()) {
            return !f.start().isBefore(from) && !f.start().isAfter(to);
        }
        return !f.start().isAfter(to) && (f.end() == null || !f.end().isBefore(from));
    }
}
