package io.casetime.engine;

import io.casetime.core.*;
import io.casetime.store.InMemoryEntityRegistry;
import io.casetime.store.InMemoryFactStore;

import java.time.Instant;

/** In-memory engine over one scope, with helpers to add described facts. */
final class ScopeFixture {
    static final String SCOPE = "case-252";

    final InMemoryFactStore facts = new InMemoryFactStore();
    final InMemoryEntityRegistry entities = new InMemoryEntityRegistry();
    final ScopeLocks locks = new ScopeLocks();
    final TemporalStore store = new TemporalStore(facts, entities, locks);
    final RelationGraph graph = new RelationGraph(store);
    final InferenceEngine inference = new InferenceEngine(store, EngineSettings.DEFAULT_CONFIDENCE);
    final Segmenter segmenter = new Segmenter(store, entities,
            EngineSettings.DEFAULT_GAP, EngineSettings.DEFAULT_BATCH);
    final Narrator narrator = new Narrator(store, entities);

    static Instant at(String hhmm) {
        return Instant.parse("2025-03-01T" + hhmm + ":00Z");
    }

    FactId instant(OwnerRef owner, String description, String hhmm) {
        entities.register(owner, EntityDescription.of(description, null));
        return store.upsertFact(owner, SCOPE, RegionType.INSTANT, at(hhmm), null, Granularity.MINUTES);
    }

    FactId interval(OwnerRef owner, String description, String from, String to) {
        entities.register(owner, EntityDescription.of(description, null));
        return store.upsertFact(owner, SCOPE, RegionType.INTERVAL, at(from), to == null ? null : at(to),
                Granularity.MINUTES);
    }

    TemporalFact fact(FactId id) {
        return store.get(id);
    }
}
