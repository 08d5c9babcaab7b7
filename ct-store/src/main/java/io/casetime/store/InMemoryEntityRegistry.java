package io.casetime.store;

import io.casetime.core.EntityDescription;
import io.casetime.core.OwnerRef;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Entity descriptions held in memory; used by the in-memory profile and by tests. */
public final class InMemoryEntityRegistry implements EntityRegistry {
    private final Map<OwnerRef, EntityDescription> entities = new ConcurrentHashMap<>();

    public InMemoryEntityRegistry register(OwnerRef owner, EntityDescription description) {
        entities.put(owner, description);
        return this;
    }

    @Override
    public void upsert(OwnerRef owner, EntityDescription description) {
        register(owner, description);
    }

    public void remove(OwnerRef owner) { entities.remove(owner); }

    @Override
    public Optional<EntityDescription> resolve(OwnerRef owner) {
        return Optional.ofNullable(entities.get(owner));
    }
}
