package io.casetime.core;

import java.util.Optional;

/**
 * Maps an owner reference to its description and owning actor.
 * An empty result means the entity does not exist.
 */
public interface EntityResolver {
    Optional<EntityDescription> resolve(OwnerRef owner);
}
