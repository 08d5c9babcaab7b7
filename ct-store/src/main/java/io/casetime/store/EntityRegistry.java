package io.casetime.store;

import io.casetime.core.EntityDescription;
import io.casetime.core.EntityResolver;
import io.casetime.core.OwnerRef;

/** An {@link EntityResolver} whose descriptions can be written. */
public interface EntityRegistry extends EntityResolver {
    void upsert(OwnerRef owner, EntityDescription description);
}
