package io.casetime.core;

/** Missing owner, fact or relation target. */
public class NotFoundException extends TemporalException {
    public NotFoundException(String message, String scopeId, Object subject) {
        super(message, scopeId, subject);
    }

    public static NotFoundException fact(String scopeId, FactId id) {
        return new NotFoundException("Temporal fact " + id + " not found", scopeId, id);
    }

    public static NotFoundException owner(String scopeId, OwnerRef owner) {
        return new NotFoundException("Entity " + owner + " not found", scopeId, owner);
    }

    public static NotFoundException scope(String scopeId) {
        return new NotFoundException("Scope " + scopeId + " has no temporal facts", scopeId, null);
    }
}
