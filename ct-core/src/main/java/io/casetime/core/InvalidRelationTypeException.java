package io.casetime.core;

public class InvalidRelationTypeException extends TemporalException {
    public InvalidRelationTypeException(String message, String scopeId, Object subject) {
        super(message, scopeId, subject);
    }
}
