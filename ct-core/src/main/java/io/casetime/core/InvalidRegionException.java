package io.casetime.core;

/** An instant that was given an end timestamp. */
public class InvalidRegionException extends TemporalException {
    public InvalidRegionException(String message, String scopeId, Object subject) {
        super(message, scopeId, subject);
    }
}
