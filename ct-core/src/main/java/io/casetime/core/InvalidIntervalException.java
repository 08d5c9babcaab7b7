package io.casetime.core;

/** An interval (or a query frame) whose end lies before its start. */
public class InvalidIntervalException extends TemporalException {
    public InvalidIntervalException(String message, String scopeId, Object subject) {
        super(message, scopeId, subject);
    }
}
