package io.casetime.core;

/**
 * Base of the engine's error taxonomy. Every error carries the scope it was raised in
 * and the offending subject (a fact id or an owner reference), either of which may be
 * {@code null} when not known at the raise site.
 */
public abstract class TemporalException extends RuntimeException {
    private final String scopeId;
    private final String subject;

    protected TemporalException(String message, String scopeId, Object subject) {
        super(message);
        this.scopeId = scopeId;
        this.subject = subject == null ? null : subject.toString();
    }

    public String scopeId() { return scopeId; }

    public String subject() { return subject; }
}
