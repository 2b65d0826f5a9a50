package com.event.linking.core.model;

/**
 * Thrown when an operation would break a data-integrity invariant, such as an article
 * belonging to two events or an event whose start date lies after its end date.
 * The offending transaction is rolled back; the state is never repaired silently.
 */
public class EventIntegrityException extends RuntimeException {

    public EventIntegrityException(String message) {
        super(message);
    }

    public EventIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
