package com.event.linking.store;

/**
 * Thrown when an event update was derived from a snapshot that is no longer current.
 * The caller re-reads the event and retries.
 */
public class StaleEventException extends RuntimeException {

    private final String eventId;
    private final long expectedVersion;
    private final long actualVersion;

    public StaleEventException(String eventId, long expectedVersion, long actualVersion) {
        super("Event " + eventId + " is at version " + actualVersion + ", expected " + expectedVersion);
        this.eventId = eventId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getEventId() {
        return eventId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
