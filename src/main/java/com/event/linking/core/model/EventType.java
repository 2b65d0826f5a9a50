package com.event.linking.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of labour action reported by the upstream extractor.
 */
public enum EventType {
    STRIKE,
    WORK_STOPPAGE,
    PROTEST,
    LOCKOUT,
    UNION_CALL,
    NEGOTIATION,
    WORKPLACE_ACCIDENT,
    OTHER;

    /**
     * Parses an extractor label such as {@code "work_stoppage"} or {@code "work stoppage"}.
     */
    public static Optional<EventType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        try {
            return Optional.of(valueOf(normalized));
        } catch (IllegalArgumentException e) {
            return Optional.of(OTHER);
        }
    }
}
