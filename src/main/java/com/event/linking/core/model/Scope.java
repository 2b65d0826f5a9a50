package com.event.linking.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Geographic or organisational reach of a labour action.
 * Declaration order is the severity order: each constant is strictly broader than the previous one.
 */
public enum Scope {
    COMPANY,
    LOCAL,
    REGIONAL,
    NATIONAL,
    GENERAL;

    /**
     * Returns true if this scope is strictly broader than the other.
     */
    public boolean isBroaderThan(Scope other) {
        return other == null || ordinal() > other.ordinal();
    }

    /**
     * Returns the broader of two scopes, treating null as unknown.
     */
    public static Scope broadest(Scope a, Scope b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /**
     * Parses an extractor label such as {@code "national"}. Unknown labels yield empty.
     */
    public static Optional<Scope> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
