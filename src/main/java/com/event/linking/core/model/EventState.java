package com.event.linking.core.model;

/**
 * Lifecycle state of a tracked event.
 */
public enum EventState {
    /**
     * Accepting new matching articles.
     */
    OPEN,

    /**
     * No matching article within the dormancy window.
     * Still eligible for matching and reconciliation; a match reopens it.
     */
    DORMANT,

    /**
     * Finalized. Excluded from new assignment; only an explicit merge or operator reopen changes it.
     */
    CLOSED;

    public boolean acceptsArticles() {
        return this != CLOSED;
    }

    /**
     * The more active of two states, OPEN before DORMANT before CLOSED.
     */
    public static EventState mostActive(EventState a, EventState b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }
}
