package com.event.linking.core.model;

/**
 * What the engine did with an ingested article.
 */
public enum AssignmentOutcome {
    /**
     * Copy or syndication of an earlier article; excluded from clustering and counting.
     */
    DUPLICATE,

    /**
     * Original article attached to an existing event.
     */
    JOINED_EVENT,

    /**
     * Original article that seeded a new event.
     */
    NEW_EVENT
}
