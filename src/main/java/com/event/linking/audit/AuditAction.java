package com.event.linking.audit;

/**
 * Types of auditable actions in the event linking system.
 */
public enum AuditAction {
    ARTICLE_INGESTED(Subject.ARTICLE),
    DUPLICATE_DETECTED(Subject.ARTICLE),
    EVENT_CREATED(Subject.EVENT),
    EVENT_JOINED(Subject.EVENT),
    EVENT_DORMANT(Subject.EVENT),
    EVENT_CLOSED(Subject.EVENT),
    EVENT_REOPENED(Subject.EVENT),
    EVENT_FINALIZED(Subject.EVENT),
    EVENT_MERGED(Subject.EVENT),
    ASSIGNMENTS_REPOINTED(Subject.EVENT),
    INGEST_ROLLED_BACK(Subject.ARTICLE);

    /**
     * What the entry's subject id refers to.
     */
    public enum Subject {
        ARTICLE,
        EVENT
    }

    private final Subject subject;

    AuditAction(Subject subject) {
        this.subject = subject;
    }

    public Subject subject() {
        return subject;
    }
}
