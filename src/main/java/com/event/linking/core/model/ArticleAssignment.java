package com.event.linking.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Assignment metadata recorded for an article once it has been processed.
 *
 * @param articleId          the article
 * @param outcome            what happened to the article
 * @param eventId            event the article belongs to, null for duplicates
 * @param canonicalArticleId canonical article of the duplicate group; the article itself when original
 * @param score              similarity score of the winning candidate, 1.0 for new events and exact duplicates
 * @param lowConfidence      true when upstream attributes were missing or weak
 * @param assignedAt         when the assignment was committed
 */
public record ArticleAssignment(
        String articleId,
        AssignmentOutcome outcome,
        String eventId,
        String canonicalArticleId,
        double score,
        boolean lowConfidence,
        Instant assignedAt
) {
    public ArticleAssignment {
        Objects.requireNonNull(articleId, "articleId is required");
        Objects.requireNonNull(outcome, "outcome is required");
        Objects.requireNonNull(assignedAt, "assignedAt is required");
        if (outcome != AssignmentOutcome.DUPLICATE && eventId == null) {
            throw new IllegalArgumentException("eventId is required for outcome " + outcome);
        }
    }

    public boolean isDuplicate() {
        return outcome == AssignmentOutcome.DUPLICATE;
    }

    /**
     * Returns a copy pointing at another event, used when reconciliation absorbs the article's event.
     */
    public ArticleAssignment withEventId(String newEventId) {
        return new ArticleAssignment(articleId, outcome, newEventId, canonicalArticleId, score,
                lowConfidence, assignedAt);
    }
}
