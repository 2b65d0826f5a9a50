package com.event.linking.api;

import com.event.linking.core.model.ArticleAssignment;
import com.event.linking.core.model.AssignmentOutcome;
import com.event.linking.core.model.Event;
import com.event.linking.dedup.DuplicateCheckResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of ingesting one article.
 *
 * <p>For a duplicate, {@link #getEventId()} is the event of the canonical article when there is
 * one. For a re-ingested article, the result describes the earlier assignment and
 * {@link #isAlreadyProcessed()} is true.</p>
 */
public final class IngestResult {

    private final String articleId;
    private final AssignmentOutcome outcome;
    private final String eventId;
    private final String canonicalArticleId;
    private final DuplicateCheckResult.MatchKind duplicateKind;
    private final double score;
    private final boolean lowConfidence;
    private final boolean alreadyProcessed;
    private final Event event;

    private IngestResult(Builder builder) {
        this.articleId = Objects.requireNonNull(builder.articleId, "articleId is required");
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome is required");
        this.eventId = builder.eventId;
        this.canonicalArticleId = builder.canonicalArticleId;
        this.duplicateKind = builder.duplicateKind != null
                ? builder.duplicateKind : DuplicateCheckResult.MatchKind.NONE;
        this.score = builder.score;
        this.lowConfidence = builder.lowConfidence;
        this.alreadyProcessed = builder.alreadyProcessed;
        this.event = builder.event;
    }

    /**
     * Result for an article whose assignment already exists.
     */
    public static IngestResult alreadyProcessed(ArticleAssignment assignment, Event event) {
        return builder()
                .articleId(assignment.articleId())
                .outcome(assignment.outcome())
                .eventId(event != null ? event.getId() : assignment.eventId())
                .canonicalArticleId(assignment.canonicalArticleId())
                .score(assignment.score())
                .lowConfidence(assignment.lowConfidence())
                .alreadyProcessed(true)
                .event(event)
                .build();
    }

    public String getArticleId() {
        return articleId;
    }

    public AssignmentOutcome getOutcome() {
        return outcome;
    }

    public String getEventId() {
        return eventId;
    }

    public String getCanonicalArticleId() {
        return canonicalArticleId;
    }

    public DuplicateCheckResult.MatchKind getDuplicateKind() {
        return duplicateKind;
    }

    public double getScore() {
        return score;
    }

    public boolean isLowConfidence() {
        return lowConfidence;
    }

    public boolean isAlreadyProcessed() {
        return alreadyProcessed;
    }

    /**
     * The event snapshot right after the assignment, empty for duplicates without an event.
     */
    public Optional<Event> getEvent() {
        return Optional.ofNullable(event);
    }

    public boolean isDuplicate() {
        return outcome == AssignmentOutcome.DUPLICATE;
    }

    public boolean isNewEvent() {
        return outcome == AssignmentOutcome.NEW_EVENT;
    }

    public boolean joinedEvent() {
        return outcome == AssignmentOutcome.JOINED_EVENT;
    }

    @Override
    public String toString() {
        return "IngestResult{" +
                "articleId='" + articleId + '\'' +
                ", outcome=" + outcome +
                ", eventId='" + eventId + '\'' +
                ", canonicalArticleId='" + canonicalArticleId + '\'' +
                ", score=" + score +
                ", lowConfidence=" + lowConfidence +
                ", alreadyProcessed=" + alreadyProcessed +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String articleId;
        private AssignmentOutcome outcome;
        private String eventId;
        private String canonicalArticleId;
        private DuplicateCheckResult.MatchKind duplicateKind;
        private double score;
        private boolean lowConfidence;
        private boolean alreadyProcessed;
        private Event event;

        public Builder articleId(String articleId) {
            this.articleId = articleId;
            return this;
        }

        public Builder outcome(AssignmentOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder canonicalArticleId(String canonicalArticleId) {
            this.canonicalArticleId = canonicalArticleId;
            return this;
        }

        public Builder duplicateKind(DuplicateCheckResult.MatchKind duplicateKind) {
            this.duplicateKind = duplicateKind;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder lowConfidence(boolean lowConfidence) {
            this.lowConfidence = lowConfidence;
            return this;
        }

        public Builder alreadyProcessed(boolean alreadyProcessed) {
            this.alreadyProcessed = alreadyProcessed;
            return this;
        }

        public Builder event(Event event) {
            this.event = event;
            return this;
        }

        public IngestResult build() {
            return new IngestResult(this);
        }
    }
}
