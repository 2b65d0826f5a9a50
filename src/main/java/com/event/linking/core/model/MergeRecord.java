package com.event.linking.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable ledger entry for a reconciliation merge.
 */
public record MergeRecord(
        String id,
        String absorbedEventId,
        String survivingEventId,
        String absorbedEventKey,
        String survivingEventKey,
        int membersMoved,
        double score,
        String triggeredBy,
        String reasoning,
        Instant timestamp
) {
    public MergeRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(absorbedEventId, "absorbedEventId is required");
        Objects.requireNonNull(survivingEventId, "survivingEventId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String absorbedEventId;
        private String survivingEventId;
        private String absorbedEventKey;
        private String survivingEventKey;
        private int membersMoved;
        private double score;
        private String triggeredBy;
        private String reasoning;
        private Instant timestamp = Instant.now();

        public Builder absorbedEventId(String absorbedEventId) {
            this.absorbedEventId = absorbedEventId;
            return this;
        }

        public Builder survivingEventId(String survivingEventId) {
            this.survivingEventId = survivingEventId;
            return this;
        }

        public Builder absorbedEventKey(String absorbedEventKey) {
            this.absorbedEventKey = absorbedEventKey;
            return this;
        }

        public Builder survivingEventKey(String survivingEventKey) {
            this.survivingEventKey = survivingEventKey;
            return this;
        }

        public Builder membersMoved(int membersMoved) {
            this.membersMoved = membersMoved;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder triggeredBy(String triggeredBy) {
            this.triggeredBy = triggeredBy;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public MergeRecord build() {
            return new MergeRecord(id, absorbedEventId, survivingEventId, absorbedEventKey,
                    survivingEventKey, membersMoved, score, triggeredBy, reasoning, timestamp);
        }
    }
}
