package com.event.linking.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable operation.
 *
 * @param subjectId     the event or article the action applies to, see {@link AuditAction#subject()}
 * @param actorId       who triggered the action: "system", "reconciliation" or an operator id
 * @param shard         {@code sector|location} shard the change was made under, null when unknown
 * @param correlationId ingest or merge correlation id, null when none was in scope
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String subjectId,
        String actorId,
        String shard,
        String correlationId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public boolean concernsArticle() {
        return action.subject() == AuditAction.Subject.ARTICLE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private String subjectId;
        private String actorId;
        private String shard;
        private String correlationId;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder shard(String shard) {
            this.shard = shard;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, subjectId, actorId, shard, correlationId, details, timestamp);
        }
    }
}
