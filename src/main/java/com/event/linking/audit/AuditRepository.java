package com.event.linking.audit;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for audit entry persistence.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findBySubjectId(String subjectId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findByActorId(String actorId);

    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();

    /**
     * Gets the most recent entries, up to the specified limit.
     */
    List<AuditEntry> findRecent(int limit);
}
