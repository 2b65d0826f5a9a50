package com.event.linking.audit;

import com.event.linking.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Records and queries the append-only audit trail of event changes.
 * Entries recorded inside a {@link LogContext} carry its shard and correlation id.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_ACTOR = "system";

    private final AuditRepository repository;
    private final Clock clock;

    public AuditService() {
        this(new InMemoryAuditRepository(), Clock.systemUTC());
    }

    public AuditService(AuditRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("audit.recorded action={} subjectId={} actorId={}",
                entry.action(), entry.subjectId(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .subjectId(subjectId)
                .actorId(actorId)
                .shard(MDC.get(LogContext.SHARD))
                .correlationId(MDC.get(LogContext.CORRELATION_ID))
                .details(details)
                .timestamp(clock.instant())
                .build());
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId) {
        return record(action, subjectId, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesFor(String subjectId) {
        return repository.findBySubjectId(subjectId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesByActor(String actorId) {
        return repository.findByActorId(actorId);
    }

    public List<AuditEntry> getEntriesBetween(Instant start, Instant end) {
        return repository.findBetween(start, end);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }
}
