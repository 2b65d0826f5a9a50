package com.event.linking.api;

import com.event.linking.audit.AuditAction;
import com.event.linking.audit.AuditService;
import com.event.linking.cluster.ClusterDecision;
import com.event.linking.cluster.EventClusterer;
import com.event.linking.core.model.ArticleAssignment;
import com.event.linking.core.model.ArticleRecord;
import com.event.linking.core.model.AssignmentOutcome;
import com.event.linking.core.model.AttributeBundle;
import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventState;
import com.event.linking.dedup.DuplicateCheckResult;
import com.event.linking.dedup.NearDuplicateDetector;
import com.event.linking.lock.ShardLock;
import com.event.linking.logging.LogContext;
import com.event.linking.metrics.MetricsService;
import com.event.linking.similarity.ArticleSignature;
import com.event.linking.similarity.EventKeyBuilder;
import com.event.linking.store.ArticleRepository;
import com.event.linking.store.EventStore;
import com.event.linking.store.StoreTransaction;
import com.event.linking.tracing.Span;
import com.event.linking.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the linking pipeline for one article.
 *
 * <p>Each article is one {@link StoreTransaction}: registration, the duplicate index, the event
 * store and the assignment each register a compensation, so a failure at any step leaves no
 * trace of the article. The article's shard is locked for the whole transaction.</p>
 *
 * <p>Pipeline:</p>
 * <ol>
 *   <li>Validate; return the existing assignment for a known article id</li>
 *   <li>Duplicate check and registration; duplicates stop here</li>
 *   <li>Candidate key and signature</li>
 *   <li>Join the best matching event or seed a new one</li>
 *   <li>Record the assignment</li>
 * </ol>
 */
public class EventLinkingService {
    private static final Logger log = LoggerFactory.getLogger(EventLinkingService.class);

    private final EventStore eventStore;
    private final ArticleRepository articleRepository;
    private final NearDuplicateDetector duplicateDetector;
    private final EventKeyBuilder keyBuilder;
    private final EventClusterer clusterer;
    private final ShardLock shardLock;
    private final AuditService auditService;
    private final LinkingOptions options;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final Clock clock;

    public EventLinkingService(EventStore eventStore, ArticleRepository articleRepository,
                               NearDuplicateDetector duplicateDetector, EventKeyBuilder keyBuilder,
                               EventClusterer clusterer, ShardLock shardLock, AuditService auditService,
                               LinkingOptions options, MetricsService metrics, TracingService tracing,
                               Clock clock) {
        this.eventStore = eventStore;
        this.articleRepository = articleRepository;
        this.duplicateDetector = duplicateDetector;
        this.keyBuilder = keyBuilder;
        this.clusterer = clusterer;
        this.shardLock = shardLock;
        this.auditService = auditService;
        this.options = options;
        this.metrics = metrics;
        this.tracing = tracing;
        this.clock = clock;
    }

    /**
     * Ingests one article. Re-ingesting a known article id has no side effects.
     *
     * @throws IllegalArgumentException if the article is invalid
     * @throws IllegalStateException    if the same article id is being ingested concurrently
     */
    public IngestResult ingest(ArticleRecord article) {
        ArticleValidator.validate(article);

        Optional<IngestResult> existing = existingResult(article.getId());
        if (existing.isPresent()) {
            log.debug("ingest.skipped articleId={} reason=already-processed", article.getId());
            return existing.get();
        }

        String shardKey = keyBuilder.shardKey(article.getAttributes());
        long started = System.nanoTime();
        try (LogContext ctx = LogContext.forIngest(LogContext.generateCorrelationId(), article.getId(), shardKey);
             Span span = tracing.startSpan("event.ingest",
                     Map.of(TracingService.ARTICLE_ID, article.getId(), TracingService.SHARD, shardKey))) {
            try {
                shardLock.lock(shardKey);
                IngestResult result;
                try {
                    result = ingestLocked(article);
                } finally {
                    shardLock.unlock(shardKey);
                }
                span.setAttribute(TracingService.OUTCOME, result.getOutcome().name());
                if (result.getEventId() != null) {
                    span.setAttribute(TracingService.EVENT_ID, result.getEventId());
                }
                span.setStatus(Span.SpanStatus.OK);
                if (!result.isAlreadyProcessed()) {
                    metrics.recordIngestDuration(result.getOutcome(), Duration.ofNanos(System.nanoTime() - started));
                }
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    private IngestResult ingestLocked(ArticleRecord article) {
        String articleId = article.getId();
        try (StoreTransaction tx = new StoreTransaction("ingest " + articleId)) {
            boolean registered = tx.execute("register article",
                    () -> articleRepository.register(article),
                    fresh -> {
                        if (fresh) {
                            articleRepository.unregister(articleId);
                        }
                    });
            if (!registered) {
                tx.markSuccess();
                return existingResult(articleId).orElseThrow(() ->
                        new IllegalStateException("Article " + articleId + " is already being ingested"));
            }

            DuplicateCheckResult dedup = tx.execute("check duplicates",
                    () -> duplicateDetector.checkAndRegister(article),
                    ignored -> duplicateDetector.unregister(articleId));

            IngestResult result = dedup.duplicate()
                    ? recordDuplicate(tx, article, dedup)
                    : assignToEvent(tx, article);

            tx.executeNoCompensation("audit ingestion", () ->
                    auditService.record(AuditAction.ARTICLE_INGESTED, articleId, AuditService.SYSTEM_ACTOR,
                            Map.of("outcome", result.getOutcome().name())));
            tx.markSuccess();
            log.info("ingest.completed articleId={} outcome={} eventId={} lowConfidence={}",
                    articleId, result.getOutcome(), result.getEventId(), result.isLowConfidence());
            return result;
        } catch (RuntimeException e) {
            metrics.incrementIngestFailure();
            auditService.record(AuditAction.INGEST_ROLLED_BACK, articleId, AuditService.SYSTEM_ACTOR,
                    Map.of("error", String.valueOf(e.getMessage())));
            log.error("ingest.failed articleId={} error={}", articleId, e.getMessage());
            throw e;
        }
    }

    private IngestResult recordDuplicate(StoreTransaction tx, ArticleRecord article, DuplicateCheckResult dedup) {
        String canonicalId = dedup.canonicalArticleId();
        String eventId = eventStore.findEventIdForArticle(canonicalId).orElse(null);
        ArticleAssignment assignment = new ArticleAssignment(article.getId(), AssignmentOutcome.DUPLICATE,
                eventId, canonicalId, 1.0, false, clock.instant());

        tx.execute("save assignment",
                () -> articleRepository.saveAssignment(assignment),
                () -> articleRepository.deleteAssignment(article.getId()));
        tx.executeNoCompensation("audit duplicate", () -> {
            Map<String, Object> details = new HashMap<>();
            details.put("canonicalArticleId", canonicalId);
            details.put("matchedArticleId", dedup.matchedArticleId());
            details.put("kind", dedup.matchKind().name());
            details.put("hammingDistance", dedup.hammingDistance());
            auditService.record(AuditAction.DUPLICATE_DETECTED, article.getId(), AuditService.SYSTEM_ACTOR, details);
        });
        metrics.incrementDuplicateDetected(dedup.matchKind().name());

        return IngestResult.builder()
                .articleId(article.getId())
                .outcome(AssignmentOutcome.DUPLICATE)
                .eventId(eventId)
                .canonicalArticleId(canonicalId)
                .duplicateKind(dedup.matchKind())
                .score(1.0)
                .event(eventId != null ? eventStore.findById(eventId).orElse(null) : null)
                .build();
    }

    private IngestResult assignToEvent(StoreTransaction tx, ArticleRecord article) {
        String articleId = article.getId();
        boolean lowConfidence = isLowConfidence(article.getAttributes());
        if (lowConfidence) {
            metrics.incrementLowConfidence();
            log.debug("ingest.lowConfidence articleId={} meanConfidence={}",
                    articleId, article.getAttributes().meanConfidence());
        }
        ArticleSignature signature = keyBuilder.signature(article);

        ClusterDecision decision = tx.execute("assign event",
                () -> clusterer.assign(article, signature, lowConfidence),
                assigned -> clusterer.undo(assigned, articleId));
        Event event = decision.event();
        double score = decision.joined() ? decision.match().score() : 1.0;

        ArticleAssignment assignment = new ArticleAssignment(articleId, decision.outcome(), event.getId(),
                articleId, score, lowConfidence, clock.instant());
        tx.execute("save assignment",
                () -> articleRepository.saveAssignment(assignment),
                () -> articleRepository.deleteAssignment(articleId));

        tx.executeNoCompensation("audit assignment", () -> {
            if (decision.joined()) {
                auditService.record(AuditAction.EVENT_JOINED, event.getId(), AuditService.SYSTEM_ACTOR,
                        Map.of("articleId", articleId, "score", score, "members", event.memberCount()));
                if (decision.previous().getState() == EventState.DORMANT) {
                    auditService.record(AuditAction.EVENT_REOPENED, event.getId(), AuditService.SYSTEM_ACTOR,
                            Map.of("articleId", articleId, "from", EventState.DORMANT.name()));
                    metrics.incrementLifecycleTransition(EventState.DORMANT, EventState.OPEN);
                }
            } else {
                auditService.record(AuditAction.EVENT_CREATED, event.getId(), AuditService.SYSTEM_ACTOR,
                        Map.of("articleId", articleId, "key", event.getKey().value()));
            }
        });

        return IngestResult.builder()
                .articleId(articleId)
                .outcome(decision.outcome())
                .eventId(event.getId())
                .canonicalArticleId(articleId)
                .score(score)
                .lowConfidence(lowConfidence)
                .event(event)
                .build();
    }

    boolean isLowConfidence(AttributeBundle attributes) {
        return attributes.isEmpty() || attributes.meanConfidence() < options.getLowConfidenceThreshold();
    }

    private Optional<IngestResult> existingResult(String articleId) {
        return articleRepository.findAssignment(articleId).map(assignment -> {
            Event event = currentEvent(assignment).orElse(null);
            return IngestResult.alreadyProcessed(assignment, event);
        });
    }

    /**
     * The surviving event of an assignment, following merges.
     */
    Optional<Event> currentEvent(ArticleAssignment assignment) {
        String lookupId = assignment.isDuplicate() ? assignment.canonicalArticleId() : assignment.articleId();
        Optional<String> eventId = eventStore.findEventIdForArticle(lookupId);
        if (eventId.isEmpty() && assignment.eventId() != null) {
            eventId = Optional.of(assignment.eventId());
        }
        return eventId.flatMap(eventStore::findById);
    }
}
