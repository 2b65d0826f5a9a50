package com.event.linking.merge;

import com.event.linking.audit.AuditAction;
import com.event.linking.audit.AuditService;
import com.event.linking.audit.MergeLedger;
import com.event.linking.cluster.EventAggregation;
import com.event.linking.core.model.ArticleAssignment;
import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventState;
import com.event.linking.core.model.MatchResult;
import com.event.linking.core.model.MergeRecord;
import com.event.linking.lock.ShardLock;
import com.event.linking.logging.LogContext;
import com.event.linking.similarity.EventSimilarityScorer;
import com.event.linking.store.ArticleRepository;
import com.event.linking.store.EventStore;
import com.event.linking.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Merges two events that describe the same action.
 *
 * <p>The survivor is the event with more members, then the earlier created, then the lower id,
 * and takes the more active state of the pair.
 * It receives the union of members, actors and locations and the wider date span. The absorbed
 * event is closed with {@code mergedIntoId} pointing at the survivor, and the assignments of its
 * articles are re-pointed. Both shards are locked in sorted order and the whole merge runs in a
 * {@link StoreTransaction}.</p>
 */
public class EventMergeEngine {
    private static final Logger log = LoggerFactory.getLogger(EventMergeEngine.class);

    public static final Comparator<Event> SURVIVOR_ORDER =
            Comparator.comparingInt(Event::memberCount).reversed()
                    .thenComparing(Event::getCreatedAt)
                    .thenComparing(Event::getId);

    private final EventStore eventStore;
    private final ArticleRepository articleRepository;
    private final EventAggregation aggregation;
    private final EventSimilarityScorer scorer;
    private final ShardLock shardLock;
    private final MergeLedger mergeLedger;
    private final AuditService auditService;
    private final Clock clock;

    public EventMergeEngine(EventStore eventStore, ArticleRepository articleRepository,
                            EventAggregation aggregation, EventSimilarityScorer scorer, ShardLock shardLock,
                            MergeLedger mergeLedger, AuditService auditService, Clock clock) {
        this.eventStore = eventStore;
        this.articleRepository = articleRepository;
        this.aggregation = aggregation;
        this.scorer = scorer;
        this.shardLock = shardLock;
        this.mergeLedger = mergeLedger;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Merges two events if, re-read under their shard locks, they still score above the threshold.
     */
    public MergeResult merge(String firstEventId, String secondEventId, double threshold, String triggeredBy) {
        Optional<Event> first = eventStore.findById(firstEventId);
        Optional<Event> second = eventStore.findById(secondEventId);
        if (first.isEmpty() || second.isEmpty()) {
            return MergeResult.failure("Event not found: " + (first.isEmpty() ? firstEventId : secondEventId));
        }

        try (ShardLock.Handle handle = shardLock.lockAll(List.of(first.get().getShardKey(),
                second.get().getShardKey()))) {
            Event a = eventStore.findById(firstEventId).orElseThrow();
            Event b = eventStore.findById(secondEventId).orElseThrow();
            if (a.isAbsorbed() || b.isAbsorbed()) {
                return MergeResult.failure(a, b, "Event already absorbed");
            }
            MatchResult match = scorer.score(a, b, threshold);
            if (!match.accepted()) {
                return MergeResult.failure(a, b, "Events no longer similar: " + match.reasoning());
            }
            Event survivor = SURVIVOR_ORDER.compare(a, b) <= 0 ? a : b;
            Event absorbed = survivor == a ? b : a;
            return mergeLocked(survivor, absorbed, match, triggeredBy);
        }
    }

    private MergeResult mergeLocked(Event survivor, Event absorbed, MatchResult match, String triggeredBy) {
        try (LogContext ctx = LogContext.forMerge(LogContext.generateCorrelationId(),
                survivor.getId(), absorbed.getId())) {
            log.info("merge.starting survivorId={} absorbedId={} score={} triggeredBy={}",
                    survivor.getId(), absorbed.getId(), match.score(), triggeredBy);

            Instant now = clock.instant();
            Event mergedSurvivor = aggregation.absorb(survivor, absorbed, now);
            Event closedAbsorbed = Event.builder(absorbed)
                    .state(EventState.CLOSED)
                    .closedAt(absorbed.getClosedAt() != null ? absorbed.getClosedAt() : now)
                    .mergedIntoId(survivor.getId())
                    .updatedAt(now)
                    .build();

            try (StoreTransaction tx = new StoreTransaction("merge " + absorbed.getId() + "->" + survivor.getId())) {
                EventStore.MergedPair stored = tx.execute("store merged events",
                        () -> eventStore.merge(mergedSurvivor, survivor.getVersion(),
                                closedAbsorbed, absorbed.getVersion()),
                        pair -> {
                            eventStore.restore(absorbed);
                            eventStore.restore(survivor);
                        });

                AtomicReference<List<ArticleAssignment>> previous = new AtomicReference<>(List.of());
                tx.execute("re-point assignments",
                        () -> previous.set(articleRepository.repointAssignments(absorbed.getId(), survivor.getId())),
                        () -> previous.get().forEach(articleRepository::saveAssignment));
                int repointed = previous.get().size();

                MergeRecord record = MergeRecord.builder()
                        .absorbedEventId(absorbed.getId())
                        .survivingEventId(survivor.getId())
                        .absorbedEventKey(absorbed.getKey().value())
                        .survivingEventKey(survivor.getKey().value())
                        .membersMoved(absorbed.memberCount())
                        .score(match.score())
                        .triggeredBy(triggeredBy)
                        .reasoning(match.reasoning())
                        .timestamp(now)
                        .build();
                tx.executeNoCompensation("record merge", () -> {
                    mergeLedger.record(record);
                    auditService.record(AuditAction.EVENT_MERGED, survivor.getId(), triggeredBy, Map.of(
                            "absorbedEventId", absorbed.getId(),
                            "score", match.score(),
                            "membersMoved", absorbed.memberCount()));
                    auditService.record(AuditAction.ASSIGNMENTS_REPOINTED, absorbed.getId(), triggeredBy,
                            Map.of("survivorEventId", survivor.getId(), "count", repointed));
                });
                tx.markSuccess();

                log.info("merge.completed survivorId={} absorbedId={} members={} repointed={}",
                        survivor.getId(), absorbed.getId(), stored.survivor().memberCount(), repointed);
                return MergeResult.success(stored.survivor(), stored.absorbed(), record, repointed);
            }
        }
    }
}
