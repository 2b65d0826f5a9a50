package com.event.linking.cluster;

import com.event.linking.api.LinkingOptions;
import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventState;
import com.event.linking.core.model.MatchResult;
import com.event.linking.core.model.MergeRecord;
import com.event.linking.logging.LogContext;
import com.event.linking.merge.EventMergeEngine;
import com.event.linking.merge.MergeResult;
import com.event.linking.metrics.MetricsService;
import com.event.linking.similarity.EventSimilarityScorer;
import com.event.linking.store.EventStore;
import com.event.linking.store.StaleEventException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Merges events that incremental clustering split.
 *
 * <p>A pass compares pairs of surviving events of the same sector: open, dormant, and closed
 * within the grace period, whose date spans or last activity lie within the match window of each
 * other. Pairs scoring strictly above the reconciliation threshold are merged. Sweeps repeat
 * until one finds nothing to merge, so a second pass over an unchanged store is a no-op. The pass
 * stops early when it exceeds its time budget; the remaining pairs wait for the next pass.</p>
 */
public class ReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    public static final String RECONCILIATION_ACTOR = "reconciliation";

    private final EventStore eventStore;
    private final EventSimilarityScorer scorer;
    private final EventMergeEngine mergeEngine;
    private final LinkingOptions options;
    private final MetricsService metrics;
    private final Clock clock;
    private final ReentrantLock passLock = new ReentrantLock();

    public ReconciliationService(EventStore eventStore, EventSimilarityScorer scorer, EventMergeEngine mergeEngine,
                                 LinkingOptions options, MetricsService metrics, Clock clock) {
        this.eventStore = eventStore;
        this.scorer = scorer;
        this.mergeEngine = mergeEngine;
        this.options = options;
        this.metrics = metrics;
        this.clock = clock;
    }

    public ReconciliationResult reconcile() {
        return reconcile(RECONCILIATION_ACTOR);
    }

    /**
     * Runs one pass. Concurrent calls run one after the other.
     */
    public ReconciliationResult reconcile(String triggeredBy) {
        passLock.lock();
        try (LogContext ctx = LogContext.forReconciliation(UUID.randomUUID().toString())) {
            return runPass(triggeredBy);
        } finally {
            passLock.unlock();
        }
    }

    private ReconciliationResult runPass(String triggeredBy) {
        long started = System.nanoTime();
        long deadline = started + options.getMaxReconciliationDuration().toNanos();
        int compared = 0;
        int failures = 0;
        boolean timedOut = false;
        List<MergeRecord> merges = new ArrayList<>();

        boolean merged = true;
        sweep:
        while (merged) {
            merged = false;
            for (List<Event> sector : eligibleBySector().values()) {
                for (int i = 0; i < sector.size(); i++) {
                    for (int j = i + 1; j < sector.size(); j++) {
                        if (System.nanoTime() > deadline) {
                            timedOut = true;
                            break sweep;
                        }
                        Event a = sector.get(i);
                        Event b = sector.get(j);
                        if (!closeInTime(a, b)) {
                            continue;
                        }
                        compared++;
                        MatchResult match = scorer.score(a, b, options.getReconciliationThreshold());
                        if (!match.accepted()) {
                            continue;
                        }
                        try {
                            MergeResult result = mergeEngine.merge(a.getId(), b.getId(),
                                    options.getReconciliationThreshold(), triggeredBy);
                            if (result.isSuccess()) {
                                merges.add(result.mergeRecord());
                                metrics.incrementEventsMerged(1);
                                merged = true;
                                // Pair list is stale after a merge; start a fresh sweep
                                continue sweep;
                            }
                            log.debug("reconcile.skipped first={} second={} reason={}",
                                    a.getId(), b.getId(), result.errorMessage());
                        } catch (StaleEventException e) {
                            failures++;
                            log.warn("reconcile.conflict first={} second={} eventId={}",
                                    a.getId(), b.getId(), e.getEventId());
                        }
                    }
                }
            }
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - started);
        metrics.recordReconciliationDuration(duration);
        log.info("reconcile.completed compared={} merges={} failures={} timedOut={} durationMs={}",
                compared, merges.size(), failures, timedOut, duration.toMillis());
        return new ReconciliationResult(compared, merges, failures, timedOut, duration);
    }

    /**
     * Eligible events grouped by known sector, each group in creation order.
     */
    Map<String, List<Event>> eligibleBySector() {
        Instant now = clock.instant();
        Map<String, List<Event>> bySector = new LinkedHashMap<>();
        eventStore.findSurviving().stream()
                .filter(e -> e.getSector() != null)
                .filter(e -> eligible(e, now))
                .sorted(Comparator.comparing(Event::getSector)
                        .thenComparing(Event::getCreatedAt)
                        .thenComparing(Event::getId))
                .forEach(e -> bySector.computeIfAbsent(e.getSector(), k -> new ArrayList<>()).add(e));
        return bySector;
    }

    private boolean eligible(Event event, Instant now) {
        if (event.getState() != EventState.CLOSED) {
            return true;
        }
        return event.getClosedAt() != null
                && Duration.between(event.getClosedAt(), now).compareTo(options.getClosedMergeGracePeriod()) <= 0;
    }

    /**
     * Date spans within the match window of each other, or last activity within it.
     */
    boolean closeInTime(Event a, Event b) {
        Duration window = options.getMatchWindow();
        if (Duration.between(a.getLastActivityAt(), b.getLastActivityAt()).abs().compareTo(window) <= 0) {
            return true;
        }
        Long gapDays = EventSimilarityScorer.distanceBetweenSpans(a, b);
        return gapDays != null && Duration.ofDays(gapDays).compareTo(window) <= 0;
    }
}
