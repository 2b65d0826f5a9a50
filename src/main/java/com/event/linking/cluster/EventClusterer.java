package com.event.linking.cluster;

import com.event.linking.api.LinkingOptions;
import com.event.linking.core.model.ArticleRecord;
import com.event.linking.core.model.AssignmentOutcome;
import com.event.linking.core.model.Event;
import com.event.linking.core.model.MatchResult;
import com.event.linking.metrics.MetricsService;
import com.event.linking.similarity.ArticleSignature;
import com.event.linking.similarity.EventSimilarityScorer;
import com.event.linking.store.EventStore;
import com.event.linking.store.StaleEventException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns an original article to an existing event or seeds a new one.
 *
 * <p>Candidates are open or dormant events that either share the article's key (ignoring the
 * date bucket when the article is undated, if the event was active within the match window),
 * or are in the same sector, overlap on location
 * (on actors when the article has no location) and were active within the match window of
 * the article's publication. The best candidate scoring strictly above the acceptance
 * threshold is joined; ties go to the most recently active event, then the lowest id.</p>
 *
 * <p>Joins are compare-and-set against the event version. A concurrent update of the
 * candidate restarts the search, up to the configured number of retries.</p>
 */
public class EventClusterer {
    private static final Logger log = LoggerFactory.getLogger(EventClusterer.class);

    private final EventStore eventStore;
    private final EventSimilarityScorer scorer;
    private final EventAggregation aggregation;
    private final LinkingOptions options;
    private final MetricsService metrics;
    private final Clock clock;

    public EventClusterer(EventStore eventStore, EventSimilarityScorer scorer, EventAggregation aggregation,
                          LinkingOptions options, MetricsService metrics, Clock clock) {
        this.eventStore = eventStore;
        this.scorer = scorer;
        this.aggregation = aggregation;
        this.options = options;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Assigns the article, retrying on concurrent event updates.
     *
     * @throws StaleEventException if every attempt lost a race
     */
    public ClusterDecision assign(ArticleRecord article, ArticleSignature signature, boolean lowConfidence) {
        StaleEventException lastConflict = null;
        int attempts = options.getMaxAssignmentRetries() + 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return attemptAssign(article, signature, lowConfidence, attempt);
            } catch (StaleEventException e) {
                lastConflict = e;
                metrics.incrementStaleRetry();
                log.debug("cluster.retry articleId={} eventId={} attempt={}",
                        article.getId(), e.getEventId(), attempt);
            }
        }
        log.warn("cluster.retries.exhausted articleId={} attempts={}", article.getId(), attempts);
        throw lastConflict;
    }

    private ClusterDecision attemptAssign(ArticleRecord article, ArticleSignature signature,
                                          boolean lowConfidence, int attempt) {
        Instant now = clock.instant();
        Optional<Scored> best = bestCandidate(article, signature);
        best.ifPresent(scored -> metrics.recordMatchScore(scored.match().score()));

        if (best.isPresent() && best.get().match().accepted()) {
            Event candidate = best.get().event();
            Event joined = aggregation.join(candidate, article, signature, lowConfidence, now);
            Event stored = eventStore.update(joined, candidate.getVersion());
            log.info("event.joined eventId={} articleId={} score={} members={}",
                    stored.getId(), article.getId(), best.get().match().score(), stored.memberCount());
            return new ClusterDecision(AssignmentOutcome.JOINED_EVENT, stored, candidate, best.get().match(), attempt);
        }

        Event seeded = aggregation.seed(article, signature, lowConfidence, now);
        Event stored = eventStore.insert(seeded);
        MatchResult match = best.map(Scored::match).orElse(MatchResult.noMatch());
        log.info("event.created eventId={} articleId={} key={} bestScore={}",
                stored.getId(), article.getId(), stored.getKey(), match.score());
        return new ClusterDecision(AssignmentOutcome.NEW_EVENT, stored, null, match, attempt);
    }

    /**
     * Scores every candidate and returns the best one, accepted or not.
     */
    public Optional<Scored> bestCandidate(ArticleRecord article, ArticleSignature signature) {
        return findCandidates(article, signature).stream()
                .map(event -> new Scored(event, scorer.score(signature, event, options.getAcceptanceThreshold())))
                .min(Comparator.comparingDouble((Scored s) -> s.match().score()).reversed()
                        .thenComparing((Scored s) -> s.event().getLastActivityAt(), Comparator.reverseOrder())
                        .thenComparing(s -> s.event().getId()));
    }

    public List<Event> findCandidates(ArticleRecord article, ArticleSignature signature) {
        Map<String, Event> candidates = new LinkedHashMap<>();
        Duration window = options.getMatchWindow();

        for (Event event : eventStore.findByUndatedKey(signature.key().undatedValue())) {
            // undated articles only match by key within the match window
            boolean keyMatches = signature.key().hasDate()
                    ? signature.key().equals(event.getKey())
                    : signature.key().matchesIgnoringDate(event.getKey())
                    && withinWindow(event.getLastActivityAt(), article.getPublishedAt(), window);
            if (keyMatches && acceptsArticles(event)) {
                candidates.put(event.getId(), event);
            }
        }

        if (signature.hasSector()) {
            for (Event event : eventStore.findBySector(signature.sector())) {
                if (candidates.containsKey(event.getId()) || !acceptsArticles(event)) {
                    continue;
                }
                boolean overlaps = signature.hasLocation()
                        ? event.getLocations().contains(signature.location())
                        : EventSimilarityScorer.intersects(signature.actors(), event.getActors());
                if (overlaps && withinWindow(event.getLastActivityAt(), article.getPublishedAt(), window)) {
                    candidates.put(event.getId(), event);
                }
            }
        }

        log.debug("cluster.candidates articleId={} count={}", article.getId(), candidates.size());
        return List.copyOf(candidates.values());
    }

    /**
     * Backs out an assignment for a rolled-back ingestion. A new event is deleted; a joined
     * event is restored to its previous snapshot, or loses the member if it changed since.
     */
    public void undo(ClusterDecision decision, String articleId) {
        Event assigned = decision.event();
        if (!decision.joined()) {
            eventStore.delete(assigned.getId());
            return;
        }
        for (int attempt = 0; attempt <= options.getMaxAssignmentRetries(); attempt++) {
            Optional<Event> current = eventStore.findById(assigned.getId());
            if (current.isEmpty() || !current.get().hasMember(articleId)) {
                return;
            }
            if (current.get().getVersion() == assigned.getVersion()) {
                eventStore.restore(decision.previous());
                return;
            }
            try {
                Event reduced = aggregation.withoutMember(current.get(), articleId, clock.instant());
                eventStore.update(reduced, current.get().getVersion());
                return;
            } catch (StaleEventException e) {
                log.debug("cluster.undo.retry eventId={} articleId={}", assigned.getId(), articleId);
            }
        }
        throw new StaleEventException(assigned.getId(), assigned.getVersion(),
                eventStore.findById(assigned.getId()).map(Event::getVersion).orElse(-1L));
    }

    private static boolean acceptsArticles(Event event) {
        return !event.isAbsorbed() && event.getState().acceptsArticles();
    }

    private static boolean withinWindow(Instant a, Instant b, Duration window) {
        return Duration.between(a, b).abs().compareTo(window) <= 0;
    }

    /**
     * A candidate event with its score.
     */
    public record Scored(Event event, MatchResult match) {
    }
}
