package com.event.linking.similarity;

import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventKey;
import com.event.linking.core.model.MatchResult;
import com.event.linking.core.model.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Scores an article against a candidate event, or two events against each other.
 * Formula: score = textWeight * textSimilarity + attributeWeight * attributeOverlap
 *
 * <p>Text similarity is the best TF cosine between the article headline and the event's
 * representative texts. Attribute overlap is the mean of the components known on both sides:
 * sector match, scope match, event type match, actor Jaccard, location overlap and action date
 * proximity. With no component known on both sides the overlap is 0.</p>
 */
public class EventSimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(EventSimilarityScorer.class);

    private final CosineSimilarity cosine;
    private final SimilarityWeights weights;
    private final long dateProximityDays;

    /**
     * @param cosine            text similarity
     * @param weights           text and attribute weights
     * @param dateProximityDays distance in days at which date proximity falls to 0
     */
    public EventSimilarityScorer(CosineSimilarity cosine, SimilarityWeights weights, long dateProximityDays) {
        if (dateProximityDays <= 0) {
            throw new IllegalArgumentException("dateProximityDays must be positive");
        }
        this.cosine = cosine;
        this.weights = weights;
        this.dateProximityDays = dateProximityDays;
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    public MatchResult score(ArticleSignature article, Event event, double acceptanceThreshold) {
        double textScore = cosine.computeMax(article.headline(), event.getRepresentativeTexts());

        List<Double> components = new ArrayList<>();
        String eventSector = knownSector(event);
        if (article.hasSector() && eventSector != null) {
            components.add(article.sector().equals(eventSector) ? 1.0 : 0.0);
        }
        if (article.scope() != null && event.getScope() != null) {
            components.add(scopeMatch(article.scope(), event.getScope()));
        }
        if (article.eventType() != null && event.getEventType() != null) {
            components.add(article.eventType() == event.getEventType() ? 1.0 : 0.0);
        }
        if (!article.actors().isEmpty() && !event.getActors().isEmpty()) {
            components.add(JaccardSimilarity.jaccard(article.actors(), event.getActors()));
        }
        if (article.hasLocation() && !event.getLocations().isEmpty()) {
            components.add(event.getLocations().contains(article.location()) ? 1.0 : 0.0);
        }
        if (article.hasActionDate() && (event.getStartDate() != null || event.getEndDate() != null)) {
            components.add(proximity(distanceToSpan(article.actionDate(), event.getStartDate(), event.getEndDate())));
        }

        return combine(event.getId(), textScore, components, acceptanceThreshold);
    }

    /**
     * Scores {@code other} as a candidate for merging into {@code event}. Symmetric.
     */
    public MatchResult score(Event event, Event other, double acceptanceThreshold) {
        double textScore = Math.max(
                cosine.computeMax(event.getRepresentativeTexts(), other.getRepresentativeTexts()),
                cosine.computeMax(other.getRepresentativeTexts(), event.getRepresentativeTexts()));

        List<Double> components = new ArrayList<>();
        String sectorA = knownSector(event);
        String sectorB = knownSector(other);
        if (sectorA != null && sectorB != null) {
            components.add(sectorA.equals(sectorB) ? 1.0 : 0.0);
        }
        if (event.getScope() != null && other.getScope() != null) {
            components.add(scopeMatch(event.getScope(), other.getScope()));
        }
        if (event.getEventType() != null && other.getEventType() != null) {
            components.add(event.getEventType() == other.getEventType() ? 1.0 : 0.0);
        }
        if (!event.getActors().isEmpty() && !other.getActors().isEmpty()) {
            components.add(JaccardSimilarity.jaccard(event.getActors(), other.getActors()));
        }
        if (!event.getLocations().isEmpty() && !other.getLocations().isEmpty()) {
            components.add(JaccardSimilarity.overlap(event.getLocations(), other.getLocations()));
        }
        Long distance = distanceBetweenSpans(event, other);
        if (distance != null) {
            components.add(proximity(distance));
        }

        return combine(other.getId(), textScore, components, acceptanceThreshold);
    }

    private MatchResult combine(String eventId, double textScore, List<Double> components, double threshold) {
        double attributeScore = components.isEmpty() ? 0.0
                : components.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double score = clamp(weights.textWeight() * textScore + weights.attributeWeight() * attributeScore);
        MatchResult result = MatchResult.of(eventId, textScore, attributeScore, score, threshold);
        log.debug("similarity.scored eventId={} {} components={}", eventId, result.reasoning(), components.size());
        return result;
    }

    /**
     * Scope agreement. Neighbouring scopes score half, anything further apart scores 0.
     */
    static double scopeMatch(Scope a, Scope b) {
        int gap = Math.abs(a.ordinal() - b.ordinal());
        if (gap == 0) {
            return 1.0;
        }
        return gap == 1 ? 0.5 : 0.0;
    }

    double proximity(long distanceDays) {
        return Math.max(0.0, 1.0 - (double) distanceDays / dateProximityDays);
    }

    /**
     * Days between a date and a span with possibly open ends; 0 when the date falls inside.
     */
    static long distanceToSpan(LocalDate date, LocalDate start, LocalDate end) {
        if (start != null && date.isBefore(start)) {
            return ChronoUnit.DAYS.between(date, start);
        }
        if (end != null && date.isAfter(end)) {
            return ChronoUnit.DAYS.between(end, date);
        }
        return 0L;
    }

    /**
     * Days separating two event spans, 0 when they overlap, null when either span is wholly unknown.
     */
    public static Long distanceBetweenSpans(Event a, Event b) {
        LocalDate aStart = a.getStartDate() != null ? a.getStartDate() : a.getEndDate();
        LocalDate aEnd = a.getEndDate() != null ? a.getEndDate() : a.getStartDate();
        LocalDate bStart = b.getStartDate() != null ? b.getStartDate() : b.getEndDate();
        LocalDate bEnd = b.getEndDate() != null ? b.getEndDate() : b.getStartDate();
        if (aStart == null || bStart == null) {
            return null;
        }
        if (aEnd.isBefore(bStart)) {
            return ChronoUnit.DAYS.between(aEnd, bStart);
        }
        if (bEnd.isBefore(aStart)) {
            return ChronoUnit.DAYS.between(bEnd, aStart);
        }
        return 0L;
    }

    private static String knownSector(Event event) {
        String sector = event.getSector();
        return sector == null || sector.isEmpty() || EventKey.UNKNOWN.equals(sector) ? null : sector;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Whether two events are in the same sector, treating unknown sectors as unequal.
     */
    public static boolean sameSector(Event a, Event b) {
        String sa = knownSector(a);
        return sa != null && sa.equals(knownSector(b));
    }

    /**
     * Whether the sets share at least one element.
     */
    public static boolean intersects(Set<String> a, Set<String> b) {
        return JaccardSimilarity.overlap(a, b) > 0.0;
    }
}
