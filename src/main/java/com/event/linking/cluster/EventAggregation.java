package com.event.linking.cluster;

import com.event.linking.core.model.ArticleRecord;
import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventMember;
import com.event.linking.core.model.EventState;
import com.event.linking.core.model.Scope;
import com.event.linking.severity.SeverityAssessment;
import com.event.linking.severity.SeverityScorer;
import com.event.linking.similarity.ArticleSignature;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds event snapshots: seeding from an article, folding in a new member, and absorbing
 * another event. Every result has its severity and confidence recomputed.
 *
 * <p>Date spans only widen. Undated members leave the span unchanged. The event scope is the
 * broadest scope reported by any member; sector and event type come from the first member
 * that reports them.</p>
 */
public class EventAggregation {

    private final SeverityScorer severityScorer;
    private final int maxRepresentativeTexts;

    public EventAggregation(SeverityScorer severityScorer, int maxRepresentativeTexts) {
        this.severityScorer = severityScorer;
        this.maxRepresentativeTexts = maxRepresentativeTexts;
    }

    public Event seed(ArticleRecord article, ArticleSignature signature, boolean lowConfidence, Instant now) {
        Event.Builder builder = Event.builder()
                .key(signature.key())
                .sector(signature.sector())
                .scope(signature.scope())
                .eventType(signature.eventType())
                .startDate(signature.actionDate())
                .endDate(signature.actionDate())
                .state(EventState.OPEN)
                .createdAt(now)
                .updatedAt(now)
                .lastActivityAt(article.getPublishedAt())
                .addActors(signature.actors())
                .addMember(member(article, signature, lowConfidence))
                .representativeTexts(appendText(List.of(), signature.headline()));
        if (signature.hasLocation()) {
            builder.addLocation(signature.location());
        }
        return withSeverity(builder);
    }

    /**
     * Adds the article to the event. A dormant event becomes open again.
     */
    public Event join(Event event, ArticleRecord article, ArticleSignature signature,
                      boolean lowConfidence, Instant now) {
        Event.Builder builder = Event.builder(event)
                .scope(Scope.broadest(event.getScope(), signature.scope()))
                .startDate(earliest(event.getStartDate(), signature.actionDate()))
                .endDate(latest(event.getEndDate(), signature.actionDate()))
                .lastActivityAt(latest(event.getLastActivityAt(), article.getPublishedAt()))
                .updatedAt(now)
                .addActors(signature.actors())
                .addMember(member(article, signature, lowConfidence))
                .representativeTexts(appendText(event.getRepresentativeTexts(), signature.headline()));
        if (event.getSector() == null) {
            builder.sector(signature.sector());
        }
        if (event.getEventType() == null) {
            builder.eventType(signature.eventType());
        }
        if (signature.hasLocation()) {
            builder.addLocation(signature.location());
        }
        if (event.getState() == EventState.DORMANT) {
            builder.state(EventState.OPEN);
        }
        return withSeverity(builder);
    }

    /**
     * Survivor snapshot after absorbing another event's members and attributes. The survivor
     * takes the more active state of the two, so a live thread is never closed by a merge.
     */
    public Event absorb(Event survivor, Event absorbed, Instant now) {
        Event.Builder builder = Event.builder(survivor)
                .scope(Scope.broadest(survivor.getScope(), absorbed.getScope()))
                .startDate(earliest(survivor.getStartDate(), absorbed.getStartDate()))
                .endDate(latest(survivor.getEndDate(), absorbed.getEndDate()))
                .lastActivityAt(latest(survivor.getLastActivityAt(), absorbed.getLastActivityAt()))
                .updatedAt(now)
                .addActors(absorbed.getActors())
                .addLocations(absorbed.getLocations())
                .addMembers(absorbed.getMembers());
        if (survivor.getSector() == null) {
            builder.sector(absorbed.getSector());
        }
        if (survivor.getEventType() == null) {
            builder.eventType(absorbed.getEventType());
        }
        List<String> texts = survivor.getRepresentativeTexts();
        for (String text : absorbed.getRepresentativeTexts()) {
            texts = appendText(texts, text);
        }
        builder.representativeTexts(texts);
        EventState state = EventState.mostActive(survivor.getState(), absorbed.getState());
        builder.state(state);
        if (state != EventState.CLOSED) {
            builder.closedAt(null);
        }
        return withSeverity(builder);
    }

    /**
     * Snapshot without one member, used to back out a join that can no longer be restored
     * from the previous snapshot. Dates and attributes are left as they were.
     */
    public Event withoutMember(Event event, String articleId, Instant now) {
        return withSeverity(Event.builder(event).removeMember(articleId).updatedAt(now));
    }

    private Event withSeverity(Event.Builder builder) {
        Event draft = builder.build();
        SeverityAssessment assessment = severityScorer.assess(draft);
        return Event.builder(draft)
                .severity(assessment.severity())
                .confidence(assessment.confidence())
                .build();
    }

    private static EventMember member(ArticleRecord article, ArticleSignature signature, boolean lowConfidence) {
        return new EventMember(article.getId(), article.getPublishedAt(), signature.actionDate(),
                article.getAttributes().meanConfidence(), lowConfidence);
    }

    private List<String> appendText(List<String> texts, String text) {
        if (text == null || text.isBlank() || texts.size() >= maxRepresentativeTexts || texts.contains(text)) {
            return texts;
        }
        List<String> result = new ArrayList<>(texts);
        result.add(text);
        return result;
    }

    static LocalDate earliest(LocalDate a, LocalDate b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    static LocalDate latest(LocalDate a, LocalDate b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
