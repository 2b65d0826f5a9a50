package com.event.linking.merge;

import com.event.linking.TestArticles;
import com.event.linking.audit.AuditAction;
import com.event.linking.audit.AuditService;
import com.event.linking.audit.InMemoryAuditRepository;
import com.event.linking.audit.MergeLedger;
import com.event.linking.cluster.EventAggregation;
import com.event.linking.core.model.ArticleAssignment;
import com.event.linking.core.model.AssignmentOutcome;
import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventMember;
import com.event.linking.core.model.EventState;
import com.event.linking.lock.LocalShardLock;
import com.event.linking.rules.DefaultNormalizationRules;
import com.event.linking.severity.SeverityScorer;
import com.event.linking.similarity.CosineSimilarity;
import com.event.linking.similarity.EventSimilarityScorer;
import com.event.linking.similarity.SimilarityWeights;
import com.event.linking.store.InMemoryArticleRepository;
import com.event.linking.store.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventMergeEngineTest {

    private static final LocalDate MARCH_5 = LocalDate.of(2024, 3, 5);
    private static final Instant NOW = TestArticles.hoursAfterStart(72);
    private static final String TEXT = "Seamen strike keeps ferries docked at Piraeus";

    private InMemoryEventStore store;
    private InMemoryArticleRepository articles;
    private MergeLedger ledger;
    private AuditService audit;
    private EventMergeEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        articles = new InMemoryArticleRepository();
        ledger = new MergeLedger();
        audit = new AuditService(new InMemoryAuditRepository(), Clock.fixed(NOW, ZoneOffset.UTC));
        EventSimilarityScorer scorer = new EventSimilarityScorer(
                new CosineSimilarity(DefaultNormalizationRules.createDefaultEngine()),
                SimilarityWeights.defaultWeights(), 14);
        engine = new EventMergeEngine(store, articles, new EventAggregation(new SeverityScorer(), 5), scorer,
                new LocalShardLock(), ledger, audit, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Event insert(String id, String location, LocalDate start, LocalDate end, Instant createdAt,
                         int extraMembers, String text) {
        Event.Builder builder = Event.builder(TestArticles.event(id, "maritime", location, start, end, createdAt, text));
        for (int i = 0; i < extraMembers; i++) {
            builder.addMember(new EventMember(id + "-b" + i, createdAt.plusSeconds(60L * (i + 1)), start, 0.8, false));
        }
        Event stored = store.insert(builder.build());
        for (String articleId : stored.getMemberIds()) {
            articles.saveAssignment(new ArticleAssignment(articleId, AssignmentOutcome.JOINED_EVENT, id, articleId,
                    0.9, false, createdAt));
        }
        return stored;
    }

    @Test
    @DisplayName("Event with more members survives and takes over the other's members")
    void mergesIntoLargerEvent() {
        insert("e1", "piraeus", MARCH_5, MARCH_5, TestArticles.T0, 1, TEXT);
        insert("e2", "piraeus", MARCH_5.plusDays(1), MARCH_5.plusDays(2), TestArticles.hoursAfterStart(1), 0, TEXT);

        MergeResult result = engine.merge("e2", "e1", 0.7, "reconciliation");

        assertTrue(result.isSuccess());
        Event survivor = store.findById("e1").orElseThrow();
        Event absorbed = store.findById("e2").orElseThrow();
        assertEquals(List.of("e1-a1", "e1-b0", "e2-a1"), survivor.getMemberIds());
        assertEquals(MARCH_5, survivor.getStartDate());
        assertEquals(MARCH_5.plusDays(2), survivor.getEndDate());
        assertEquals("e1", absorbed.getMergedIntoId());
        assertEquals(EventState.CLOSED, absorbed.getState());
        assertEquals(NOW, absorbed.getClosedAt());
        assertEquals("e1", store.findEventIdForArticle("e2-a1").orElseThrow());
        assertEquals("e1", articles.findAssignment("e2-a1").orElseThrow().eventId());
        assertEquals(1, result.assignmentsRepointed());
    }

    @Test
    void recordsLedgerAndAudit() {
        insert("e1", "piraeus", MARCH_5, MARCH_5, TestArticles.T0, 1, TEXT);
        insert("e2", "piraeus", MARCH_5, MARCH_5, TestArticles.hoursAfterStart(1), 0, TEXT);

        MergeResult result = engine.merge("e1", "e2", 0.7, "reconciliation");

        assertEquals(result.mergeRecord(), ledger.findByAbsorbed("e2").orElseThrow());
        assertEquals(1, result.mergeRecord().membersMoved());
        assertEquals("reconciliation", result.mergeRecord().triggeredBy());
        assertEquals(1, audit.getEntriesByAction(AuditAction.EVENT_MERGED).size());
        assertEquals(1, audit.getEntriesByAction(AuditAction.ASSIGNMENTS_REPOINTED).size());
    }

    @Test
    @DisplayName("Equal member counts keep the earlier event")
    void earlierEventSurvivesTie() {
        insert("e2", "piraeus", MARCH_5, MARCH_5, TestArticles.T0, 0, TEXT);
        insert("e1", "piraeus", MARCH_5, MARCH_5, TestArticles.hoursAfterStart(1), 0, TEXT);

        MergeResult result = engine.merge("e1", "e2", 0.7, "operator");

        assertEquals("e2", result.survivor().getId());
        assertEquals("e1", result.absorbed().getId());
    }

    @Test
    @DisplayName("Locks both shards when the events live in different shards")
    void crossShardMerge() {
        insert("e1", "piraeus", MARCH_5, MARCH_5, TestArticles.T0, 1, TEXT);
        insert("e2", "athens", MARCH_5, MARCH_5, TestArticles.hoursAfterStart(1), 0, TEXT);

        MergeResult result = engine.merge("e1", "e2", 0.5, "reconciliation");

        assertTrue(result.isSuccess());
        assertTrue(store.findById("e1").orElseThrow().getLocations().containsAll(List.of("piraeus", "athens")));
    }

    @Test
    void dissimilarEventsAreNotMerged() {
        insert("e1", "piraeus", MARCH_5, MARCH_5, TestArticles.T0, 0, TEXT);
        insert("e2", "patras", MARCH_5.plusDays(20), MARCH_5.plusDays(20), TestArticles.T0, 0,
                "Teachers protest budget cuts");

        MergeResult result = engine.merge("e1", "e2", 0.7, "reconciliation");

        assertTrue(result.isFailure());
        assertFalse(store.findById("e2").orElseThrow().isAbsorbed());
        assertEquals(0, ledger.size());
    }

    @Test
    void missingEventFails() {
        insert("e1", "piraeus", MARCH_5, MARCH_5, TestArticles.T0, 0, TEXT);

        MergeResult result = engine.merge("e1", "missing", 0.7, "reconciliation");

        assertTrue(result.isFailure());
        assertTrue(result.errorMessage().contains("missing"));
    }

    @Test
    void absorbedEventCannotMergeAgain() {
        insert("e1", "piraeus", MARCH_5, MARCH_5, TestArticles.T0, 1, TEXT);
        insert("e2", "piraeus", MARCH_5, MARCH_5, TestArticles.hoursAfterStart(1), 0, TEXT);
        insert("e3", "piraeus", MARCH_5, MARCH_5, TestArticles.hoursAfterStart(2), 0, TEXT);
        engine.merge("e1", "e2", 0.7, "reconciliation");

        assertTrue(engine.merge("e2", "e3", 0.7, "reconciliation").isFailure());
    }
}
