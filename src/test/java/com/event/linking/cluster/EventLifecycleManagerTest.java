package com.event.linking.cluster;

import com.event.linking.TestArticles;
import com.event.linking.api.LinkingOptions;
import com.event.linking.audit.AuditAction;
import com.event.linking.audit.AuditService;
import com.event.linking.audit.InMemoryAuditRepository;
import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventState;
import com.event.linking.lock.LocalShardLock;
import com.event.linking.metrics.MicrometerMetricsService;
import com.event.linking.store.InMemoryEventStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventLifecycleManagerTest {

    private static final LocalDate MARCH_1 = LocalDate.of(2024, 3, 1);
    private static final Instant NOW = TestArticles.T0.plus(Duration.ofDays(60));

    private final LinkingOptions options = LinkingOptions.defaults();

    private InMemoryEventStore store;
    private AuditService audit;
    private SimpleMeterRegistry registry;
    private EventLifecycleManager lifecycle;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        audit = new AuditService(new InMemoryAuditRepository(), Clock.fixed(NOW, ZoneOffset.UTC));
        registry = new SimpleMeterRegistry();
        lifecycle = new EventLifecycleManager(store, new LocalShardLock(), options, audit,
                new MicrometerMetricsService(registry), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Event insert(String id, EventState state) {
        Event event = TestArticles.event(id, "maritime", "piraeus", MARCH_1, MARCH_1, TestArticles.T0, "text");
        return store.insert(Event.builder(event).state(state).build());
    }

    private EventState stateOf(String id) {
        return store.findById(id).orElseThrow().getState();
    }

    @Nested
    @DisplayName("Inactivity transitions")
    class Inactivity {

        @Test
        void activeEventsStayOpen() {
            insert("e1", EventState.OPEN);

            assertTrue(lifecycle.advance(TestArticles.T0.plus(Duration.ofDays(10))).isEmpty());
            assertEquals(EventState.OPEN, stateOf("e1"));
        }

        @Test
        @DisplayName("Idle past the dormancy window becomes dormant")
        void becomesDormant() {
            insert("e1", EventState.OPEN);

            List<LifecycleTransition> transitions = lifecycle.advance(TestArticles.T0.plus(Duration.ofDays(15)));

            assertEquals(1, transitions.size());
            assertEquals(EventState.OPEN, transitions.get(0).from());
            assertEquals(EventState.DORMANT, transitions.get(0).to());
            assertEquals(EventState.DORMANT, stateOf("e1"));
            assertEquals(1, audit.getEntriesByAction(AuditAction.EVENT_DORMANT).size());
            assertEquals(1.0, registry.get("event.linking.lifecycle.transitions")
                    .tag("from", "OPEN").tag("to", "DORMANT").counter().count());
        }

        @Test
        @DisplayName("Idle past the closure window closes, an open event passing through dormant")
        void closes() {
            insert("e1", EventState.OPEN);
            insert("e2", EventState.DORMANT);
            Instant asOf = TestArticles.T0.plus(Duration.ofDays(46));

            List<LifecycleTransition> transitions = lifecycle.advance(asOf);

            assertEquals(List.of(EventState.DORMANT, EventState.CLOSED, EventState.CLOSED),
                    transitions.stream().map(LifecycleTransition::to).toList());
            assertEquals(List.of(EventState.OPEN, EventState.DORMANT, EventState.DORMANT),
                    transitions.stream().map(LifecycleTransition::from).toList());
            assertEquals(EventState.CLOSED, stateOf("e1"));
            assertEquals(EventState.CLOSED, stateOf("e2"));
            assertEquals(asOf, store.findById("e1").orElseThrow().getClosedAt());
            assertEquals(1, audit.getEntriesByAction(AuditAction.EVENT_DORMANT).size());
            assertEquals(2, audit.getEntriesByAction(AuditAction.EVENT_CLOSED).size());
        }

        @Test
        void openEventNeverClosesDirectly() {
            Event event = insert("e1", EventState.OPEN);

            assertEquals(EventState.DORMANT,
                    lifecycle.targetState(event, TestArticles.T0.plus(Duration.ofDays(100))).orElseThrow());
        }

        @Test
        void boundaryIsExclusive() {
            Event event = insert("e1", EventState.OPEN);

            assertTrue(lifecycle.targetState(event, TestArticles.T0.plus(options.getDormancyWindow())).isEmpty());
        }

        @Test
        void closedEventsAreLeftAlone() {
            insert("e1", EventState.CLOSED);

            assertTrue(lifecycle.advance(NOW).isEmpty());
        }

        @Test
        void advanceIsIdempotent() {
            insert("e1", EventState.OPEN);
            Instant asOf = TestArticles.T0.plus(Duration.ofDays(20));

            lifecycle.advance(asOf);

            assertTrue(lifecycle.advance(asOf).isEmpty());
        }
    }

    @Nested
    @DisplayName("Operator actions")
    class Operator {

        @Test
        @DisplayName("Reopening restarts the inactivity clock")
        void reopen() {
            insert("e1", EventState.CLOSED);

            Event reopened = lifecycle.reopen("e1", "operator-1");

            assertEquals(EventState.OPEN, reopened.getState());
            assertNull(reopened.getClosedAt());
            assertEquals(NOW, reopened.getLastActivityAt());
            assertEquals("operator-1", audit.getEntriesByAction(AuditAction.EVENT_REOPENED).get(0).actorId());
        }

        @Test
        void reopenOpenEventIsNoOp() {
            Event event = insert("e1", EventState.OPEN);

            assertEquals(event, lifecycle.reopen("e1", "operator-1"));
            assertEquals(0, audit.size());
        }

        @Test
        void finalizeClosesEarly() {
            insert("e1", EventState.OPEN);

            Event finalized = lifecycle.finalizeEvent("e1", "operator-2");

            assertEquals(EventState.CLOSED, finalized.getState());
            assertEquals(NOW, finalized.getClosedAt());
            assertEquals(1, audit.getEntriesByAction(AuditAction.EVENT_FINALIZED).size());
        }

        @Test
        void absorbedEventCannotBeReopened() {
            insert("e1", EventState.OPEN);
            Event absorbed = TestArticles.event("e2", "maritime", "piraeus", MARCH_1, MARCH_1, TestArticles.T0, "x");
            store.insert(Event.builder(absorbed).state(EventState.CLOSED).mergedIntoId("e1").build());

            assertThrows(IllegalStateException.class, () -> lifecycle.reopen("e2", "operator-1"));
            assertThrows(IllegalStateException.class, () -> lifecycle.finalizeEvent("e2", "operator-1"));
        }

        @Test
        void unknownEvent() {
            assertThrows(IllegalArgumentException.class, () -> lifecycle.reopen("missing", "operator-1"));
        }
    }
}
