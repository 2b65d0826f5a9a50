package com.event.linking.cluster;

import com.event.linking.api.LinkingOptions;
import com.event.linking.audit.AuditAction;
import com.event.linking.audit.AuditService;
import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventState;
import com.event.linking.lock.ShardLock;
import com.event.linking.logging.LogContext;
import com.event.linking.metrics.MetricsService;
import com.event.linking.store.EventStore;
import com.event.linking.store.StaleEventException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Drives the OPEN, DORMANT, CLOSED state machine.
 *
 * <p>Inactivity is measured from an event's last activity (latest member publication). An open
 * event idle longer than the dormancy window becomes DORMANT; a dormant event idle longer than
 * the closure window becomes CLOSED. A sweep may apply both steps to one event. Operators can
 * finalize an event early or reopen a closed one. Events absorbed by a merge stay closed.</p>
 */
public class EventLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(EventLifecycleManager.class);

    private final EventStore eventStore;
    private final ShardLock shardLock;
    private final LinkingOptions options;
    private final AuditService auditService;
    private final MetricsService metrics;
    private final Clock clock;

    public EventLifecycleManager(EventStore eventStore, ShardLock shardLock, LinkingOptions options,
                                 AuditService auditService, MetricsService metrics, Clock clock) {
        this.eventStore = eventStore;
        this.shardLock = shardLock;
        this.options = options;
        this.auditService = auditService;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Applies inactivity transitions as of the given instant.
     *
     * @return the transitions applied, in event creation order
     */
    public List<LifecycleTransition> advance(Instant asOf) {
        List<LifecycleTransition> transitions = new ArrayList<>();
        for (Event event : eventStore.findSurviving()) {
            if (event.isClosed() || targetState(event, asOf).isEmpty()) {
                continue;
            }
            // an open event idle past the closure window passes through DORMANT in the same sweep
            Optional<LifecycleTransition> applied = step(event.getId(), asOf);
            while (applied.isPresent()) {
                transitions.add(applied.get());
                applied = applied.get().to() == EventState.CLOSED ? Optional.empty() : step(event.getId(), asOf);
            }
        }
        if (!transitions.isEmpty()) {
            log.info("lifecycle.advanced asOf={} transitions={}", asOf, transitions.size());
        }
        return transitions;
    }

    private Optional<LifecycleTransition> step(String eventId, Instant asOf) {
        return transition(eventId, AuditService.SYSTEM_ACTOR, current -> {
            Optional<EventState> target = targetState(current, asOf);
            if (current.isAbsorbed() || target.isEmpty()) {
                return null;
            }
            Event.Builder builder = Event.builder(current).state(target.get()).updatedAt(asOf);
            if (target.get() == EventState.CLOSED) {
                builder.closedAt(asOf);
            }
            return builder.build();
        });
    }

    /**
     * Reopens a dormant or closed event. Its inactivity clock restarts now.
     *
     * @throws IllegalArgumentException if the event does not exist
     * @throws IllegalStateException    if the event was absorbed by a merge
     */
    public Event reopen(String eventId, String operator) {
        Event event = require(eventId);
        if (event.isAbsorbed()) {
            throw new IllegalStateException("Event " + eventId + " was merged into "
                    + event.getMergedIntoId() + " and cannot be reopened");
        }
        if (event.isOpen()) {
            return event;
        }
        Instant now = clock.instant();
        transition(eventId, operator, current -> {
            if (current.isAbsorbed()) {
                throw new IllegalStateException("Event " + eventId + " was merged into "
                        + current.getMergedIntoId() + " and cannot be reopened");
            }
            if (current.isOpen()) {
                return null;
            }
            return Event.builder(current)
                    .state(EventState.OPEN)
                    .closedAt(null)
                    .lastActivityAt(EventAggregation.latest(current.getLastActivityAt(), now))
                    .updatedAt(now)
                    .build();
        });
        return require(eventId);
    }

    /**
     * Closes an event regardless of activity.
     *
     * @throws IllegalArgumentException if the event does not exist
     * @throws IllegalStateException    if the event was absorbed by a merge
     */
    public Event finalizeEvent(String eventId, String operator) {
        Event event = require(eventId);
        if (event.isAbsorbed()) {
            throw new IllegalStateException("Event " + eventId + " was merged into " + event.getMergedIntoId());
        }
        if (event.isClosed()) {
            return event;
        }
        Instant now = clock.instant();
        transition(eventId, operator, current -> current.isClosed() ? null
                : Event.builder(current).state(EventState.CLOSED).closedAt(now).updatedAt(now).build());
        return require(eventId);
    }

    /**
     * State the event should move to at the given instant, if any.
     */
    Optional<EventState> targetState(Event event, Instant asOf) {
        Duration idle = Duration.between(event.getLastActivityAt(), asOf);
        if (event.isOpen() && idle.compareTo(options.getDormancyWindow()) > 0) {
            return Optional.of(EventState.DORMANT);
        }
        if (event.isDormant() && idle.compareTo(options.getClosureWindow()) > 0) {
            return Optional.of(EventState.CLOSED);
        }
        return Optional.empty();
    }

    /**
     * Applies a change under the event's shard lock with compare-and-set retries. The change
     * function returns null when nothing is to be done.
     */
    private Optional<LifecycleTransition> transition(String eventId, String actorId, UnaryOperator<Event> change) {
        Event snapshot = require(eventId);
        try (LogContext ctx = LogContext.forLifecycle(eventId, "lifecycle")
                .with(LogContext.SHARD, snapshot.getShardKey())) {
            shardLock.lock(snapshot.getShardKey());
            try {
                for (int attempt = 0; attempt <= options.getMaxAssignmentRetries(); attempt++) {
                    Event current = require(eventId);
                    Event changed = change.apply(current);
                    if (changed == null) {
                        return Optional.empty();
                    }
                    try {
                        eventStore.update(changed, current.getVersion());
                    } catch (StaleEventException e) {
                        metrics.incrementStaleRetry();
                        continue;
                    }
                    LifecycleTransition transition = new LifecycleTransition(eventId, current.getState(),
                            changed.getState(), changed.getUpdatedAt(), actorId);
                    record(transition);
                    return Optional.of(transition);
                }
            } finally {
                shardLock.unlock(snapshot.getShardKey());
            }
        }
        throw new StaleEventException(eventId, -1, require(eventId).getVersion());
    }

    private void record(LifecycleTransition transition) {
        metrics.incrementLifecycleTransition(transition.from(), transition.to());
        auditService.record(auditAction(transition), transition.eventId(), transition.actorId(),
                Map.of("from", transition.from().name(), "to", transition.to().name()));
        log.info("lifecycle.transition eventId={} from={} to={} actor={}",
                transition.eventId(), transition.from(), transition.to(), transition.actorId());
    }

    private static AuditAction auditAction(LifecycleTransition transition) {
        if (transition.to() == EventState.DORMANT) {
            return AuditAction.EVENT_DORMANT;
        }
        if (transition.to() == EventState.OPEN) {
            return AuditAction.EVENT_REOPENED;
        }
        return AuditService.SYSTEM_ACTOR.equals(transition.actorId())
                ? AuditAction.EVENT_CLOSED : AuditAction.EVENT_FINALIZED;
    }

    private Event require(String eventId) {
        return eventStore.findById(eventId)
                .orElseThrow(() -> new IllegalArgumentException("Event not found: " + eventId));
    }
}
