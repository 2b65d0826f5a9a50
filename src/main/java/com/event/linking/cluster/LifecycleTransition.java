package com.event.linking.cluster;

import com.event.linking.core.model.EventState;

import java.time.Instant;

/**
 * One state change applied to an event.
 */
public record LifecycleTransition(String eventId, EventState from, EventState to, Instant at, String actorId) {
}
