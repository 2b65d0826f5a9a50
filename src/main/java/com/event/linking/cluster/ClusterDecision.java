package com.event.linking.cluster;

import com.event.linking.core.model.AssignmentOutcome;
import com.event.linking.core.model.Event;
import com.event.linking.core.model.MatchResult;

/**
 * Where the clusterer put an article.
 *
 * @param outcome  {@link AssignmentOutcome#JOINED_EVENT} or {@link AssignmentOutcome#NEW_EVENT}
 * @param event    the stored event snapshot after the assignment
 * @param previous the snapshot the join was applied to, null for a new event
 * @param match    best candidate score, {@link MatchResult#noMatch()} when there was no candidate
 * @param attempts assignment attempts, more than one after concurrent updates
 */
public record ClusterDecision(
        AssignmentOutcome outcome,
        Event event,
        Event previous,
        MatchResult match,
        int attempts
) {
    public boolean joined() {
        return outcome == AssignmentOutcome.JOINED_EVENT;
    }
}
