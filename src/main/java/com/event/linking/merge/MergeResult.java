package com.event.linking.merge;

import com.event.linking.core.model.Event;
import com.event.linking.core.model.MergeRecord;

/**
 * Result of merging two events.
 */
public record MergeResult(
        boolean success,
        Event survivor,
        Event absorbed,
        MergeRecord mergeRecord,
        int assignmentsRepointed,
        String errorMessage
) {
    public static MergeResult success(Event survivor, Event absorbed, MergeRecord mergeRecord,
                                      int assignmentsRepointed) {
        return new MergeResult(true, survivor, absorbed, mergeRecord, assignmentsRepointed, null);
    }

    public static MergeResult failure(String errorMessage) {
        return new MergeResult(false, null, null, null, 0, errorMessage);
    }

    public static MergeResult failure(Event survivor, Event absorbed, String errorMessage) {
        return new MergeResult(false, survivor, absorbed, null, 0, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }
}
