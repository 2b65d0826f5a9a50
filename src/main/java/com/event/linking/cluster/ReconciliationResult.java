package com.event.linking.cluster;

import com.event.linking.core.model.MergeRecord;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one reconciliation pass.
 *
 * @param pairsCompared event pairs scored
 * @param merges        merges performed, in order
 * @param failures      pairs whose merge failed and was rolled back
 * @param timedOut      whether the pass stopped at its time budget
 * @param duration      wall time of the pass
 */
public record ReconciliationResult(
        int pairsCompared,
        List<MergeRecord> merges,
        int failures,
        boolean timedOut,
        Duration duration
) {
    public ReconciliationResult {
        merges = merges != null ? List.copyOf(merges) : List.of();
    }

    public int mergeCount() {
        return merges.size();
    }
}
