package com.event.linking.analytics;

import java.time.LocalDate;
import java.util.List;

/**
 * Totals and breakdowns of one time bucket.
 *
 * @param bucketStart   first day of the bucket
 * @param label         display label
 * @param eventCount    events bucketed here
 * @param severityIndex sum of their severities
 * @param bySector      breakdown by sector, sorted by value
 * @param byScope       breakdown by scope, in scope order
 * @param byEventType   breakdown by event type, sorted by value
 */
public record BucketSummary(
        LocalDate bucketStart,
        String label,
        long eventCount,
        double severityIndex,
        List<BreakdownEntry> bySector,
        List<BreakdownEntry> byScope,
        List<BreakdownEntry> byEventType
) {
    public BucketSummary {
        bySector = List.copyOf(bySector);
        byScope = List.copyOf(byScope);
        byEventType = List.copyOf(byEventType);
    }
}
