package com.event.linking.analytics;

import java.util.ArrayList;
import java.util.List;

/**
 * Analytics over the surviving events of one store version.
 *
 * @param granularity  bucket size
 * @param storeVersion store version the snapshot was computed from
 * @param buckets      buckets in chronological order; empty buckets are omitted
 * @param totalEvents  events counted across all buckets
 */
public record AnalyticsSnapshot(
        TimeGranularity granularity,
        long storeVersion,
        List<BucketSummary> buckets,
        long totalEvents
) {
    public AnalyticsSnapshot {
        buckets = List.copyOf(buckets);
    }

    /**
     * Flattens the snapshot: per bucket one total row, then the sector, scope and event type rows.
     */
    public List<AnalyticsRow> toRows() {
        List<AnalyticsRow> rows = new ArrayList<>();
        for (BucketSummary bucket : buckets) {
            String start = bucket.bucketStart().toString();
            rows.add(new AnalyticsRow(bucket.label(), start, AnalyticsRow.TOTAL, AnalyticsRow.TOTAL,
                    bucket.eventCount(), bucket.severityIndex()));
            addRows(rows, bucket, start, AnalyticsRow.SECTOR, bucket.bySector());
            addRows(rows, bucket, start, AnalyticsRow.SCOPE, bucket.byScope());
            addRows(rows, bucket, start, AnalyticsRow.EVENT_TYPE, bucket.byEventType());
        }
        return rows;
    }

    private static void addRows(List<AnalyticsRow> rows, BucketSummary bucket, String start,
                                String dimension, List<BreakdownEntry> entries) {
        for (BreakdownEntry entry : entries) {
            rows.add(new AnalyticsRow(bucket.label(), start, dimension, entry.value(),
                    entry.eventCount(), entry.severityIndex()));
        }
    }
}
