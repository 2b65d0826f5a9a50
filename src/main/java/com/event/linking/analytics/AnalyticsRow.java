package com.event.linking.analytics;

/**
 * One flat row of an analytics snapshot.
 * The {@code total} dimension carries the bucket totals; other dimensions carry breakdown entries.
 */
public record AnalyticsRow(
        String bucket,
        String bucketStart,
        String dimension,
        String value,
        long eventCount,
        double severityIndex
) {
    public static final String TOTAL = "total";
    public static final String SECTOR = "sector";
    public static final String SCOPE = "scope";
    public static final String EVENT_TYPE = "event_type";
}
