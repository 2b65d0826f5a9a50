package com.event.linking.analytics;

/**
 * Event count and severity sum for one value of a breakdown dimension.
 *
 * @param value         the dimension value, e.g. a sector name; {@code unknown} when absent
 * @param eventCount    number of events
 * @param severityIndex sum of the events' severities
 */
public record BreakdownEntry(String value, long eventCount, double severityIndex) {
}
