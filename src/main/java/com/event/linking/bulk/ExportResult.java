package com.event.linking.bulk;

/**
 * Result of an event export.
 *
 * @param totalEvents  events written
 * @param totalMembers member rows written
 */
public record ExportResult(long totalEvents, long totalMembers) {
    @Override
    public String toString() {
        return "ExportResult{events=" + totalEvents + ", members=" + totalMembers + '}';
    }
}
