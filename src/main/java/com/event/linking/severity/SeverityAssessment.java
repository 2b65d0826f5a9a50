package com.event.linking.severity;

/**
 * Severity and confidence of an event with the components that produced them.
 */
public record SeverityAssessment(
        double severity,
        double confidence,
        double scopeComponent,
        double sectorComponent,
        double durationComponent,
        long durationDays
) {
}
