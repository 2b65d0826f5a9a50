package com.event.linking.bulk;

import java.util.List;

/**
 * Result of a bulk article import.
 *
 * @param totalRecords     records read from the input
 * @param newEvents        articles that seeded a new event
 * @param joinedEvents     articles that joined an existing event
 * @param duplicates       articles detected as copies
 * @param alreadyProcessed articles whose id was already known
 * @param errors           records that could not be parsed or ingested
 */
public record ImportResult(
        long totalRecords,
        long newEvents,
        long joinedEvents,
        long duplicates,
        long alreadyProcessed,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long successCount() {
        return newEvents + joinedEvents + duplicates + alreadyProcessed;
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * An error for one input record.
     *
     * @param recordNumber position of the record in the input (1-based)
     * @param reference    the record's id or url when known
     * @param message      the error message
     */
    public record ImportError(long recordNumber, String reference, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", new=" + newEvents +
                ", joined=" + joinedEvents +
                ", duplicates=" + duplicates +
                ", alreadyProcessed=" + alreadyProcessed +
                ", errors=" + errors.size() + '}';
    }
}
