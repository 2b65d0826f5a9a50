package com.event.linking.api;

import java.util.List;

/**
 * Result of ingesting a batch.
 *
 * @param results per-article results of the articles that succeeded, in processing order
 * @param errors  one message per article that failed and was rolled back
 */
public record BatchResult(
        int totalArticles,
        int newEvents,
        int joinedEvents,
        int duplicates,
        int alreadyProcessed,
        List<IngestResult> results,
        List<String> errors
) {
    public BatchResult {
        results = results != null ? List.copyOf(results) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    static BatchResult of(int totalArticles, List<IngestResult> results, List<String> errors) {
        int created = 0;
        int joined = 0;
        int duplicates = 0;
        int repeated = 0;
        for (IngestResult result : results) {
            if (result.isAlreadyProcessed()) {
                repeated++;
            } else if (result.isDuplicate()) {
                duplicates++;
            } else if (result.isNewEvent()) {
                created++;
            } else {
                joined++;
            }
        }
        return new BatchResult(totalArticles, created, joined, duplicates, repeated, results, errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "BatchResult{" +
                "total=" + totalArticles +
                ", new=" + newEvents +
                ", joined=" + joinedEvents +
                ", duplicates=" + duplicates +
                ", alreadyProcessed=" + alreadyProcessed +
                ", errors=" + errors.size() +
                '}';
    }
}
