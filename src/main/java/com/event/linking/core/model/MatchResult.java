package com.event.linking.core.model;

/**
 * Outcome of scoring an article (or another event) against one candidate event.
 *
 * @param score          combined score in [0.0, 1.0]
 * @param eventId        the candidate event, null for {@link #noMatch()}
 * @param textScore      text similarity component
 * @param attributeScore attribute overlap component
 * @param accepted       whether the score clears the acceptance threshold
 * @param reasoning      short human-readable explanation
 */
public record MatchResult(
        double score,
        String eventId,
        double textScore,
        double attributeScore,
        boolean accepted,
        String reasoning
) {
    public MatchResult {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
    }

    public static MatchResult noMatch() {
        return new MatchResult(0.0, null, 0.0, 0.0, false, "No candidate event");
    }

    /**
     * Creates a scored result; accepted only when the score is strictly above the threshold.
     */
    public static MatchResult of(String eventId, double textScore, double attributeScore,
                                 double score, double acceptanceThreshold) {
        boolean accepted = score > acceptanceThreshold;
        String reasoning = String.format("text=%.3f attributes=%.3f combined=%.3f threshold=%.3f",
                textScore, attributeScore, score, acceptanceThreshold);
        return new MatchResult(score, eventId, textScore, attributeScore, accepted, reasoning);
    }

    public boolean hasCandidate() {
        return eventId != null;
    }
}
