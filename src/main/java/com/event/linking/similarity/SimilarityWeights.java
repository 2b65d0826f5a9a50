package com.event.linking.similarity;

/**
 * Weights of the text and attribute components when scoring an article against an event.
 */
public record SimilarityWeights(
        double textWeight,
        double attributeWeight
) {
    public SimilarityWeights {
        if (textWeight < 0 || attributeWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = textWeight + attributeWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: text 0.6, attributes 0.4.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.6, 0.4);
    }

    /**
     * Weights favoring extracted attributes, for feeds with short or templated headlines.
     */
    public static SimilarityWeights attributeFocused() {
        return new SimilarityWeights(0.4, 0.6);
    }
}
