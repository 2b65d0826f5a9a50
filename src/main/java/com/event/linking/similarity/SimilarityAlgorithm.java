package com.event.linking.similarity;

/**
 * Interface for text similarity algorithms.
 * All implementations return a score between 0.0 (no similarity) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
