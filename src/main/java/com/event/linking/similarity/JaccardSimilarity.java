package com.event.linking.similarity;

import com.event.linking.rules.NormalizationEngine;

import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard similarity (token overlap).
 * Computes similarity as |intersection| / |union| of normalized word tokens.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private final NormalizationEngine engine;

    public JaccardSimilarity(NormalizationEngine engine) {
        this.engine = engine;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }
        return jaccard(new HashSet<>(engine.tokenize(s1)), new HashSet<>(engine.tokenize(s2)));
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    /**
     * Jaccard index of two sets. Two empty sets score 0.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int intersectionSize = intersection(a, b);
        // |union| = |A| + |B| - |intersection|
        int unionSize = a.size() + b.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    /**
     * Overlap coefficient |A ∩ B| / min(|A|, |B|). A single-element set scores 1 when contained.
     */
    public static double overlap(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        return (double) intersection(a, b) / Math.min(a.size(), b.size());
    }

    private static int intersection(Set<String> a, Set<String> b) {
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int count = 0;
        for (String token : smaller) {
            if (larger.contains(token)) {
                count++;
            }
        }
        return count;
    }
}
