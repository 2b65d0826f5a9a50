package com.event.linking.similarity;

import com.event.linking.rules.NormalizationEngine;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Term-frequency cosine similarity over normalized word tokens.
 */
public class CosineSimilarity implements SimilarityAlgorithm {

    private final NormalizationEngine engine;

    public CosineSimilarity(NormalizationEngine engine) {
        this.engine = engine;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }
        return cosine(termFrequencies(engine.tokenize(s1)), termFrequencies(engine.tokenize(s2)));
    }

    /**
     * Highest similarity between the text and any of the references.
     */
    public double computeMax(String text, List<String> references) {
        if (text == null || text.isBlank() || references.isEmpty()) {
            return 0.0;
        }
        Map<String, Integer> tf = termFrequencies(engine.tokenize(text));
        double best = 0.0;
        for (String reference : references) {
            if (reference == null || reference.isBlank()) {
                continue;
            }
            best = Math.max(best, cosine(tf, termFrequencies(engine.tokenize(reference))));
        }
        return best;
    }

    /**
     * Highest similarity between any text of the first list and any of the second.
     */
    public double computeMax(List<String> texts, List<String> references) {
        double best = 0.0;
        for (String text : texts) {
            best = Math.max(best, computeMax(text, references));
        }
        return best;
    }

    @Override
    public String getName() {
        return "Cosine";
    }

    static Map<String, Integer> termFrequencies(List<String> tokens) {
        Map<String, Integer> tf = new HashMap<>();
        for (String token : tokens) {
            tf.merge(token, 1, Integer::sum);
        }
        return tf;
    }

    static double cosine(Map<String, Integer> a, Map<String, Integer> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        double dot = 0.0;
        for (Map.Entry<String, Integer> entry : a.entrySet()) {
            Integer other = b.get(entry.getKey());
            if (other != null) {
                dot += (double) entry.getValue() * other;
            }
        }
        if (dot == 0.0) {
            return 0.0;
        }
        double score = dot / (norm(a) * norm(b));
        // Floating point can push identical vectors a hair above 1
        return Math.min(1.0, score);
    }

    private static double norm(Map<String, Integer> tf) {
        double sum = 0.0;
        for (int count : tf.values()) {
            sum += (double) count * count;
        }
        return Math.sqrt(sum);
    }
}
