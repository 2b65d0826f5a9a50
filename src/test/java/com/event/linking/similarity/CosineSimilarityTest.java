package com.event.linking.similarity;

import com.event.linking.rules.DefaultNormalizationRules;
import com.event.linking.rules.NormalizationEngine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CosineSimilarityTest {

    private final NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();
    private final CosineSimilarity cosine = new CosineSimilarity(engine);
    private final JaccardSimilarity jaccard = new JaccardSimilarity(engine);

    @Test
    void identicalTextsScoreOne() {
        assertEquals(1.0, cosine.compute("Απεργία στα λιμάνια", "ΑΠΕΡΓΙΑ στα λιμανια"), 1e-9);
    }

    @Test
    void disjointTextsScoreZero() {
        assertEquals(0.0, cosine.compute("seamen strike", "teachers protest"), 1e-9);
    }

    @Test
    void blankTextScoresZero() {
        assertEquals(0.0, cosine.compute("", "strike"));
        assertEquals(0.0, cosine.compute(null, "strike"));
    }

    @Test
    void partialOverlap() {
        // {seamen, strike} vs {strike, piraeus}: 1 / (sqrt2 * sqrt2)
        assertEquals(0.5, cosine.compute("seamen strike", "strike piraeus"), 1e-9);
    }

    @Test
    void computeMaxPicksBestReference() {
        double best = cosine.computeMax("seamen strike", List.of("teachers protest", "seamen strike"));
        assertEquals(1.0, best, 1e-9);
        assertEquals(0.0, cosine.computeMax("seamen strike", List.of()));
    }

    @Test
    void jaccardOfTokens() {
        // {seamen, strike} vs {strike, piraeus}: 1 / 3
        assertEquals(1.0 / 3.0, jaccard.compute("seamen strike", "strike piraeus"), 1e-9);
    }

    @Test
    void overlapCoefficientUsesSmallerSet() {
        assertEquals(1.0, JaccardSimilarity.overlap(Set.of("athens"), Set.of("athens", "piraeus")), 1e-9);
        assertEquals(0.0, JaccardSimilarity.overlap(Set.of(), Set.of("athens")));
        assertEquals(0.5, JaccardSimilarity.jaccard(Set.of("athens"), Set.of("athens", "piraeus")), 1e-9);
    }
}
