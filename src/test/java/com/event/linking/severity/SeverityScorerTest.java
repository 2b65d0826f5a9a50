package com.event.linking.severity;

import com.event.linking.core.model.EventMember;
import com.event.linking.core.model.Scope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SeverityScorerTest {

    private static final LocalDate MARCH_5 = LocalDate.of(2024, 3, 5);
    private static final Instant NOW = Instant.parse("2024-03-05T08:00:00Z");

    private final SeverityScorer scorer = new SeverityScorer();

    private static EventMember member(String id, double confidence) {
        return new EventMember(id, NOW, MARCH_5, confidence, false);
    }

    @Test
    void sumsScopeSectorAndDuration() {
        SeverityAssessment assessment = scorer.assess(Scope.NATIONAL, "maritime", MARCH_5, MARCH_5.plusDays(1),
                List.of(member("a", 0.8)));

        assertEquals(6.4, assessment.severity(), 1e-9);
        assertEquals(2, assessment.durationDays());
        assertEquals(4.0, assessment.scopeComponent(), 1e-9);
        assertEquals(1.4, assessment.sectorComponent(), 1e-9);
        assertEquals(1.0, assessment.durationComponent(), 1e-9);
    }

    @Test
    @DisplayName("Unknown values fall back to the narrowest scope, default sector and one day")
    void unknownValues() {
        SeverityAssessment assessment = scorer.assess(null, null, null, null, List.of(member("a", 0.5)));

        assertEquals(2.5, assessment.severity(), 1e-9);
        assertEquals(1, assessment.durationDays());
    }

    @Test
    void durationIsCapped() {
        SeverityAssessment assessment = scorer.assess(Scope.GENERAL, "transport", MARCH_5, MARCH_5.plusDays(99),
                List.of(member("a", 0.5)));

        assertEquals(30, assessment.durationDays());
        assertEquals(21.5, assessment.severity(), 1e-9);
    }

    @ParameterizedTest
    @CsvSource({
            "COMPANY, LOCAL",
            "LOCAL, REGIONAL",
            "REGIONAL, NATIONAL",
            "NATIONAL, GENERAL"
    })
    void broaderScopeIsMoreSevere(Scope narrower, Scope broader) {
        double low = scorer.assess(narrower, "retail", MARCH_5, MARCH_5, List.of(member("a", 0.5))).severity();
        double high = scorer.assess(broader, "retail", MARCH_5, MARCH_5, List.of(member("a", 0.5))).severity();

        assertTrue(high > low);
    }

    @Test
    @DisplayName("Corroboration raises confidence")
    void corroboration() {
        assertEquals(0.8, scorer.confidence(List.of(member("a", 0.8))), 1e-9);
        assertEquals(0.8555, scorer.confidence(List.of(member("a", 0.8), member("b", 0.8))), 1e-9);
        assertEquals(1.0, scorer.confidence(List.of(member("a", 1.0), member("b", 1.0), member("c", 1.0))), 1e-9);
        assertEquals(0.0, scorer.confidence(List.of()), 1e-9);
    }

    @Test
    void sameInputsSameOutputs() {
        SeverityAssessment a = scorer.assess(Scope.REGIONAL, "health", MARCH_5, MARCH_5.plusDays(3),
                List.of(member("a", 0.7), member("b", 0.9)));
        SeverityAssessment b = scorer.assess(Scope.REGIONAL, "health", MARCH_5, MARCH_5.plusDays(3),
                List.of(member("b", 0.9), member("a", 0.7)));

        assertEquals(a, b);
    }

    @Test
    void roundsToFourDecimals() {
        assertEquals(0.1235, SeverityScorer.round(0.12345), 1e-12);
        assertEquals(2.0, SeverityScorer.round(1.99999), 1e-12);
    }

    @Test
    void customSectorWeight() {
        SeverityScorer custom = new SeverityScorer(SeverityWeights.defaults().withSectorWeight("retail", 3.0));

        assertEquals(3.0, custom.assess(Scope.COMPANY, "retail", MARCH_5, MARCH_5, List.of(member("a", 0.5)))
                .sectorComponent(), 1e-9);
    }

    @Test
    void scopeWeightsMustIncrease() {
        Map<Scope, Double> flat = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            flat.put(scope, 1.0);
        }

        assertThrows(IllegalArgumentException.class,
                () -> new SeverityWeights(flat, Map.of(), 1.0, 0.5, 30, 0.1));
    }
}
