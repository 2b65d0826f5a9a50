package com.event.linking.severity;

import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventMember;
import com.event.linking.core.model.Scope;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Computes event severity and confidence.
 * Formula: severity = scopeWeight(scope) + sectorWeight(sector) + durationWeight * min(durationDays, cap)
 *
 * <p>Duration is the inclusive day span, or one day while either end is unknown. Unknown scope
 * scores as the narrowest scope. Confidence is the mean member attribute confidence boosted by
 * corroboration: {@code mean * (1 + gain * ln(memberCount))}, clamped to [0, 1]. Both values are
 * rounded to four decimals, so identical inputs give identical outputs.</p>
 */
public class SeverityScorer {

    private final SeverityWeights weights;

    public SeverityScorer() {
        this(SeverityWeights.defaults());
    }

    public SeverityScorer(SeverityWeights weights) {
        this.weights = weights;
    }

    public SeverityWeights getWeights() {
        return weights;
    }

    public SeverityAssessment assess(Event event) {
        return assess(event.getScope(), event.getSector(), event.getStartDate(), event.getEndDate(),
                event.getMembers());
    }

    public SeverityAssessment assess(Scope scope, String sector, LocalDate startDate, LocalDate endDate,
                                     List<EventMember> members) {
        double scopeComponent = weights.scopeWeight(scope != null ? scope : Scope.COMPANY);
        double sectorComponent = weights.sectorWeight(sector);
        long durationDays = Math.min(durationDays(startDate, endDate), weights.maxDurationDays());
        double durationComponent = weights.durationWeight() * durationDays;

        double severity = round(scopeComponent + sectorComponent + durationComponent);
        return new SeverityAssessment(severity, confidence(members), scopeComponent, sectorComponent,
                round(durationComponent), durationDays);
    }

    public double confidence(List<EventMember> members) {
        if (members.isEmpty()) {
            return 0.0;
        }
        double mean = members.stream().mapToDouble(EventMember::attributeConfidence).average().orElse(0.0);
        double boosted = mean * (1.0 + weights.confidenceGain() * Math.log(members.size()));
        return round(Math.max(0.0, Math.min(1.0, boosted)));
    }

    static long durationDays(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            return 1;
        }
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public static double round(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
