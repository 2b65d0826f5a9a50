package com.event.linking.severity;

import com.event.linking.core.model.Scope;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Weights of the severity formula.
 *
 * @param scopeWeights        weight per scope, strictly increasing from COMPANY to GENERAL
 * @param sectorWeights       weight per normalized sector name
 * @param defaultSectorWeight weight of sectors missing from the table
 * @param durationWeight      weight per day of duration
 * @param maxDurationDays     duration cap in days
 * @param confidenceGain      corroboration gain applied to the log of the member count
 */
public record SeverityWeights(
        Map<Scope, Double> scopeWeights,
        Map<String, Double> sectorWeights,
        double defaultSectorWeight,
        double durationWeight,
        int maxDurationDays,
        double confidenceGain
) {
    public SeverityWeights {
        if (scopeWeights == null || scopeWeights.size() != Scope.values().length) {
            throw new IllegalArgumentException("A weight is required for every scope");
        }
        Scope previous = null;
        for (Scope scope : Scope.values()) {
            Double weight = scopeWeights.get(scope);
            if (weight == null || weight < 0) {
                throw new IllegalArgumentException("Scope weight must be non-negative: " + scope);
            }
            if (previous != null && weight <= scopeWeights.get(previous)) {
                throw new IllegalArgumentException("Scope weights must increase strictly, "
                        + scope + " <= " + previous);
            }
            previous = scope;
        }
        if (defaultSectorWeight < 0 || durationWeight < 0 || confidenceGain < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        if (maxDurationDays < 1) {
            throw new IllegalArgumentException("maxDurationDays must be at least 1");
        }
        scopeWeights = Map.copyOf(new EnumMap<>(scopeWeights));
        sectorWeights = sectorWeights != null ? Map.copyOf(sectorWeights) : Map.of();
    }

    public double scopeWeight(Scope scope) {
        return scopeWeights.get(scope);
    }

    public double sectorWeight(String sector) {
        if (sector == null) {
            return defaultSectorWeight;
        }
        return sectorWeights.getOrDefault(sector, defaultSectorWeight);
    }

    /**
     * Copy with one sector weight added or replaced.
     */
    public SeverityWeights withSectorWeight(String sector, double weight) {
        Map<String, Double> sectors = new HashMap<>(sectorWeights);
        sectors.put(sector, weight);
        return new SeverityWeights(scopeWeights, sectors, defaultSectorWeight, durationWeight,
                maxDurationDays, confidenceGain);
    }

    /**
     * Default weights: scopes 1 to 5, sector table over the label vocabulary (1.0 otherwise),
     * 0.5 per day capped at 30 days, confidence gain 0.1.
     */
    public static SeverityWeights defaults() {
        Map<Scope, Double> scopes = new EnumMap<>(Scope.class);
        scopes.put(Scope.COMPANY, 1.0);
        scopes.put(Scope.LOCAL, 2.0);
        scopes.put(Scope.REGIONAL, 3.0);
        scopes.put(Scope.NATIONAL, 4.0);
        scopes.put(Scope.GENERAL, 5.0);

        Map<String, Double> sectors = new HashMap<>();
        sectors.put("transport", 1.5);
        sectors.put("health", 1.5);
        sectors.put("energy", 1.5);
        sectors.put("maritime", 1.4);
        sectors.put("education", 1.2);
        sectors.put("public services", 1.2);
        sectors.put("telecommunications", 1.1);
        sectors.put("manufacturing", 1.0);
        sectors.put("construction", 1.0);
        sectors.put("retail", 1.0);
        sectors.put("food industry", 1.0);
        sectors.put("finance", 1.0);
        sectors.put("tourism", 1.0);
        sectors.put("agriculture", 1.0);
        sectors.put("other", 1.0);
        return new SeverityWeights(scopes, sectors, 1.0, 0.5, 30, 0.1);
    }
}
