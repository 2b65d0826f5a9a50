package com.event.linking.dedup;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for near-duplicate detection.
 *
 * @param shingleSize         words per shingle
 * @param maxHammingDistance  largest SimHash distance still counted as a duplicate
 * @param bands               LSH bands the 64-bit SimHash is split into
 * @param window              largest publication time difference between duplicates
 * @param boilerplatePatterns regexes removed from folded text lines before fingerprinting
 */
public record DuplicateDetectionConfig(
        int shingleSize,
        int maxHammingDistance,
        int bands,
        Duration window,
        List<String> boilerplatePatterns
) {
    public static final int SIMHASH_BITS = 64;

    public static final List<String> DEFAULT_BOILERPLATE = List.of(
            "https?://\\S+",
            "\\S+@\\S+\\.\\S+",
            "^\\s*(read more|see also|related:|share this|share on|follow us on|subscribe to).*$",
            "^\\s*(διαβαστε (περισσοτερα|επισησ|ακομα)|δειτε (επισησ|ακομα)|σχετικα:|κοινοποιηστε|ακολουθηστε μασ).*$",
            "^.*(©|copyright|all rights reserved|με επιφυλαξη παντοσ δικαιωματοσ).*$"
    );

    public DuplicateDetectionConfig {
        if (shingleSize < 1) {
            throw new IllegalArgumentException("shingleSize must be at least 1");
        }
        if (maxHammingDistance < 0 || maxHammingDistance >= SIMHASH_BITS) {
            throw new IllegalArgumentException("maxHammingDistance must be between 0 and 63");
        }
        if (bands < 1 || SIMHASH_BITS % bands != 0) {
            throw new IllegalArgumentException("bands must divide 64, got " + bands);
        }
        if (bands <= maxHammingDistance) {
            // Pigeonhole: with more bands than differing bits, some band is identical
            throw new IllegalArgumentException("bands (" + bands
                    + ") must exceed maxHammingDistance (" + maxHammingDistance + ")");
        }
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("window must be non-negative");
        }
        boilerplatePatterns = boilerplatePatterns != null ? List.copyOf(boilerplatePatterns) : List.of();
    }

    public int bitsPerBand() {
        return SIMHASH_BITS / bands;
    }

    public static DuplicateDetectionConfig defaults() {
        return new DuplicateDetectionConfig(3, 3, 4, Duration.ofDays(3), DEFAULT_BOILERPLATE);
    }

    public DuplicateDetectionConfig withWindow(Duration newWindow) {
        return new DuplicateDetectionConfig(shingleSize, maxHammingDistance, bands, newWindow, boilerplatePatterns);
    }

    public DuplicateDetectionConfig withMaxHammingDistance(int distance) {
        return new DuplicateDetectionConfig(shingleSize, distance, bands, window, boilerplatePatterns);
    }
}
