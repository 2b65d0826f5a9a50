package com.event.linking.core.model;

/**
 * A single extracted attribute together with the extractor's confidence in it.
 *
 * @param value      the extracted value, null when the extractor found nothing
 * @param confidence confidence in [0.0, 1.0]; 0.0 for absent values
 */
public record Attribute<T>(T value, double confidence) {

    private static final Attribute<?> ABSENT = new Attribute<>(null, 0.0);

    public Attribute {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
        }
        if (value == null) {
            confidence = 0.0;
        }
    }

    public static <T> Attribute<T> of(T value, double confidence) {
        return new Attribute<>(value, confidence);
    }

    /**
     * Attribute reported without a confidence; treated as certain.
     */
    public static <T> Attribute<T> certain(T value) {
        return new Attribute<>(value, 1.0);
    }

    @SuppressWarnings("unchecked")
    public static <T> Attribute<T> absent() {
        return (Attribute<T>) ABSENT;
    }

    public boolean isPresent() {
        return value != null;
    }
}
