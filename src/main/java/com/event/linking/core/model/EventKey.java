package com.event.linking.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Coarse grouping signature of an event: normalized sector, primary actor, location and day bucket.
 * Used only to narrow the candidate search.
 *
 * @param sector     normalized sector, {@value #UNKNOWN} when absent
 * @param actor      normalized primary actor, {@value #UNKNOWN} when absent
 * @param location   normalized location, {@value #UNKNOWN} when absent
 * @param dateBucket action date rounded to the day, null when the action date is unknown
 */
public record EventKey(String sector, String actor, String location, LocalDate dateBucket) {

    public static final String UNKNOWN = "unknown";
    private static final String SEPARATOR = "|";

    public EventKey {
        sector = orUnknown(sector);
        actor = orUnknown(actor);
        location = orUnknown(location);
    }

    public boolean hasDate() {
        return dateBucket != null;
    }

    /**
     * True when both keys agree on sector, actor and location, whatever their date buckets.
     */
    public boolean matchesIgnoringDate(EventKey other) {
        return other != null
                && sector.equals(other.sector)
                && actor.equals(other.actor)
                && location.equals(other.location);
    }

    /**
     * Key value without the date component.
     */
    public String undatedValue() {
        return sector + SEPARATOR + actor + SEPARATOR + location;
    }

    /**
     * Shard the key belongs to. Assignments are serialized per shard.
     */
    public String shardKey() {
        return sector + SEPARATOR + location;
    }

    /**
     * String form of the key. The date component is omitted when unknown.
     */
    public String value() {
        return hasDate() ? undatedValue() + SEPARATOR + dateBucket : undatedValue();
    }

    /**
     * Parses a value produced by {@link #value()}.
     */
    public static EventKey parse(String value) {
        Objects.requireNonNull(value, "value is required");
        String[] parts = value.split("\\|", -1);
        if (parts.length < 3 || parts.length > 4) {
            throw new IllegalArgumentException("Malformed event key: " + value);
        }
        LocalDate date = parts.length == 4 ? LocalDate.parse(parts[3]) : null;
        return new EventKey(parts[0], parts[1], parts[2], date);
    }

    @Override
    public String toString() {
        return value();
    }

    private static String orUnknown(String component) {
        return component == null || component.isBlank() ? UNKNOWN : component;
    }
}
