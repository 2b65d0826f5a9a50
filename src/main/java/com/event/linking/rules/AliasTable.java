package com.event.linking.rules;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Lookup table mapping variant spellings of sectors, actors and locations to one canonical form,
 * for example the Greek and English names of the same union confederation.
 *
 * <p>Keys and values are stored folded (see {@link NormalizationEngine#fold(String)}) so that
 * lookups are insensitive to case and accents.</p>
 */
public final class AliasTable {

    private static final AliasTable EMPTY = builder().build();

    private final Map<AttributeKind, Map<String, String>> aliases;

    private AliasTable(Map<AttributeKind, Map<String, String>> aliases) {
        Map<AttributeKind, Map<String, String>> copy = new EnumMap<>(AttributeKind.class);
        aliases.forEach((kind, table) -> copy.put(kind, Map.copyOf(table)));
        this.aliases = Collections.unmodifiableMap(copy);
    }

    public static AliasTable empty() {
        return EMPTY;
    }

    /**
     * Resolves a folded value to its canonical form, or returns it unchanged.
     */
    public String resolve(AttributeKind kind, String foldedValue) {
        if (foldedValue == null) {
            return null;
        }
        Map<String, String> table = aliases.get(kind);
        if (table == null) {
            return foldedValue;
        }
        return table.getOrDefault(foldedValue, foldedValue);
    }

    public Optional<String> lookup(AttributeKind kind, String foldedValue) {
        Map<String, String> table = aliases.get(kind);
        if (table == null || foldedValue == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.get(foldedValue));
    }

    public int size(AttributeKind kind) {
        Map<String, String> table = aliases.get(kind);
        return table == null ? 0 : table.size();
    }

    /**
     * Returns a table holding this table's aliases overlaid with the other's.
     */
    public AliasTable mergedWith(AliasTable other) {
        Builder builder = builder();
        aliases.forEach((kind, table) -> table.forEach((variant, canonical) -> builder.put(kind, variant, canonical)));
        other.aliases.forEach((kind, table) -> table.forEach((variant, canonical) -> builder.put(kind, variant, canonical)));
        return builder.build();
    }

    /**
     * Loads aliases from properties of the form {@code <kind>.<canonical>=<variant>,<variant>}.
     * For example {@code actor.gsee=γσεε,general confederation of greek workers}.
     *
     * @throws IllegalArgumentException if a key does not start with a known kind
     */
    public static AliasTable fromProperties(Properties properties) {
        Builder builder = builder();
        for (String name : properties.stringPropertyNames()) {
            int dot = name.indexOf('.');
            if (dot <= 0 || dot == name.length() - 1) {
                throw new IllegalArgumentException("Alias key must be <kind>.<canonical>: " + name);
            }
            AttributeKind kind;
            try {
                kind = AttributeKind.valueOf(name.substring(0, dot).toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown alias kind in key: " + name, e);
            }
            String canonical = name.substring(dot + 1).replace('_', ' ');
            String[] variants = properties.getProperty(name).split(",");
            builder.alias(kind, canonical, variants);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<AttributeKind, Map<String, String>> aliases = new EnumMap<>(AttributeKind.class);

        /**
         * Registers variants of a canonical value. The canonical value also maps to itself.
         */
        public Builder alias(AttributeKind kind, String canonical, String... variants) {
            Objects.requireNonNull(kind, "kind is required");
            Objects.requireNonNull(canonical, "canonical is required");
            String foldedCanonical = NormalizationEngine.fold(canonical);
            put(kind, foldedCanonical, foldedCanonical);
            for (String variant : variants) {
                String folded = NormalizationEngine.fold(variant);
                if (!folded.isEmpty()) {
                    put(kind, folded, foldedCanonical);
                }
            }
            return this;
        }

        private void put(AttributeKind kind, String variant, String canonical) {
            aliases.computeIfAbsent(kind, k -> new HashMap<>()).put(variant, canonical);
        }

        public AliasTable build() {
            return new AliasTable(aliases);
        }
    }
}
