package com.event.linking.rules;

/**
 * Kinds of extracted values that normalization rules and aliases can be scoped to.
 */
public enum AttributeKind {
    SECTOR,
    ACTOR,
    LOCATION,
    TEXT
}
