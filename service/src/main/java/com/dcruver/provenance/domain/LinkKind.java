package com.dcruver.provenance.domain;

import com.dcruver.provenance.error.ValidationException;

/**
 * Type of a directed relationship between two fragments.
 */
public enum LinkKind {
    /**
     * Semantic similarity, created automatically by the linking engine
     */
    RELATES_TO("relates_to"),

    /**
     * Same entities mentioned
     */
    REFERENCES("references"),

    /**
     * Temporal sequence
     */
    FOLLOWS("follows"),

    /**
     * Conflicting decisions
     */
    CONTRADICTS("contradicts"),

    /**
     * New information breaks an older assumption
     */
    INVALIDATES("invalidates");

    private final String value;

    LinkKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static LinkKind fromValue(String value) {
        if (value == null) {
            throw new ValidationException("Link kind must not be null");
        }
        for (LinkKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value.trim()) || kind.name().equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        throw new ValidationException("Unknown link kind: " + value);
    }
}
