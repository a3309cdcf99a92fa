package com.dcruver.provenance.domain;

import com.dcruver.provenance.error.ValidationException;

import java.util.UUID;

/**
 * Opaque identifiers are UUID strings; this normalizes and validates them at the boundary.
 */
public final class Identifiers {

    private Identifiers() {
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Parse and canonicalize an identifier.
     *
     * @param id raw identifier
     * @param what name used in the error message, e.g. "fragment id"
     * @return canonical lower-case UUID string
     * @throws ValidationException if the id is missing or not a UUID
     */
    public static String require(String id, String what) {
        if (id == null || id.isBlank()) {
            throw new ValidationException(what + " must not be empty");
        }
        try {
            return UUID.fromString(id.trim()).toString();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid " + what + " format: " + id, e);
        }
    }
}
