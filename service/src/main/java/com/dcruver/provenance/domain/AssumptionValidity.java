package com.dcruver.provenance.domain;

import com.dcruver.provenance.error.ValidationException;

/**
 * Validity state of an assumption.
 *
 * UNKNOWN is the initial state. VALID may still be invalidated by later evidence;
 * INVALID is terminal. Nothing ever moves back to UNKNOWN.
 */
public enum AssumptionValidity {
    UNKNOWN("unknown"),
    VALID("valid"),
    INVALID("invalid");

    private final String value;

    AssumptionValidity(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Whether a lifecycle operation may move an assumption from this state to {@code target}.
     * Re-asserting the current state is not a transition and is handled by the caller.
     */
    public boolean canTransitionTo(AssumptionValidity target) {
        return switch (this) {
            case UNKNOWN -> target == VALID || target == INVALID;
            case VALID -> target == INVALID;
            case INVALID -> false;
        };
    }

    public static AssumptionValidity fromValue(String value) {
        if (value == null) {
            throw new ValidationException("Validity must not be null");
        }
        for (AssumptionValidity validity : values()) {
            if (validity.value.equalsIgnoreCase(value.trim()) || validity.name().equalsIgnoreCase(value.trim())) {
                return validity;
            }
        }
        throw new ValidationException("Unknown validity state: " + value);
    }
}
