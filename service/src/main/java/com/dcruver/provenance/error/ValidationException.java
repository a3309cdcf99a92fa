package com.dcruver.provenance.error;

/**
 * Input rejected before any write: malformed identifier, unknown kind,
 * value out of range or a forbidden lifecycle transition.
 */
public class ValidationException extends ProvenanceException {

    public ValidationException(String message) {
        super(Kind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(Kind.VALIDATION, message, cause);
    }
}
