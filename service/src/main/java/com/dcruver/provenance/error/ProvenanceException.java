package com.dcruver.provenance.error;

import lombok.Getter;

/**
 * Base class for every failure raised by the provenance core.
 *
 * The {@link Kind} tells callers how to surface the failure. Not-found and
 * validation errors are the caller's to fix and connection failures are worth
 * retrying. Parse failures do not leave the extraction layer.
 */
@Getter
public abstract class ProvenanceException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        VALIDATION,
        CONNECTION,
        PARSE
    }

    private final Kind kind;

    protected ProvenanceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ProvenanceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
