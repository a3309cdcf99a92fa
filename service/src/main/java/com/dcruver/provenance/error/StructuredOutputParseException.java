package com.dcruver.provenance.error;

/**
 * The text-generation provider answered, but not with JSON of the expected shape.
 */
public class StructuredOutputParseException extends ProvenanceException {

    public StructuredOutputParseException(String message) {
        super(Kind.PARSE, message);
    }

    public StructuredOutputParseException(String message, Throwable cause) {
        super(Kind.PARSE, message, cause);
    }
}
