package com.dcruver.provenance.error;

import lombok.Getter;

/**
 * An external provider (embedding model, chat model, vector index) could not be reached.
 */
@Getter
public class ProviderConnectionException extends ProvenanceException {

    private final String provider;

    public ProviderConnectionException(String provider, String message, Throwable cause) {
        super(Kind.CONNECTION, provider + " unavailable: " + message, cause);
        this.provider = provider;
    }
}
