package com.dcruver.provenance.error;

import lombok.Getter;

/**
 * A referenced entity id does not exist.
 */
@Getter
public class NotFoundException extends ProvenanceException {

    private final String entity;
    private final String id;

    public NotFoundException(String entity, String id) {
        super(Kind.NOT_FOUND, entity + " not found: " + id);
        this.entity = entity;
        this.id = id;
    }
}
