package com.dcruver.provenance.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;

/**
 * A stated or inferred belief extracted from a fragment.
 */
@Data
@Builder
@With
public class Assumption {
    private final String id;
    private final String fragmentId;
    private final String statement;
    @Builder.Default
    private final boolean explicit = true;
    @Builder.Default
    private final AssumptionValidity validity = AssumptionValidity.UNKNOWN;
    private final String invalidatedBy;  // only set when INVALID, nulled if that fragment is deleted
    private final Instant createdAt;
}
