package com.dcruver.provenance.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A choice extracted from a fragment. Immutable once stored.
 */
@Data
@Builder
public class Decision {
    private final String id;
    private final String fragmentId;
    private final String what;
    @Builder.Default
    private final String why = "";
    private final double confidence;
    private final Instant createdAt;
}
