package com.dcruver.provenance.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Directed, typed, strength-weighted edge between two fragments.
 * (sourceId, targetId, kind) is unique.
 */
@Data
@Builder
public class FragmentLink {
    private final String id;
    private final String sourceId;
    private final String targetId;
    @Builder.Default
    private final LinkKind kind = LinkKind.RELATES_TO;
    private final double strength;
    private final Instant createdAt;
}
