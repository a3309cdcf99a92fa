package com.dcruver.provenance.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * A captured unit of raw context: a note, a transcript, a chat message.
 * Decisions and assumptions are only populated when the fragment is read by id.
 */
@Data
@Builder
@With
public class Fragment {
    private final String id;
    private final String rawContent;
    private final String summary;
    private final SourceKind sourceKind;
    private final String sourceRef;
    private final Instant capturedAt;
    @Builder.Default
    private final Set<String> participants = Set.of();
    @Builder.Default
    private final Set<String> topics = Set.of();
    private final String project;
    private final Instant createdAt;

    // Populated on single-fragment reads
    @Builder.Default
    private final List<Decision> decisions = List.of();
    @Builder.Default
    private final List<Assumption> assumptions = List.of();
}
