package com.dcruver.provenance.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Filters for fragment listing. Null fields do not filter.
 */
@Data
@Builder
public class FragmentFilter {
    private final String project;
    private final SourceKind sourceKind;
    private final Instant since;
    private final Instant until;
    @Builder.Default
    private final int limit = 100;
    @Builder.Default
    private final int offset = 0;

    public static FragmentFilter all() {
        return FragmentFilter.builder().build();
    }
}
