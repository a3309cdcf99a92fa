package com.dcruver.provenance.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Filters for decision and assumption listing. Time bounds apply to the record's
 * creation time; the project filter joins against the owning fragment.
 */
@Data
@Builder
public class RecordFilter {
    private final String fragmentId;
    private final String project;
    private final Instant since;
    private final Instant until;
    @Builder.Default
    private final int limit = 100;

    public static RecordFilter all() {
        return RecordFilter.builder().build();
    }

    public static RecordFilter forFragment(String fragmentId) {
        return RecordFilter.builder().fragmentId(fragmentId).build();
    }
}
