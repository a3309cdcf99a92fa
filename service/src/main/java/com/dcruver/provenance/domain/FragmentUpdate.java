package com.dcruver.provenance.domain;

import lombok.Builder;
import lombok.Data;

import java.util.Set;

/**
 * Metadata changes for an existing fragment.
 *
 * A null field leaves the stored value unchanged. A blank summary or project
 * clears it; an empty set clears topics or participants.
 */
@Data
@Builder
public class FragmentUpdate {
    private final String summary;
    private final String project;
    private final Set<String> topics;
    private final Set<String> participants;

    public boolean isEmpty() {
        return summary == null && project == null && topics == null && participants == null;
    }
}
