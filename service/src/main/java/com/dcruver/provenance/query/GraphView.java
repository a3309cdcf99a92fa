package com.dcruver.provenance.query;

import com.dcruver.provenance.domain.LinkKind;
import com.dcruver.provenance.domain.SourceKind;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Fragments as nodes and links as edges, ready for a graph renderer.
 */
@Data
@Builder
public class GraphView {
    private final List<Node> nodes;
    private final List<Edge> edges;

    @Data
    @Builder
    public static class Node {
        private final String id;
        private final String label;
        private final SourceKind sourceKind;
        private final String project;
        private final Instant capturedAt;
        private final Set<String> topics;
        private final int connections;
    }

    @Data
    @Builder
    public static class Edge {
        private final String id;
        private final String source;
        private final String target;
        private final LinkKind kind;
        private final double strength;
    }
}
