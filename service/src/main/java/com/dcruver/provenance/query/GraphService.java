package com.dcruver.provenance.query;

import com.dcruver.provenance.domain.Fragment;
import com.dcruver.provenance.domain.FragmentFilter;
import com.dcruver.provenance.domain.FragmentLink;
import com.dcruver.provenance.storage.FragmentStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the fragment graph for a set of list filters.
 */
@Service
@RequiredArgsConstructor
public class GraphService {

    static final int LABEL_LENGTH = 60;
    static final int MAX_LINKS = 5000;

    private final FragmentStore fragmentStore;

    /**
     * Nodes are the fragments matching the filter; edges are the links whose two
     * endpoints are both nodes. Connection counts include links to fragments outside
     * the node set.
     */
    public GraphView build(FragmentFilter filter) {
        List<Fragment> fragments = fragmentStore.listFragments(filter);
        List<FragmentLink> links = fragmentStore.listLinks(null, MAX_LINKS);

        Set<String> ids = fragments.stream().map(Fragment::getId).collect(Collectors.toSet());
        Map<String, Integer> connections = new HashMap<>();
        for (FragmentLink link : links) {
            if (ids.contains(link.getSourceId())) {
                connections.merge(link.getSourceId(), 1, Integer::sum);
            }
            if (ids.contains(link.getTargetId())) {
                connections.merge(link.getTargetId(), 1, Integer::sum);
            }
        }

        List<GraphView.Node> nodes = fragments.stream()
            .map(f -> GraphView.Node.builder()
                .id(f.getId())
                .label(truncate(f.getRawContent()))
                .sourceKind(f.getSourceKind())
                .project(f.getProject())
                .capturedAt(f.getCapturedAt())
                .topics(f.getTopics())
                .connections(connections.getOrDefault(f.getId(), 0))
                .build())
            .toList();

        List<GraphView.Edge> edges = links.stream()
            .filter(l -> ids.contains(l.getSourceId()) && ids.contains(l.getTargetId()))
            .map(l -> GraphView.Edge.builder()
                .id(l.getId())
                .source(l.getSourceId())
                .target(l.getTargetId())
                .kind(l.getKind())
                .strength(l.getStrength())
                .build())
            .toList();

        return GraphView.builder().nodes(nodes).edges(edges).build();
    }

    static String truncate(String text) {
        String flat = text.replace('\n', ' ').strip();
        if (flat.length() <= LABEL_LENGTH) {
            return flat;
        }
        return flat.substring(0, LABEL_LENGTH - 3) + "...";
    }
}
