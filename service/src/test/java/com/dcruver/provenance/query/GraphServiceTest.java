package com.dcruver.provenance.query;

import com.dcruver.provenance.app.DataSourceConfig;
import com.dcruver.provenance.domain.Fragment;
import com.dcruver.provenance.domain.FragmentFilter;
import com.dcruver.provenance.domain.FragmentLink;
import com.dcruver.provenance.domain.LinkKind;
import com.dcruver.provenance.storage.FragmentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GraphServiceTest {

    @TempDir
    Path tempDir;

    private FragmentStore store;
    private GraphService graphService;

    @BeforeEach
    void setUp() throws Exception {
        DataSource dataSource = DataSourceConfig.sqliteDataSource(tempDir.resolve("provenance.db"));
        store = new FragmentStore(dataSource, new DataSourceTransactionManager(dataSource));
        store.init();
        graphService = new GraphService(store);
    }

    @Test
    void testEdgesOnlyBetweenIncludedNodes() {
        Fragment a = fragment("First alpha note", "alpha");
        Fragment b = fragment("Second alpha note", "alpha");
        Fragment c = fragment("Beta note", "beta");
        link(a, b, 0.9);
        link(a, c, 0.8);

        GraphView graph = graphService.build(FragmentFilter.builder().project("alpha").build());

        assertEquals(2, graph.getNodes().size());
        assertEquals(1, graph.getEdges().size());
        GraphView.Edge edge = graph.getEdges().get(0);
        assertEquals(a.getId(), edge.getSource());
        assertEquals(b.getId(), edge.getTarget());
        assertEquals(0.9, edge.getStrength(), 1e-9);

        GraphView.Node nodeA = graph.getNodes().stream()
            .filter(n -> n.getId().equals(a.getId())).findFirst().orElseThrow();
        assertEquals(2, nodeA.getConnections(), "Connections count links outside the node set too");
    }

    @Test
    void testLabelsAreTruncated() {
        String longText = "x".repeat(200);
        fragment(longText, null);

        GraphView graph = graphService.build(FragmentFilter.all());

        String label = graph.getNodes().get(0).getLabel();
        assertEquals(GraphService.LABEL_LENGTH, label.length());
        assertTrue(label.endsWith("..."));
        assertEquals("short note", GraphService.truncate("short\nnote"));
    }

    private Fragment fragment(String content, String project) {
        return store.createFragment(Fragment.builder().rawContent(content).project(project).build());
    }

    private void link(Fragment source, Fragment target, double strength) {
        store.createLink(FragmentLink.builder()
            .sourceId(source.getId())
            .targetId(target.getId())
            .kind(LinkKind.RELATES_TO)
            .strength(strength)
            .build());
    }
}
