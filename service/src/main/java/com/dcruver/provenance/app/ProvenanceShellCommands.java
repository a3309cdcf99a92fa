package com.dcruver.provenance.app;

import com.dcruver.provenance.capture.CaptureService;
import com.dcruver.provenance.domain.Assumption;
import com.dcruver.provenance.domain.AssumptionValidity;
import com.dcruver.provenance.domain.Decision;
import com.dcruver.provenance.domain.Fragment;
import com.dcruver.provenance.domain.FragmentFilter;
import com.dcruver.provenance.domain.FragmentLink;
import com.dcruver.provenance.domain.FragmentUpdate;
import com.dcruver.provenance.domain.LinkKind;
import com.dcruver.provenance.domain.RecordFilter;
import com.dcruver.provenance.domain.RelatedFragment;
import com.dcruver.provenance.domain.SourceKind;
import com.dcruver.provenance.error.ProvenanceException;
import com.dcruver.provenance.lifecycle.AssumptionLifecycle;
import com.dcruver.provenance.nlp.EmbeddingService;
import com.dcruver.provenance.query.GraphService;
import com.dcruver.provenance.query.GraphView;
import com.dcruver.provenance.query.SearchHit;
import com.dcruver.provenance.query.SearchService;
import com.dcruver.provenance.storage.FragmentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Spring Shell commands for capturing and inspecting provenance data.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class ProvenanceShellCommands {

    private final CaptureService captureService;
    private final FragmentStore fragmentStore;
    private final AssumptionLifecycle assumptionLifecycle;
    private final SearchService searchService;
    private final GraphService graphService;
    private final EmbeddingService embeddingService;

    @ShellMethod(key = "capture", value = "Capture a new context fragment")
    public String capture(
        @ShellOption(help = "Fragment text") String content,
        @ShellOption(defaultValue = "quick_capture", help = "quick_capture, meeting_video, chat or notes") String source,
        @ShellOption(defaultValue = ShellOption.NULL) String sourceRef,
        @ShellOption(defaultValue = ShellOption.NULL) String project,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Comma-separated topics") String topics,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Comma-separated participants") String participants
    ) {
        return run(() -> {
            Fragment fragment = captureService.capture(Fragment.builder()
                .rawContent(content)
                .sourceKind(SourceKind.fromValue(source))
                .sourceRef(sourceRef)
                .project(project)
                .topics(splitCsv(topics))
                .participants(splitCsv(participants))
                .build());
            return "Captured fragment " + fragment.getId() + "\nLinking and extraction queued.";
        });
    }

    @ShellMethod(key = "show", value = "Show a fragment with its decisions and assumptions")
    public String show(String id) {
        return run(() -> fragmentStore.getFragment(id)
            .map(this::formatFragmentDetail)
            .orElse("Fragment not found: " + id));
    }

    @ShellMethod(key = {"list", "fragments"}, value = "List recent fragments")
    public String list(
        @ShellOption(defaultValue = ShellOption.NULL) String project,
        @ShellOption(defaultValue = ShellOption.NULL) String source,
        @ShellOption(defaultValue = "20") int limit
    ) {
        return run(() -> {
            List<Fragment> fragments = fragmentStore.listFragments(FragmentFilter.builder()
                .project(project)
                .sourceKind(source != null ? SourceKind.fromValue(source) : null)
                .limit(limit)
                .build());
            if (fragments.isEmpty()) {
                return "No fragments.";
            }

            StringBuilder sb = new StringBuilder();
            for (Fragment f : fragments) {
                sb.append(String.format("%s  %s  [%s]%s  %s\n",
                    f.getId(), f.getCapturedAt(), f.getSourceKind().getValue(),
                    f.getProject() != null ? " (" + f.getProject() + ")" : "",
                    preview(f.getRawContent(), 60)));
            }
            return sb.toString();
        });
    }

    @ShellMethod(key = "update", value = "Change a fragment's summary, project, topics or participants")
    public String update(
        String id,
        @ShellOption(defaultValue = ShellOption.NULL) String summary,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Project, or an empty string to clear") String project,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Comma-separated topics, replaces existing") String topics,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Comma-separated participants, replaces existing") String participants
    ) {
        return run(() -> {
            FragmentUpdate update = FragmentUpdate.builder()
                .summary(summary)
                .project(project)
                .topics(topics != null ? splitCsv(topics) : null)
                .participants(participants != null ? splitCsv(participants) : null)
                .build();
            if (update.isEmpty()) {
                return "Nothing to update.";
            }
            return formatFragmentDetail(captureService.update(id, update));
        });
    }

    @ShellMethod(key = "delete", value = "Delete a fragment and everything extracted from it")
    public String delete(String id) {
        return run(() -> captureService.delete(id) ? "Deleted fragment " + id : "Fragment not found: " + id);
    }

    @ShellMethod(key = "reindex", value = "Re-embed a fragment and queue linking again")
    public String reindex(String id) {
        return run(() -> "Re-indexed fragment " + captureService.reindex(id).getId());
    }

    @ShellMethod(key = "link", value = "Create or update a link between two fragments")
    public String link(
        String source,
        String target,
        @ShellOption(defaultValue = "relates_to") String kind,
        @ShellOption(defaultValue = "1.0") double strength
    ) {
        return run(() -> {
            FragmentLink link = fragmentStore.createLink(FragmentLink.builder()
                .sourceId(source)
                .targetId(target)
                .kind(LinkKind.fromValue(kind))
                .strength(strength)
                .build());
            return String.format("Link %s: %s -[%s %.2f]-> %s",
                link.getId(), link.getSourceId(), link.getKind().getValue(), link.getStrength(), link.getTargetId());
        });
    }

    @ShellMethod(key = "related", value = "Show fragments linked to a fragment")
    public String related(
        String id,
        @ShellOption(defaultValue = ShellOption.NULL) String kind,
        @ShellOption(defaultValue = "10") int limit
    ) {
        return run(() -> {
            List<RelatedFragment> related = fragmentStore.getRelatedFragments(id,
                kind != null ? LinkKind.fromValue(kind) : null, limit);
            if (related.isEmpty()) {
                return "No related fragments.";
            }

            StringBuilder sb = new StringBuilder();
            for (RelatedFragment r : related) {
                sb.append(String.format("%.3f  %-11s %s %s  %s\n",
                    r.getStrength(), r.getKind().getValue(),
                    r.getDirection() == RelatedFragment.Direction.OUTGOING ? "->" : "<-",
                    r.getFragment().getId(), preview(r.getFragment().getRawContent(), 50)));
            }
            return sb.toString();
        });
    }

    @ShellMethod(key = "decisions", value = "List extracted decisions")
    public String decisions(
        @ShellOption(defaultValue = ShellOption.NULL) String fragment,
        @ShellOption(defaultValue = ShellOption.NULL) String project,
        @ShellOption(defaultValue = "20") int limit
    ) {
        return run(() -> {
            List<Decision> decisions = fragmentStore.listDecisions(RecordFilter.builder()
                .fragmentId(fragment).project(project).limit(limit).build());
            if (decisions.isEmpty()) {
                return "No decisions.";
            }

            StringBuilder sb = new StringBuilder();
            for (Decision d : decisions) {
                sb.append(String.format("%s  (%.2f) %s%s\n", d.getId(), d.getConfidence(), d.getWhat(),
                    d.getWhy().isBlank() ? "" : " - because " + d.getWhy()));
            }
            return sb.toString();
        });
    }

    @ShellMethod(key = "assumptions", value = "List extracted assumptions")
    public String assumptions(
        @ShellOption(defaultValue = ShellOption.NULL) String fragment,
        @ShellOption(defaultValue = ShellOption.NULL) String project,
        @ShellOption(defaultValue = ShellOption.NULL, help = "unknown, valid or invalid") String validity,
        @ShellOption(defaultValue = "20") int limit
    ) {
        return run(() -> {
            List<Assumption> assumptions = fragmentStore.listAssumptions(
                RecordFilter.builder().fragmentId(fragment).project(project).limit(limit).build(),
                validity != null ? AssumptionValidity.fromValue(validity) : null);
            if (assumptions.isEmpty()) {
                return "No assumptions.";
            }

            StringBuilder sb = new StringBuilder();
            for (Assumption a : assumptions) {
                sb.append(formatAssumption(a)).append('\n');
            }
            return sb.toString();
        });
    }

    @ShellMethod(key = "validate", value = "Confirm an assumption still holds")
    public String validate(String id) {
        return run(() -> formatAssumption(assumptionLifecycle.markValid(id)));
    }

    @ShellMethod(key = "invalidate", value = "Mark an assumption invalid because of a newer fragment")
    public String invalidate(String id, @ShellOption(help = "Invalidating fragment id") String by) {
        return run(() -> formatAssumption(assumptionLifecycle.invalidate(id, by)));
    }

    @ShellMethod(key = "search", value = "Semantic search over fragments")
    public String search(
        String query,
        @ShellOption(defaultValue = "10") int limit,
        @ShellOption(defaultValue = ShellOption.NULL) String project
    ) {
        return run(() -> {
            List<SearchHit> hits = searchService.search(query, limit, project, 0.0);
            if (hits.isEmpty()) {
                return "No results.";
            }

            StringBuilder sb = new StringBuilder();
            for (SearchHit hit : hits) {
                sb.append(String.format("%.3f  %s  %s\n", hit.getSimilarity(),
                    hit.getFragment().getId(), preview(hit.getFragment().getRawContent(), 60)));
            }
            return sb.toString();
        });
    }

    @ShellMethod(key = "graph", value = "Summarize the fragment link graph")
    public String graph(
        @ShellOption(defaultValue = ShellOption.NULL) String project,
        @ShellOption(defaultValue = "100") int limit
    ) {
        return run(() -> {
            GraphView graph = graphService.build(FragmentFilter.builder().project(project).limit(limit).build());

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("%d fragments, %d links\n", graph.getNodes().size(), graph.getEdges().size()));
            for (GraphView.Node node : graph.getNodes()) {
                sb.append(String.format("  %s  %2d links  %s\n", node.getId(), node.getConnections(), node.getLabel()));
            }
            for (GraphView.Edge edge : graph.getEdges()) {
                sb.append(String.format("  %s -[%s %.2f]-> %s\n",
                    edge.getSource(), edge.getKind().getValue(), edge.getStrength(), edge.getTarget()));
            }
            return sb.toString();
        });
    }

    @ShellMethod(key = "cache-stats", value = "Show embedding cache statistics")
    public String cacheStats() {
        var stats = embeddingService.getCacheStats();
        return String.format("Embedding cache: %s, %d/%d entries, %d hits, %d misses, %d evictions",
            stats.isEnabled() ? "enabled" : "disabled", stats.getSize(), stats.getMaxSize(),
            stats.getHits(), stats.getMisses(), stats.getEvictions());
    }

    private String run(Supplier<String> command) {
        try {
            return command.get();
        } catch (ProvenanceException e) {
            return switch (e.getKind()) {
                case NOT_FOUND -> "Not found: " + e.getMessage();
                case VALIDATION -> "Invalid input: " + e.getMessage();
                case CONNECTION -> "Service unavailable: " + e.getMessage();
                case PARSE -> "Unreadable model output: " + e.getMessage();
            };
        } catch (Exception e) {
            log.error("Command failed", e);
            return "Command failed: " + e.getMessage();
        }
    }

    private String formatFragmentDetail(Fragment f) {
        StringBuilder sb = new StringBuilder();
        sb.append("Fragment ").append(f.getId()).append('\n');
        sb.append(String.format("- Source: %s%s\n", f.getSourceKind().getValue(),
            f.getSourceRef() != null ? " (" + f.getSourceRef() + ")" : ""));
        sb.append("- Captured: ").append(f.getCapturedAt()).append('\n');
        if (f.getProject() != null) {
            sb.append("- Project: ").append(f.getProject()).append('\n');
        }
        if (!f.getTopics().isEmpty()) {
            sb.append("- Topics: ").append(String.join(", ", f.getTopics())).append('\n');
        }
        if (!f.getParticipants().isEmpty()) {
            sb.append("- Participants: ").append(String.join(", ", f.getParticipants())).append('\n');
        }
        if (f.getSummary() != null) {
            sb.append("- Summary: ").append(f.getSummary()).append('\n');
        }
        sb.append('\n').append(f.getRawContent()).append("\n\n");

        sb.append("Decisions:\n");
        if (f.getDecisions().isEmpty()) {
            sb.append("  (none)\n");
        }
        for (Decision d : f.getDecisions()) {
            sb.append(String.format("  (%.2f) %s\n", d.getConfidence(), d.getWhat()));
        }

        sb.append("Assumptions:\n");
        if (f.getAssumptions().isEmpty()) {
            sb.append("  (none)\n");
        }
        for (Assumption a : f.getAssumptions()) {
            sb.append("  ").append(formatAssumption(a)).append('\n');
        }
        return sb.toString();
    }

    private static String formatAssumption(Assumption a) {
        return String.format("%s  [%s]%s %s%s", a.getId(), a.getValidity().getValue(),
            a.isExplicit() ? "" : " (implied)", a.getStatement(),
            a.getInvalidatedBy() != null ? " - invalidated by " + a.getInvalidatedBy() : "");
    }

    private static Set<String> splitCsv(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return new LinkedHashSet<>(Arrays.asList(value.split("\\s*,\\s*")));
    }

    private static String preview(String text, int maxLength) {
        String flat = text.replace('\n', ' ');
        return flat.length() <= maxLength ? flat : flat.substring(0, maxLength) + "...";
    }
}
