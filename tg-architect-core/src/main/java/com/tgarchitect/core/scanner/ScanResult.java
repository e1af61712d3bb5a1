package com.tgarchitect.core.scanner;

import com.tgarchitect.core.graph.GraphNode;
import com.tgarchitect.core.graph.edge.TgEdge;
import com.tgarchitect.core.hierarchy.DependencyGraph;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.TerragruntFile;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of {@link TerragruntScanner#scan(ScanContext)}.
 *
 * @param scanId scan identifier
 * @param success false when the scan could not run or was cancelled
 * @param cancelled whether the cancellation check stopped the scan
 * @param files parsed and resolved files
 * @param nodes configuration and synthetic module nodes
 * @param edges typed edges
 * @param graph file level dependency graph with execution order
 * @param errors error-level findings
 * @param warnings warning-level findings
 * @param statistics counters
 */
public record ScanResult(
    String scanId,
    boolean success,
    boolean cancelled,
    List<TerragruntFile> files,
    List<GraphNode> nodes,
    List<TgEdge> edges,
    DependencyGraph graph,
    List<ParseError> errors,
    List<ParseError> warnings,
    ScanStatistics statistics
) {
    public ScanResult {
        Objects.requireNonNull(scanId, "scanId must not be null");
        files = files == null ? List.of() : List.copyOf(files);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        graph = graph == null ? DependencyGraph.of(Map.of()) : graph;
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        statistics = statistics == null ? ScanStatistics.empty() : statistics;
    }

    public static ScanResult failed(String scanId, List<ParseError> errors) {
        return new ScanResult(scanId, false, false, null, null, null, null, errors, null, null);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasCycles() {
        return graph.hasCycles();
    }
}
