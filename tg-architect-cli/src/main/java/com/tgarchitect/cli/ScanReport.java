package com.tgarchitect.cli;

import com.tgarchitect.core.graph.GraphNode;
import com.tgarchitect.core.graph.edge.TgEdge;
import com.tgarchitect.core.hierarchy.CycleError;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.scanner.ScanResult;
import com.tgarchitect.core.scanner.ScanStatistics;

import java.util.List;
import java.util.Map;

/**
 * JSON document written by {@code scan --output}.
 *
 * @param scanId scan identifier
 * @param success whether the scan completed
 * @param statistics scan counters
 * @param nodes graph nodes
 * @param edges graph edges
 * @param executionOrder configuration files, dependencies first
 * @param cycles dependency cycles, each a list of files
 * @param errors error-level findings
 * @param warnings warning-level findings
 */
public record ScanReport(
    String scanId,
    boolean success,
    ScanStatistics statistics,
    List<NodeEntry> nodes,
    List<EdgeEntry> edges,
    List<String> executionOrder,
    List<List<String>> cycles,
    List<Finding> errors,
    List<Finding> warnings
) {

    public static ScanReport from(ScanResult result) {
        return new ScanReport(
            result.scanId(),
            result.success(),
            result.statistics(),
            result.nodes().stream().map(NodeEntry::from).toList(),
            result.edges().stream().map(EdgeEntry::from).toList(),
            result.graph().executionOrder(),
            result.graph().cycles().stream().map(CycleError::cycle).toList(),
            result.errors().stream().map(Finding::from).toList(),
            result.warnings().stream().map(Finding::from).toList());
    }

    public record NodeEntry(
        String id,
        String type,
        String name,
        String file,
        int lineStart,
        int lineEnd,
        String terraformSource,
        Map<String, Object> metadata
    ) {
        static NodeEntry from(GraphNode node) {
            return new NodeEntry(node.id(), node.type().wireName(), node.name(), node.location().file(),
                node.location().lineStart(), node.location().lineEnd(), node.terraformSource(), node.metadata());
        }
    }

    public record EdgeEntry(
        String id,
        String type,
        String source,
        String target,
        String label,
        int confidence,
        boolean implicit,
        int evidenceCount
    ) {
        static EdgeEntry from(TgEdge edge) {
            return new EdgeEntry(edge.id(), edge.type().wireName(), edge.sourceNodeId(), edge.targetNodeId(),
                edge.label(), edge.aggregatedConfidence(), edge.implicit(), edge.evidence().size());
        }
    }

    public record Finding(String code, String severity, String message, String file, Integer line) {
        static Finding from(ParseError error) {
            return new Finding(
                error.code().name(),
                error.severity().name().toLowerCase(),
                error.message(),
                error.location() == null ? null : error.location().file(),
                error.location() == null ? null : error.location().line());
        }
    }
}
