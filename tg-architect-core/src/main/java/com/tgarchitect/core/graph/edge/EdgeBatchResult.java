package com.tgarchitect.core.graph.edge;

import java.util.ArrayList;
import java.util.List;

/**
 * Edges and rejections from a batch call on {@link EdgeFactory}.
 *
 * @param edges created edges
 * @param errors rejected requests
 * @param summary counts
 */
public record EdgeBatchResult(
    List<TgEdge> edges,
    List<EdgeCreationError> errors,
    EdgeSummary summary
) {
    public EdgeBatchResult {
        edges = edges == null ? List.of() : List.copyOf(edges);
        errors = errors == null ? List.of() : List.copyOf(errors);
        summary = summary == null ? EdgeSummary.of(edges, errors.size()) : summary;
    }

    public static EdgeBatchResult of(List<TgEdge> edges, List<EdgeCreationError> errors) {
        return new EdgeBatchResult(edges, errors, EdgeSummary.of(edges, errors.size()));
    }

    public static EdgeBatchResult fromOutcomes(List<EdgeCreationOutcome> outcomes) {
        List<TgEdge> edges = new ArrayList<>();
        List<EdgeCreationError> errors = new ArrayList<>();
        for (EdgeCreationOutcome outcome : outcomes) {
            outcome.getEdge().ifPresent(edges::add);
            outcome.getError().ifPresent(errors::add);
        }
        return of(edges, errors);
    }

    /**
     * Concatenates two results and recomputes the summary.
     *
     * @param other result to append
     * @return combined result
     */
    public EdgeBatchResult merge(EdgeBatchResult other) {
        List<TgEdge> allEdges = new ArrayList<>(edges);
        allEdges.addAll(other.edges());
        List<EdgeCreationError> allErrors = new ArrayList<>(errors);
        allErrors.addAll(other.errors());
        return of(allEdges, allErrors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
