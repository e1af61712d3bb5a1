package com.tgarchitect.core.graph;

import com.tgarchitect.core.model.ParseError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link NodeFactory#createTerragruntConfigNodesWithRelationships}.
 *
 * @param nodes one node per file that could be converted
 * @param dependencyHints dependency references between nodes
 * @param includeHints include references between nodes
 * @param pathToId normalized absolute file path to node id
 * @param errors per-file failures
 */
public record NodeBatchResult(
    List<GraphNode> nodes,
    List<DependencyHint> dependencyHints,
    List<IncludeHint> includeHints,
    Map<String, String> pathToId,
    List<ParseError> errors
) {
    public NodeBatchResult {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        dependencyHints = dependencyHints == null ? List.of() : List.copyOf(dependencyHints);
        includeHints = includeHints == null ? List.of() : List.copyOf(includeHints);
        pathToId = pathToId == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(pathToId));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
