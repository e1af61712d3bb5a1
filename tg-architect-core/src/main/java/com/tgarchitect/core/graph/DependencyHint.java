package com.tgarchitect.core.graph;

import java.util.Objects;
import java.util.Optional;

/**
 * A {@code dependency} or {@code dependencies} reference found while creating nodes,
 * to be turned into a {@code tg_depends_on} edge.
 *
 * @param sourceId id of the declaring node
 * @param targetPath resolved absolute path of the target configuration
 * @param targetId id of the target node, null when the target was not scanned
 * @param dependencyName dependency name, empty for {@code dependencies} entries
 * @param resolved whether the path resolved to an existing file
 */
public record DependencyHint(
    String sourceId,
    String targetPath,
    String targetId,
    String dependencyName,
    boolean resolved
) {
    public DependencyHint {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetPath, "targetPath must not be null");
        dependencyName = dependencyName == null ? "" : dependencyName;
    }

    public Optional<String> getTargetId() {
        return Optional.ofNullable(targetId);
    }
}
