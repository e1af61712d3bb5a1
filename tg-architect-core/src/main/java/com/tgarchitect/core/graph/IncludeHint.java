package com.tgarchitect.core.graph;

import com.tgarchitect.core.model.MergeStrategy;

import java.util.Objects;
import java.util.Optional;

/**
 * An {@code include} reference found while creating nodes, to be turned into a
 * {@code tg_includes} edge.
 *
 * @param sourceId id of the including node
 * @param targetPath resolved absolute path of the included file
 * @param targetId id of the included node, null when the target was not scanned
 * @param includeLabel include label, empty for unlabeled includes
 * @param mergeStrategy merge strategy of the include
 * @param exposeAsVariable whether the include is exposed
 * @param resolved whether the path resolved to an existing file
 */
public record IncludeHint(
    String sourceId,
    String targetPath,
    String targetId,
    String includeLabel,
    MergeStrategy mergeStrategy,
    boolean exposeAsVariable,
    boolean resolved
) {
    public IncludeHint {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetPath, "targetPath must not be null");
        includeLabel = includeLabel == null ? "" : includeLabel;
        mergeStrategy = mergeStrategy == null ? MergeStrategy.NO_MERGE : mergeStrategy;
    }

    public Optional<String> getTargetId() {
        return Optional.ofNullable(targetId);
    }
}
