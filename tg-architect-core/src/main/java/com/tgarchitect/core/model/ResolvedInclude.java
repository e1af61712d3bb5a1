package com.tgarchitect.core.model;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.model.block.IncludeBlock;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving one include block.
 *
 * @param label include label
 * @param pathExpression the include's path expression
 * @param resolvedPath absolute normalized target path, null when resolution failed
 * @param mergeStrategy merge strategy declared by the include
 * @param exposeAsVariable whether the include is exposed as a variable
 * @param failureReason why resolution failed, null on success
 */
public record ResolvedInclude(
    String label,
    HclExpression pathExpression,
    String resolvedPath,
    MergeStrategy mergeStrategy,
    boolean exposeAsVariable,
    String failureReason
) {
    public ResolvedInclude {
        label = label == null ? "" : label;
        Objects.requireNonNull(pathExpression, "pathExpression must not be null");
        mergeStrategy = mergeStrategy == null ? MergeStrategy.NO_MERGE : mergeStrategy;
        if (resolvedPath == null && failureReason == null) {
            failureReason = "unresolved";
        }
    }

    public static ResolvedInclude of(IncludeBlock block, String resolvedPath) {
        Objects.requireNonNull(resolvedPath, "resolvedPath must not be null");
        return new ResolvedInclude(block.label(), block.path(), resolvedPath,
            block.mergeStrategy(), block.exposeAsVariable(), null);
    }

    public static ResolvedInclude failed(IncludeBlock block, String reason) {
        return new ResolvedInclude(block.label(), block.path(), null,
            block.mergeStrategy(), block.exposeAsVariable(), reason);
    }

    public boolean isResolved() {
        return resolvedPath != null;
    }

    public Optional<String> getResolvedPath() {
        return Optional.ofNullable(resolvedPath);
    }
}
