package com.tgarchitect.core.model;

import com.tgarchitect.core.expression.HclExpression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving one dependency target.
 *
 * <p>Produced for each {@code dependency} block and for each entry of a
 * {@code dependencies} block. The latter have an empty name.
 *
 * @param name dependency name, empty for {@code dependencies} entries
 * @param configPathExpression config path expression
 * @param resolvedPath absolute path of the target terragrunt.hcl, null when resolution failed
 * @param outputsUsed output keys referenced as {@code dependency.<name>.outputs.<key>}
 * @param failureReason why resolution failed, null on success
 */
public record ResolvedDependency(
    String name,
    HclExpression configPathExpression,
    String resolvedPath,
    List<String> outputsUsed,
    String failureReason
) {
    public ResolvedDependency {
        name = name == null ? "" : name;
        Objects.requireNonNull(configPathExpression, "configPathExpression must not be null");
        outputsUsed = outputsUsed == null ? List.of() : List.copyOf(outputsUsed);
        if (resolvedPath == null && failureReason == null) {
            failureReason = "unresolved";
        }
    }

    public static ResolvedDependency of(String name, HclExpression expression, String resolvedPath, List<String> outputsUsed) {
        Objects.requireNonNull(resolvedPath, "resolvedPath must not be null");
        return new ResolvedDependency(name, expression, resolvedPath, outputsUsed, null);
    }

    public static ResolvedDependency failed(String name, HclExpression expression, List<String> outputsUsed, String reason) {
        return new ResolvedDependency(name, expression, null, outputsUsed, reason);
    }

    public boolean isResolved() {
        return resolvedPath != null;
    }

    public Optional<String> getResolvedPath() {
        return Optional.ofNullable(resolvedPath);
    }
}
