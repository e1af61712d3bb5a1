package com.tgarchitect.core.linker;

import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.graph.GraphNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving one {@code terraform.source}.
 *
 * @param source parsed source
 * @param targetNodeId node the source links to, null on failure
 * @param syntheticNode node created for the module, null when an existing node was found
 * @param resolvedPath absolute module directory for local sources, or null
 * @param confidence link confidence
 * @param errorCode failure code, null on success
 * @param error failure message, null on success
 */
public record SourceResolution(
    TerraformSourceExpression source,
    String targetNodeId,
    GraphNode syntheticNode,
    String resolvedPath,
    int confidence,
    ErrorCode errorCode,
    String error
) {
    public SourceResolution {
        Objects.requireNonNull(source, "source must not be null");
    }

    public static SourceResolution linked(TerraformSourceExpression source, String targetNodeId,
                                          String resolvedPath, int confidence) {
        return new SourceResolution(source, targetNodeId, null, resolvedPath, confidence, null, null);
    }

    public static SourceResolution synthetic(TerraformSourceExpression source, GraphNode node,
                                             String resolvedPath, int confidence) {
        return new SourceResolution(source, node.id(), node, resolvedPath, confidence, null, null);
    }

    public static SourceResolution failed(TerraformSourceExpression source, String resolvedPath,
                                          ErrorCode code, String message) {
        return new SourceResolution(source, null, null, resolvedPath, 0, code, message);
    }

    public boolean isSuccess() {
        return targetNodeId != null;
    }

    public boolean isSynthetic() {
        return syntheticNode != null;
    }

    public SourceType sourceType() {
        return source.type();
    }

    public Optional<GraphNode> getSyntheticNode() {
        return Optional.ofNullable(syntheticNode);
    }

    public Optional<String> getResolvedPath() {
        return Optional.ofNullable(resolvedPath);
    }
}
