package com.tgarchitect.core.graph.edge;

import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.model.ParseError;

import java.util.Objects;

/**
 * Why an edge could not be created.
 *
 * @param edgeType requested edge type
 * @param sourceNodeId requested source node, may be null
 * @param targetNodeId requested target node, may be null
 * @param code error code
 * @param field offending field, or null
 * @param message description
 */
public record EdgeCreationError(
    EdgeType edgeType,
    String sourceNodeId,
    String targetNodeId,
    ErrorCode code,
    String field,
    String message
) {
    public EdgeCreationError {
        Objects.requireNonNull(edgeType, "edgeType must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public ParseError toParseError() {
        return new ParseError(edgeType.wireName() + " " + sourceNodeId + " -> " + targetNodeId + ": " + message,
            null, code.defaultSeverity(), code);
    }
}
