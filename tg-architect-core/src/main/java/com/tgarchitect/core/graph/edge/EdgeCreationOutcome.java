package com.tgarchitect.core.graph.edge;

import java.util.Optional;

/**
 * Either a created edge or the reason it was rejected.
 *
 * @param edge created edge, null on failure
 * @param error rejection reason, null on success
 */
public record EdgeCreationOutcome(
    TgEdge edge,
    EdgeCreationError error
) {
    public EdgeCreationOutcome {
        if ((edge == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of edge and error must be set");
        }
    }

    public static EdgeCreationOutcome success(TgEdge edge) {
        return new EdgeCreationOutcome(edge, null);
    }

    public static EdgeCreationOutcome failure(EdgeCreationError error) {
        return new EdgeCreationOutcome(null, error);
    }

    public boolean isSuccess() {
        return edge != null;
    }

    public Optional<TgEdge> getEdge() {
        return Optional.ofNullable(edge);
    }

    public Optional<EdgeCreationError> getError() {
        return Optional.ofNullable(error);
    }
}
