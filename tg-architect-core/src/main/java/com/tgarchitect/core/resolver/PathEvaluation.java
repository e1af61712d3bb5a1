package com.tgarchitect.core.resolver;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of evaluating a path expression.
 *
 * @param path evaluated path, null on failure
 * @param failure failure kind, null on success
 * @param reason human readable failure reason, null on success
 */
public record PathEvaluation(String path, Failure failure, String reason) {

    /**
     * Why a path could not be produced.
     */
    public enum Failure {
        /** The expression cannot be evaluated statically. */
        UNRESOLVABLE,
        /** {@code find_in_parent_folders} reached the filesystem root without a match. */
        NOT_FOUND,
        /** {@code find_in_parent_folders} or a locals chain exceeded the depth bound. */
        DEPTH_EXCEEDED
    }

    public static PathEvaluation resolved(String path) {
        return new PathEvaluation(Objects.requireNonNull(path, "path must not be null"), null, null);
    }

    public static PathEvaluation failed(Failure failure, String reason) {
        return new PathEvaluation(null, Objects.requireNonNull(failure, "failure must not be null"), reason);
    }

    public boolean isResolved() {
        return path != null;
    }

    public Optional<String> getPath() {
        return Optional.ofNullable(path);
    }
}
