package com.tgarchitect.core.parser;

import com.tgarchitect.core.model.ParseError;

/**
 * Decides how the block parser continues after a malformed block.
 *
 * <p>{@link com.tgarchitect.core.config.ParserConfig#errorRecovery()} selects between the two
 * built-in strategies:
 * <pre>{@code
 * ErrorRecoveryStrategy strategy = config.errorRecovery()
 *     ? ErrorRecoveryStrategy.skipToBlockBoundary()
 *     : ErrorRecoveryStrategy.failFast();
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ErrorRecoveryStrategy {

    /**
     * Handles a block error. The error itself has already been recorded.
     *
     * <p>Implementations may move the cursor and must not throw.
     *
     * @param cursor token position at the point of failure
     * @param error the recorded error
     * @return true to continue parsing, false to stop
     */
    boolean recover(TokenCursor cursor, ParseError error);

    /**
     * Skips the rest of the broken block and continues with the next one.
     *
     * @return recovering strategy
     */
    static ErrorRecoveryStrategy skipToBlockBoundary() {
        return (cursor, error) -> {
            cursor.skipToBlockBoundary();
            return true;
        };
    }

    /**
     * Stops parsing at the first block error.
     *
     * @return fail-fast strategy
     */
    static ErrorRecoveryStrategy failFast() {
        return (cursor, error) -> false;
    }
}
