package com.tgarchitect.core.error;

/**
 * Pipeline stage an {@link ErrorCode} belongs to.
 */
public enum ErrorCategory {
    LEXER,
    SYNTAX,
    BLOCK,
    INCLUDE,
    DEPENDENCY,
    FUNCTION,
    FILESYSTEM,
    VALIDATION,
    EDGE,
    SOURCE,
    CONFIG,
    GRAPH
}
