package com.tgarchitect.core.model;

import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.error.ErrorSeverity;

import java.util.Objects;

/**
 * Structured, non-fatal finding produced while lexing, parsing or resolving a file.
 *
 * @param message human readable description
 * @param location where the problem was found, or null when not tied to a position
 * @param severity severity
 * @param code stable error code
 */
public record ParseError(
    String message,
    SourceLocation location,
    ErrorSeverity severity,
    ErrorCode code
) {
    public ParseError {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(code, "code must not be null");
        if (severity == null) {
            severity = code.defaultSeverity();
        }
    }

    public static ParseError error(ErrorCode code, String message, SourceLocation location) {
        return new ParseError(message, location, ErrorSeverity.ERROR, code);
    }

    public static ParseError warning(ErrorCode code, String message, SourceLocation location) {
        return new ParseError(message, location, ErrorSeverity.WARNING, code);
    }

    public boolean isError() {
        return severity == ErrorSeverity.ERROR;
    }

    public boolean recoverable() {
        return code.recoverable();
    }

    @Override
    public String toString() {
        return "[" + severity.wireName() + "] " + code + " " + message
            + (location != null ? " at " + location : "");
    }
}
