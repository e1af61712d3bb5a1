package com.tgarchitect.core.config;

import com.tgarchitect.core.error.ErrorSeverity;

import java.util.Objects;

/**
 * One finding of {@link ConfigValidator}.
 *
 * @param field dotted field path, for example {@code parser.maxIncludeDepth}
 * @param message description
 * @param value offending value, may be null
 * @param severity {@link ErrorSeverity#ERROR} or {@link ErrorSeverity#WARNING}
 */
public record ConfigValidationIssue(
    String field,
    String message,
    Object value,
    ErrorSeverity severity
) {
    public ConfigValidationIssue {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }

    public static ConfigValidationIssue error(String field, String message, Object value) {
        return new ConfigValidationIssue(field, message, value, ErrorSeverity.ERROR);
    }

    public static ConfigValidationIssue warning(String field, String message, Object value) {
        return new ConfigValidationIssue(field, message, value, ErrorSeverity.WARNING);
    }

    public boolean isError() {
        return severity == ErrorSeverity.ERROR;
    }
}
