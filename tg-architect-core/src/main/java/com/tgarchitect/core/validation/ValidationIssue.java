package com.tgarchitect.core.validation;

import com.tgarchitect.core.model.SourceLocation;
import com.tgarchitect.core.model.block.BlockKind;

import java.util.Objects;

/**
 * A rule violation found in a file.
 *
 * @param code rule id
 * @param message human-readable message
 * @param severity severity
 * @param location source location, null for file-level issues
 * @param blockKind block that caused the issue, null when unknown
 * @param suggestion suggested fix, may be null
 */
public record ValidationIssue(
    String code,
    String message,
    ValidationSeverity severity,
    SourceLocation location,
    BlockKind blockKind,
    String suggestion
) {
    public ValidationIssue {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }

    static ValidationIssue of(ValidationRule rule, String message, SourceLocation location, BlockKind blockKind,
                              String suggestion) {
        return new ValidationIssue(rule.id(), message, rule.severity(), location, blockKind, suggestion);
    }

    public boolean isError() {
        return severity == ValidationSeverity.ERROR;
    }

    @Override
    public String toString() {
        String where = location == null ? "" : location.file() + ":" + location.line() + " ";
        return where + "[" + code + "] " + severity.name().toLowerCase() + ": " + message;
    }
}
