package com.tgarchitect.core.validation;

/**
 * Severity of a validation issue. Only {@link #ERROR} makes a file invalid.
 */
public enum ValidationSeverity {
    ERROR,
    WARNING,
    INFO
}
