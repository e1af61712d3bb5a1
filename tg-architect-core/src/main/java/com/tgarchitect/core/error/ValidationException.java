package com.tgarchitect.core.error;

/**
 * Shape validation failure of a block, edge or evidence value.
 *
 * <p>{@link #getField()} names the offending field so callers can report it precisely.
 */
public class ValidationException extends TerragruntException {

    private final String field;

    public ValidationException(ErrorCode code, String field, String message) {
        super(code, message);
        this.field = field;
    }

    public ValidationException(String field, String message) {
        this(ErrorCode.VALIDATION_FAILED, field, message);
    }

    public String getField() {
        return field;
    }
}
