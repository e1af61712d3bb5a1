package com.tgarchitect.core.error;

/**
 * Raised when a {@code TgEdgeEvidence} value violates one of its field constraints.
 */
public class EvidenceValidationException extends ValidationException {

    public EvidenceValidationException(String field, String message) {
        super(ErrorCode.INVALID_EVIDENCE, field, field + ": " + message);
    }
}
