package com.tgarchitect.core.error;

import com.tgarchitect.core.model.SourceLocation;

/**
 * Include or dependency resolution failure, raised by {@link com.tgarchitect.core.resolver.ResolutionResult#requireResolved()}.
 */
public class ResolutionException extends TerragruntException {

    public ResolutionException(ErrorCode code, String message, SourceLocation location) {
        super(code, message, location, null);
    }

    public ResolutionException(ErrorCode code, String message) {
        super(code, message);
    }
}
