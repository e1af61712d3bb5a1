package com.tgarchitect.core.error;

import com.tgarchitect.core.model.SourceLocation;

/**
 * Raised by the block parser when error recovery is disabled and the input is malformed.
 */
public class TerragruntSyntaxException extends TerragruntException {

    public TerragruntSyntaxException(ErrorCode code, String message, SourceLocation location) {
        super(code, message, location, null);
    }
}
