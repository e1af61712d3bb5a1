package com.tgarchitect.core.error;

import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.SourceLocation;

import java.util.Objects;
import java.util.Optional;

/**
 * Base type of every exception the pipeline throws.
 *
 * <p>Expected failure modes (bad input files, missing includes, invalid edges) are
 * reported as {@link ParseError} values rather than thrown. Exceptions are used for
 * caller mistakes and fail-fast conditions such as invalid configuration. Either way
 * an exception can be turned into a {@link ParseError} with {@link #toParseError()}
 * so it crosses API boundaries as structured data.
 *
 * @since 1.0.0
 */
public abstract class TerragruntException extends RuntimeException {

    private final ErrorCode code;
    private final ErrorSeverity severity;
    private final SourceLocation location;

    protected TerragruntException(ErrorCode code, String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.severity = code.defaultSeverity();
        this.location = location;
    }

    protected TerragruntException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorSeverity getSeverity() {
        return severity;
    }

    public boolean isRecoverable() {
        return code.recoverable();
    }

    public Optional<SourceLocation> getLocation() {
        return Optional.ofNullable(location);
    }

    /**
     * Converts this exception to a structured parse error.
     *
     * @return parse error with the same code, severity, message and location
     */
    public ParseError toParseError() {
        return new ParseError(getMessage(), location, severity, code);
    }
}
