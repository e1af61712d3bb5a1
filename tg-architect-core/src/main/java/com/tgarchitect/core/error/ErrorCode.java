package com.tgarchitect.core.error;

/**
 * Catalog of every structured error code produced by the pipeline.
 *
 * <p>Each code carries the stage it belongs to, its default severity and whether
 * processing can continue after it. Codes are stable: they are persisted together
 * with graph data and shown to operators, so constants are only ever added.
 *
 * @since 1.0.0
 */
public enum ErrorCode {

    // Lexer
    UNTERMINATED_STRING(ErrorCategory.LEXER, ErrorSeverity.ERROR, true),
    UNTERMINATED_HEREDOC(ErrorCategory.LEXER, ErrorSeverity.ERROR, true),
    UNTERMINATED_COMMENT(ErrorCategory.LEXER, ErrorSeverity.WARNING, true),
    INVALID_CHARACTER(ErrorCategory.LEXER, ErrorSeverity.ERROR, true),
    INVALID_NUMBER(ErrorCategory.LEXER, ErrorSeverity.ERROR, true),
    INVALID_INTERPOLATION(ErrorCategory.LEXER, ErrorSeverity.WARNING, true),

    // Block parser
    SYNTAX_ERROR(ErrorCategory.SYNTAX, ErrorSeverity.ERROR, true),
    INVALID_BLOCK_TYPE(ErrorCategory.BLOCK, ErrorSeverity.WARNING, true),
    MISSING_REQUIRED_ATTRIBUTE(ErrorCategory.BLOCK, ErrorSeverity.ERROR, true),
    INVALID_ATTRIBUTE_VALUE(ErrorCategory.BLOCK, ErrorSeverity.ERROR, true),

    // Include / dependency resolution
    INCLUDE_NOT_FOUND(ErrorCategory.INCLUDE, ErrorSeverity.ERROR, true),
    CIRCULAR_INCLUDE(ErrorCategory.INCLUDE, ErrorSeverity.ERROR, true),
    DEPENDENCY_NOT_FOUND(ErrorCategory.DEPENDENCY, ErrorSeverity.WARNING, true),
    CIRCULAR_DEPENDENCY(ErrorCategory.DEPENDENCY, ErrorSeverity.ERROR, true),
    UNRESOLVED_PATH(ErrorCategory.INCLUDE, ErrorSeverity.WARNING, true),
    MAX_DEPTH_EXCEEDED(ErrorCategory.INCLUDE, ErrorSeverity.ERROR, true),

    // Functions
    UNKNOWN_FUNCTION(ErrorCategory.FUNCTION, ErrorSeverity.WARNING, true),
    INVALID_FUNCTION_ARGS(ErrorCategory.FUNCTION, ErrorSeverity.ERROR, true),

    // Filesystem
    FILE_READ_ERROR(ErrorCategory.FILESYSTEM, ErrorSeverity.ERROR, true),
    FILE_TOO_LARGE(ErrorCategory.FILESYSTEM, ErrorSeverity.ERROR, true),

    // Validation
    VALIDATION_FAILED(ErrorCategory.VALIDATION, ErrorSeverity.ERROR, false),
    INVALID_EVIDENCE(ErrorCategory.VALIDATION, ErrorSeverity.ERROR, false),

    // Edges
    EDGE_SELF_REFERENTIAL(ErrorCategory.EDGE, ErrorSeverity.ERROR, true),
    EDGE_MISSING_NODE(ErrorCategory.EDGE, ErrorSeverity.ERROR, true),
    EDGE_INVALID_FIELD(ErrorCategory.EDGE, ErrorSeverity.ERROR, true),
    EDGE_CREATION_FAILED(ErrorCategory.EDGE, ErrorSeverity.ERROR, true),

    // Terraform sources
    SOURCE_UNRESOLVABLE(ErrorCategory.SOURCE, ErrorSeverity.WARNING, true),
    SOURCE_CIRCULAR_REFERENCE(ErrorCategory.SOURCE, ErrorSeverity.ERROR, true),

    // Configuration
    INVALID_CONFIGURATION(ErrorCategory.CONFIG, ErrorSeverity.ERROR, false),

    // Dependency graph
    GRAPH_CYCLE(ErrorCategory.GRAPH, ErrorSeverity.ERROR, true);

    private final ErrorCategory category;
    private final ErrorSeverity defaultSeverity;
    private final boolean recoverable;

    ErrorCode(ErrorCategory category, ErrorSeverity defaultSeverity, boolean recoverable) {
        this.category = category;
        this.defaultSeverity = defaultSeverity;
        this.recoverable = recoverable;
    }

    public ErrorCategory category() {
        return category;
    }

    public ErrorSeverity defaultSeverity() {
        return defaultSeverity;
    }

    /**
     * Returns whether the pipeline can keep processing sibling items after this error.
     *
     * @return true if recoverable
     */
    public boolean recoverable() {
        return recoverable;
    }
}
