package com.tgarchitect.core.lexer;

/**
 * Kinds of tokens produced by {@link TerragruntLexer}.
 */
public enum TokenType {
    IDENTIFIER,
    STRING,
    NUMBER,
    BOOL,
    NULL,

    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    LPAREN,
    RPAREN,
    EQUALS,
    COMMA,
    DOT,
    COLON,
    QUESTION,
    /** {@code =>} in object for-expressions. */
    ARROW,
    /** {@code ...} expansion in function calls and for-expressions. */
    ELLIPSIS,
    /** Comparison, logical and arithmetic operators. */
    OPERATOR,

    /** Statement separator; never discarded. */
    NEWLINE,
    HEREDOC,
    COMMENT,
    /** {@code ${} outside a string body. */
    INTERPOLATION,
    /** {@code %{} outside a string body. */
    DIRECTIVE,
    EOF
}
