package com.tgarchitect.core.lexer;

import java.util.Objects;

/**
 * Immutable lexical token.
 *
 * <p>Line and column positions are 1-based. Offsets index into the lexed input and
 * allow the parser to recover the exact source text of a token range.
 *
 * @param type token kind
 * @param value raw source text of the token
 * @param line start line
 * @param column start column
 * @param endLine line after the last character
 * @param endColumn column after the last character
 * @param startOffset offset of the first character
 * @param endOffset offset after the last character
 */
public record Token(
    TokenType type,
    String value,
    int line,
    int column,
    int endLine,
    int endColumn,
    int startOffset,
    int endOffset
) {
    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "(" + value.replace("\n", "\\n") + ")@" + line + ":" + column;
    }
}
