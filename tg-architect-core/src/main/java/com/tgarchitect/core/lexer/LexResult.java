package com.tgarchitect.core.lexer;

import com.tgarchitect.core.model.ParseError;

import java.util.List;

/**
 * Output of a single {@link TerragruntLexer#tokenize(String, String)} call.
 *
 * @param tokens every token including comments and newlines, terminated by EOF
 * @param errors non-fatal lexical errors
 */
public record LexResult(
    List<Token> tokens,
    List<ParseError> errors
) {
    public LexResult {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Returns the tokens the block parser consumes: everything except comments.
     *
     * @return filtered token list
     */
    public List<Token> filterForParsing() {
        return tokens.stream()
            .filter(token -> token.type() != TokenType.COMMENT)
            .toList();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
