package com.tgarchitect.core.parser;

import com.tgarchitect.core.lexer.Token;
import com.tgarchitect.core.lexer.TokenType;

import java.util.List;

/**
 * Position in a filtered token stream.
 *
 * <p>The stream always ends with an EOF token; reading past the end keeps returning it.
 */
public final class TokenCursor {

    private final List<Token> tokens;
    private int pos;

    public TokenCursor(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
    }

    public Token current() {
        return peek(0);
    }

    public Token peek(int ahead) {
        int index = Math.min(pos + ahead, tokens.size() - 1);
        return tokens.get(index);
    }

    /**
     * Consumes the current token.
     *
     * @return the consumed token
     */
    public Token advance() {
        Token token = current();
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    /**
     * Returns the most recently consumed token.
     *
     * @return previous token, or the current one at the start of the stream
     */
    public Token previous() {
        return pos == 0 ? current() : tokens.get(pos - 1);
    }

    public boolean check(TokenType type) {
        return current().is(type);
    }

    public boolean isAtEnd() {
        return current().is(TokenType.EOF);
    }

    public void skipNewlines() {
        while (check(TokenType.NEWLINE)) {
            advance();
        }
    }

    /**
     * Skips to the start of the next top-level statement.
     *
     * <p>Stops after a newline at brace depth 0 that is followed by an identifier in the
     * first column. Closing braces without a matching opening brace are skipped, since they
     * belong to the block that failed.
     */
    public void skipToBlockBoundary() {
        int depth = 0;
        while (!isAtEnd()) {
            Token token = current();
            if (token.is(TokenType.LBRACE)) {
                depth++;
            } else if (token.is(TokenType.RBRACE)) {
                if (depth > 0) {
                    depth--;
                }
            } else if (token.is(TokenType.NEWLINE) && depth == 0) {
                Token next = peek(1);
                if (next.is(TokenType.IDENTIFIER) && next.column() == 1) {
                    advance();
                    return;
                }
            }
            advance();
        }
    }

    int position() {
        return pos;
    }
}
