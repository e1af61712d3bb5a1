package com.tgarchitect.core.lexer;

import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.SourceLocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Hand-written single pass tokenizer for Terragrunt HCL.
 *
 * <p>The lexer never aborts: malformed input is reported through
 * {@link LexResult#errors()} and scanning continues with the next character. Newlines are
 * emitted as {@link TokenType#NEWLINE} tokens because they separate HCL statements.
 *
 * <p><b>Strings and interpolation:</b> inside a quoted string, {@code ${...}} and
 * {@code %{...}} regions are tracked so that braces and quoted strings inside an
 * interpolation do not end the outer string. Nesting is tracked up to
 * {@link #MAX_INTERPOLATION_DEPTH} levels; deeper regions are reported as
 * {@link ErrorCode#INVALID_INTERPOLATION} and scanned as plain text.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LexResult result = new TerragruntLexer().tokenize(content, "live/prod/terragrunt.hcl");
 * List<Token> tokens = result.filterForParsing();
 * }</pre>
 *
 * <p>Instances keep scanning state and are not thread-safe; create one per thread or per call.
 *
 * @since 1.0.0
 */
public class TerragruntLexer {

    /**
     * Maximum number of nested {@code ${}} regions tracked inside one string literal.
     */
    public static final int MAX_INTERPOLATION_DEPTH = 16;

    private static final Map<Character, TokenType> SINGLE_CHAR_TOKENS = Map.ofEntries(
        Map.entry('{', TokenType.LBRACE),
        Map.entry('}', TokenType.RBRACE),
        Map.entry('[', TokenType.LBRACKET),
        Map.entry(']', TokenType.RBRACKET),
        Map.entry('(', TokenType.LPAREN),
        Map.entry(')', TokenType.RPAREN),
        Map.entry('=', TokenType.EQUALS),
        Map.entry(',', TokenType.COMMA),
        Map.entry('.', TokenType.DOT),
        Map.entry(':', TokenType.COLON),
        Map.entry('?', TokenType.QUESTION)
    );

    private static final List<String> TWO_CHAR_OPERATORS = List.of("==", "!=", "<=", ">=", "&&", "||");
    private static final String SINGLE_CHAR_OPERATORS = "!<>+-*/%";

    private String input;
    private String file;
    private int pos;
    private int line;
    private int column;
    private List<Token> tokens;
    private List<ParseError> errors;

    /**
     * Tokenizes input that has no associated file.
     *
     * @param input source text
     * @return tokens and errors
     */
    public LexResult tokenize(String input) {
        return tokenize(input, null);
    }

    /**
     * Tokenizes the given source text.
     *
     * @param input source text
     * @param file file path used in error locations, may be null
     * @return tokens (terminated by EOF) and non-fatal errors
     */
    public LexResult tokenize(String input, String file) {
        this.input = input == null ? "" : input;
        this.file = file;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.tokens = new ArrayList<>();
        this.errors = new ArrayList<>();

        while (!isAtEnd()) {
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", line, column, line, column, pos, pos));

        return new LexResult(tokens, errors);
    }

    private void scanToken() {
        char c = current();
        int startPos = pos;
        int startLine = line;
        int startColumn = column;

        if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
            advance();
            return;
        }

        if (c == '\n') {
            advance();
            emit(TokenType.NEWLINE, startPos, startLine, startColumn);
            return;
        }

        if (c == '#' || (c == '/' && peek() == '/')) {
            readLineComment(startPos, startLine, startColumn);
            return;
        }

        if (c == '/' && peek() == '*') {
            readBlockComment(startPos, startLine, startColumn);
            return;
        }

        if (c == '<' && peek() == '<') {
            readHeredoc(startPos, startLine, startColumn);
            return;
        }

        if (c == '"') {
            readString(startPos, startLine, startColumn);
            return;
        }

        if (isDigit(c) || (c == '-' && isDigit(peek()))) {
            readNumber(startPos, startLine, startColumn);
            return;
        }

        if (isIdentifierStart(c)) {
            readIdentifier(startPos, startLine, startColumn);
            return;
        }

        if (c == '=' && peek() == '>') {
            advance(2);
            emit(TokenType.ARROW, startPos, startLine, startColumn);
            return;
        }

        if (c == '.' && peek() == '.' && peekAt(2) == '.') {
            advance(3);
            emit(TokenType.ELLIPSIS, startPos, startLine, startColumn);
            return;
        }

        if ((c == '$' || c == '%') && peek() == '{') {
            advance(2);
            emit(c == '$' ? TokenType.INTERPOLATION : TokenType.DIRECTIVE, startPos, startLine, startColumn);
            return;
        }

        if (pos + 1 < input.length() && TWO_CHAR_OPERATORS.contains(input.substring(pos, pos + 2))) {
            advance(2);
            emit(TokenType.OPERATOR, startPos, startLine, startColumn);
            return;
        }

        TokenType single = SINGLE_CHAR_TOKENS.get(c);
        if (single != null) {
            advance();
            emit(single, startPos, startLine, startColumn);
            return;
        }

        if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
            advance();
            emit(TokenType.OPERATOR, startPos, startLine, startColumn);
            return;
        }

        error(ErrorCode.INVALID_CHARACTER, "Invalid character: '" + c + "'", startLine, startColumn);
        advance();
    }

    // ==================== Token Readers ====================

    private void readLineComment(int startPos, int startLine, int startColumn) {
        while (!isAtEnd() && current() != '\n') {
            advance();
        }
        emit(TokenType.COMMENT, startPos, startLine, startColumn);
    }

    private void readBlockComment(int startPos, int startLine, int startColumn) {
        advance(2);
        boolean closed = false;
        while (!isAtEnd()) {
            if (current() == '*' && peek() == '/') {
                advance(2);
                closed = true;
                break;
            }
            advance();
        }
        if (!closed) {
            error(ErrorCode.UNTERMINATED_COMMENT, "Unterminated block comment", startLine, startColumn);
        }
        emit(TokenType.COMMENT, startPos, startLine, startColumn);
    }

    /**
     * Reads a quoted string. The mode stack holds {@code -1} for a string body and the
     * current brace depth (0 or more) for an interpolation region.
     */
    private void readString(int startPos, int startLine, int startColumn) {
        advance();

        Deque<int[]> modes = new ArrayDeque<>();
        modes.push(new int[] {-1});
        int interpolationDepth = 0;
        boolean depthReported = false;
        boolean terminated = false;

        while (!isAtEnd()) {
            char c = current();
            int[] mode = modes.peek();

            if (mode[0] < 0) {
                if (c == '\\' && pos + 1 < input.length()) {
                    advance(2);
                    continue;
                }
                if (c == '"') {
                    advance();
                    modes.pop();
                    if (modes.isEmpty()) {
                        terminated = true;
                        break;
                    }
                    continue;
                }
                if ((c == '$' || c == '%') && peek() == c && peekAt(2) == '{') {
                    // $${ and %%{ are literal escapes
                    advance(3);
                    continue;
                }
                if ((c == '$' || c == '%') && peek() == '{') {
                    if (interpolationDepth < MAX_INTERPOLATION_DEPTH) {
                        modes.push(new int[] {0});
                        interpolationDepth++;
                    } else if (!depthReported) {
                        error(ErrorCode.INVALID_INTERPOLATION,
                            "Interpolation nested deeper than " + MAX_INTERPOLATION_DEPTH + " levels",
                            line, column);
                        depthReported = true;
                    }
                    advance(2);
                    continue;
                }
                advance();
                continue;
            }

            if (c == '"') {
                modes.push(new int[] {-1});
            } else if (c == '{') {
                mode[0]++;
            } else if (c == '}') {
                if (mode[0] == 0) {
                    modes.pop();
                    interpolationDepth--;
                } else {
                    mode[0]--;
                }
            }
            advance();
        }

        if (!terminated) {
            error(ErrorCode.UNTERMINATED_STRING, "Unterminated string literal", startLine, startColumn);
        }
        emit(TokenType.STRING, startPos, startLine, startColumn);
    }

    private void readHeredoc(int startPos, int startLine, int startColumn) {
        advance(2);

        boolean indented = current() == '-';
        if (indented) {
            advance();
        }

        StringBuilder delimiter = new StringBuilder();
        while (!isAtEnd() && isDelimiterChar(current())) {
            delimiter.append(advance());
        }

        if (delimiter.isEmpty()) {
            error(ErrorCode.UNTERMINATED_HEREDOC, "Heredoc missing delimiter", startLine, startColumn);
            emit(TokenType.HEREDOC, startPos, startLine, startColumn);
            return;
        }

        while (!isAtEnd() && current() != '\n') {
            advance();
        }
        if (!isAtEnd()) {
            advance();
        }

        String expected = delimiter.toString();
        boolean found = false;
        while (!isAtEnd()) {
            int lineEnd = input.indexOf('\n', pos);
            if (lineEnd < 0) {
                lineEnd = input.length();
            }
            String currentLine = input.substring(pos, lineEnd);

            if (isDelimiterLine(currentLine, expected, indented)) {
                advance(lineEnd - pos);
                found = true;
                break;
            }

            advance(lineEnd - pos);
            if (!isAtEnd()) {
                advance();
            }
        }

        if (!found) {
            error(ErrorCode.UNTERMINATED_HEREDOC,
                "Unterminated heredoc: expected '" + expected + "'", startLine, startColumn);
        }
        emit(TokenType.HEREDOC, startPos, startLine, startColumn);
    }

    private void readNumber(int startPos, int startLine, int startColumn) {
        if (current() == '-') {
            advance();
        }
        consumeDigits();

        if (current() == '.' && isDigit(peek())) {
            advance();
            consumeDigits();
        }

        if (current() == 'e' || current() == 'E') {
            int exponentLine = line;
            int exponentColumn = column;
            advance();
            if (current() == '+' || current() == '-') {
                advance();
            }
            if (isDigit(current())) {
                consumeDigits();
            } else {
                error(ErrorCode.INVALID_NUMBER, "Invalid number: exponent has no digits",
                    exponentLine, exponentColumn);
            }
        }

        emit(TokenType.NUMBER, startPos, startLine, startColumn);
    }

    private void readIdentifier(int startPos, int startLine, int startColumn) {
        while (!isAtEnd() && isIdentifierChar(current())) {
            advance();
        }
        String word = input.substring(startPos, pos);
        TokenType type = switch (word) {
            case "true", "false" -> TokenType.BOOL;
            case "null" -> TokenType.NULL;
            default -> TokenType.IDENTIFIER;
        };
        emit(type, startPos, startLine, startColumn);
    }

    // ==================== Helpers ====================

    private static boolean isDelimiterLine(String candidate, String delimiter, boolean indented) {
        if (indented) {
            return candidate.strip().equals(delimiter);
        }
        return candidate.stripTrailing().equals(delimiter);
    }

    private void consumeDigits() {
        while (!isAtEnd() && isDigit(current())) {
            advance();
        }
    }

    private void emit(TokenType type, int startPos, int startLine, int startColumn) {
        tokens.add(new Token(type, input.substring(startPos, pos), startLine, startColumn, line, column, startPos, pos));
    }

    private void error(ErrorCode code, String message, int atLine, int atColumn) {
        errors.add(new ParseError(message, SourceLocation.at(file, atLine, atColumn), code.defaultSeverity(), code));
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char current() {
        return pos < input.length() ? input.charAt(pos) : '\0';
    }

    private char peek() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private void advance(int count) {
        for (int i = 0; i < count && !isAtEnd(); i++) {
            advance();
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierChar(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '-';
    }

    private static boolean isDelimiterChar(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
