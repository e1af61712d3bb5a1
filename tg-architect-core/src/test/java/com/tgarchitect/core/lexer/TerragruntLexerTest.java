package com.tgarchitect.core.lexer;

import com.tgarchitect.core.error.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TerragruntLexer}.
 */
class TerragruntLexerTest {

    private final TerragruntLexer lexer = new TerragruntLexer();

    @Test
    void tokenize_simpleBlock_producesExpectedTokenSequence() {
        // When
        LexResult result = lexer.tokenize("terraform { source = \"X\" }", "terragrunt.hcl");

        // Then
        assertThat(result.errors()).isEmpty();
        assertThat(types(result.tokens())).containsExactly(
            TokenType.IDENTIFIER, TokenType.LBRACE, TokenType.IDENTIFIER, TokenType.EQUALS,
            TokenType.STRING, TokenType.RBRACE, TokenType.EOF);
        assertThat(result.tokens().get(4).value()).isEqualTo("\"X\"");
    }

    @Test
    void tokenize_newlines_areKeptWithPositions() {
        LexResult result = lexer.tokenize("a\nb");

        List<Token> tokens = result.tokens();
        assertThat(types(tokens)).containsExactly(
            TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.IDENTIFIER, TokenType.EOF);
        assertThat(tokens.get(0).line()).isEqualTo(1);
        assertThat(tokens.get(0).column()).isEqualTo(1);
        assertThat(tokens.get(1).column()).isEqualTo(2);
        assertThat(tokens.get(2).line()).isEqualTo(2);
        assertThat(tokens.get(2).column()).isEqualTo(1);
    }

    @Test
    void tokenize_comments_areEmittedAndFilteredForParsing() {
        // Given
        String input = """
            # hash comment
            // slash comment
            /* block
               comment */
            x = 1
            """;

        // When
        LexResult result = lexer.tokenize(input);

        // Then
        assertThat(result.tokens()).filteredOn(t -> t.is(TokenType.COMMENT)).hasSize(3);
        assertThat(result.filterForParsing()).noneMatch(t -> t.is(TokenType.COMMENT));
        assertThat(result.filterForParsing()).anyMatch(t -> t.is(TokenType.NUMBER) && t.value().equals("1"));
    }

    @Test
    void tokenize_keywords_mapToBoolAndNull() {
        LexResult result = lexer.tokenize("true false null other");

        assertThat(types(result.tokens())).containsExactly(
            TokenType.BOOL, TokenType.BOOL, TokenType.NULL, TokenType.IDENTIFIER, TokenType.EOF);
    }

    @Test
    void tokenize_identifierWithDashes_isSingleToken() {
        LexResult result = lexer.tokenize("find_in_parent_folders my-module");

        assertThat(result.tokens().get(0).value()).isEqualTo("find_in_parent_folders");
        assertThat(result.tokens().get(1).value()).isEqualTo("my-module");
    }

    @Test
    void tokenize_unterminatedString_reportsErrorAndEmitsPartialToken() {
        // When
        LexResult result = lexer.tokenize("x = \"unterminated", "broken.hcl");

        // Then
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).code()).isEqualTo(ErrorCode.UNTERMINATED_STRING);
        assertThat(result.errors().get(0).location().file()).isEqualTo("broken.hcl");
        assertThat(result.tokens()).anyMatch(t -> t.is(TokenType.STRING) && t.value().equals("\"unterminated"));
    }

    @Test
    void tokenize_escapedQuote_doesNotEndString() {
        LexResult result = lexer.tokenize("\"say \\\"hi\\\"\" next");

        assertThat(result.errors()).isEmpty();
        assertThat(result.tokens().get(0).type()).isEqualTo(TokenType.STRING);
        assertThat(result.tokens().get(0).value()).isEqualTo("\"say \\\"hi\\\"\"");
        assertThat(result.tokens().get(1).value()).isEqualTo("next");
    }

    @Test
    void tokenize_interpolationWithNestedQuotes_staysOneString() {
        // Given
        String input = "\"${lookup(local.map, \"key\")}-suffix\"";

        // When
        LexResult result = lexer.tokenize(input);

        // Then
        assertThat(result.errors()).isEmpty();
        assertThat(types(result.tokens())).containsExactly(TokenType.STRING, TokenType.EOF);
        assertThat(result.tokens().get(0).value()).isEqualTo(input);
    }

    @Test
    void tokenize_interpolationOutsideString_isAtomicToken() {
        LexResult result = lexer.tokenize("${ %{");

        assertThat(types(result.tokens())).containsExactly(
            TokenType.INTERPOLATION, TokenType.DIRECTIVE, TokenType.EOF);
        assertThat(result.tokens().get(0).value()).isEqualTo("${");
    }

    @Test
    void tokenize_heredoc_consumesUntilDelimiterLine() {
        // Given
        String input = """
            contents = <<-EOF
              provider "aws" {}
              EOF
            next = 1
            """;

        // When
        LexResult result = lexer.tokenize(input);

        // Then
        assertThat(result.errors()).isEmpty();
        Token heredoc = result.tokens().stream().filter(t -> t.is(TokenType.HEREDOC)).findFirst().orElseThrow();
        assertThat(heredoc.value()).startsWith("<<-EOF").endsWith("EOF");
        assertThat(StringLiterals.extractHeredocContent(heredoc.value())).isEqualTo("provider \"aws\" {}");
        assertThat(result.tokens()).anyMatch(t -> t.value().equals("next"));
    }

    @Test
    void tokenize_unterminatedHeredoc_reportsNonFatalError() {
        LexResult result = lexer.tokenize("x = <<EOT\nbody\n");

        assertThat(result.errors()).extracting(e -> e.code()).containsExactly(ErrorCode.UNTERMINATED_HEREDOC);
        assertThat(result.tokens()).anyMatch(t -> t.is(TokenType.HEREDOC));
    }

    @Test
    void tokenize_numbers_supportSignFractionAndExponent() {
        LexResult result = lexer.tokenize("-12 3.5 1e10 2E-3");

        assertThat(result.errors()).isEmpty();
        assertThat(result.tokens()).filteredOn(t -> t.is(TokenType.NUMBER))
            .extracting(Token::value)
            .containsExactly("-12", "3.5", "1e10", "2E-3");
    }

    @Test
    void tokenize_exponentWithoutDigits_reportsInvalidNumberAndContinues() {
        LexResult result = lexer.tokenize("x = 1e\ny = 2");

        assertThat(result.errors()).extracting(e -> e.code()).containsExactly(ErrorCode.INVALID_NUMBER);
        assertThat(result.tokens()).anyMatch(t -> t.is(TokenType.NUMBER) && t.value().equals("2"));
    }

    @Test
    void tokenize_invalidCharacter_isSkippedWithError() {
        // When
        LexResult result = lexer.tokenize("a @ b");

        // Then
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).code()).isEqualTo(ErrorCode.INVALID_CHARACTER);
        assertThat(result.errors().get(0).location().column()).isEqualTo(3);
        assertThat(types(result.tokens())).containsExactly(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF);
    }

    @Test
    void tokenize_operatorsAndPunctuation_areRecognized() {
        LexResult result = lexer.tokenize("a == b && c ? [d...] : {e => f}");

        assertThat(types(result.tokens())).contains(
            TokenType.OPERATOR, TokenType.QUESTION, TokenType.LBRACKET, TokenType.ELLIPSIS,
            TokenType.RBRACKET, TokenType.COLON, TokenType.LBRACE, TokenType.ARROW, TokenType.RBRACE);
        assertThat(result.tokens()).filteredOn(t -> t.is(TokenType.OPERATOR))
            .extracting(Token::value).containsExactly("==", "&&");
    }

    @Test
    void tokenize_nullInput_returnsOnlyEof() {
        LexResult result = lexer.tokenize(null);

        assertThat(types(result.tokens())).containsExactly(TokenType.EOF);
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    void tokenize_offsets_recoverSourceText() {
        String input = "name = \"value\"";

        LexResult result = lexer.tokenize(input);

        for (Token token : result.tokens()) {
            assertThat(input.substring(token.startOffset(), token.endOffset())).isEqualTo(token.value());
        }
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }
}
