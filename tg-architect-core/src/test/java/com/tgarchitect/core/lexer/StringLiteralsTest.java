package com.tgarchitect.core.lexer;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StringLiterals}.
 */
class StringLiteralsTest {

    @Test
    void extractStringContent_escapedNewline_yieldsTwoLines() {
        // Given
        String raw = "\"line1\\nline2\"";

        // When
        String content = StringLiterals.extractStringContent(raw);

        // Then
        assertThat(content).isEqualTo("line1\nline2");
        assertThat(content.lines()).containsExactly("line1", "line2");
    }

    @ParameterizedTest
    @ValueSource(strings = {"line1\nline2", "tab\there", "quote \" inside", "back\\slash", "plain", ""})
    void escapeThenExtract_isIdempotent(String content) {
        String once = StringLiterals.extractStringContent(StringLiterals.quote(content));
        String twice = StringLiterals.extractStringContent(StringLiterals.quote(once));

        assertThat(once).isEqualTo(content);
        assertThat(twice).isEqualTo(once);
    }

    @Test
    void extractStringContent_unknownEscape_isKeptVerbatim() {
        assertThat(StringLiterals.extractStringContent("\"a\\qb\"")).isEqualTo("a\\qb");
    }

    @Test
    void extractStringContent_unterminatedLiteral_isTolerated() {
        assertThat(StringLiterals.extractStringContent("\"partial")).isEqualTo("partial");
    }

    @Test
    void extractStringContent_endingWithEscapedQuote_keepsQuote() {
        assertThat(StringLiterals.extractStringContent("\"a\\\"")).isEqualTo("a\"");
    }

    @Test
    void extractHeredocContent_plainForm_keepsIndentation() {
        String raw = "<<EOT\n  indented\nflat\nEOT";

        assertThat(StringLiterals.extractHeredocContent(raw)).isEqualTo("  indented\nflat");
    }

    @Test
    void extractHeredocContent_indentedForm_removesCommonIndent() {
        String raw = "<<-EOT\n    a\n      b\n    EOT";

        assertThat(StringLiterals.extractHeredocContent(raw)).isEqualTo("a\n  b");
    }
}
