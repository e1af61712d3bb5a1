package com.tgarchitect.core.config;

import com.tgarchitect.core.error.ConfigurationException;
import com.tgarchitect.core.error.ErrorSeverity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigValidator}.
 */
class ConfigValidatorTest {

    @Test
    void validate_defaults_noIssues() {
        assertThat(ConfigValidator.validate(TerragruntConfig.defaults())).isEmpty();
        assertThat(TerragruntConfig.defaults().isValid()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(ConfigPreset.class)
    void validate_presets_haveNoErrors(ConfigPreset preset) {
        assertThat(preset.config().isValid()).isTrue();
    }

    @Test
    void validate_includeDepthOutOfRange_reportsError() {
        TerragruntConfig zero = withParser(ParserConfig.builder().maxIncludeDepth(0));
        TerragruntConfig huge = withParser(ParserConfig.builder().maxIncludeDepth(51));

        assertThat(fields(zero)).containsExactly("parser.maxIncludeDepth");
        assertThat(fields(huge)).containsExactly("parser.maxIncludeDepth");
    }

    @Test
    void validate_parserLimits_reportErrors() {
        TerragruntConfig config = withParser(ParserConfig.builder()
            .filePatterns(List.of())
            .maxFileSize(10L)
            .maxScanDepth(-1)
            .maxCacheSize(0)
            .cacheTtlMs(-5L)
            .encoding("NOT-A-CHARSET"));

        assertThat(fields(config)).containsExactlyInAnyOrder(
            "parser.filePatterns",
            "parser.maxFileSize",
            "parser.maxScanDepth",
            "parser.maxCacheSize",
            "parser.cacheTtlMs",
            "parser.encoding");
    }

    @Test
    void validate_softLimits_reportWarnings() {
        // Given
        TerragruntConfig config = withParser(ParserConfig.builder()
            .maxFileSize(200L * 1024 * 1024)
            .excludePatterns(List.of(" "))
            .nodeIdPrefix("1-bad"))
            .withEdge(EdgeConfig.defaults().withMaxEvidencePerEdge(500));

        // When
        List<ConfigValidationIssue> issues = config.validate();

        // Then
        assertThat(issues).allMatch(issue -> issue.severity() == ErrorSeverity.WARNING);
        assertThat(issues).extracting(ConfigValidationIssue::field).containsExactlyInAnyOrder(
            "parser.excludePatterns", "parser.maxFileSize", "parser.nodeIdPrefix", "edge.maxEvidencePerEdge");
        assertThat(config.isValid()).isTrue();
    }

    @Test
    void validate_confidenceOutOfRange_reportsError() {
        TerragruntConfig config = TerragruntConfig.defaults()
            .withEdge(EdgeConfig.defaults().withConfidences(101, 85, -1))
            .withLinker(new LinkerConfig(true, 100, 150, 0));

        assertThat(fields(config)).containsExactlyInAnyOrder(
            "edge.explicitConfidence",
            "edge.heuristicConfidence",
            "linker.externalSourceConfidence",
            "linker.maxRecursionDepth");
    }

    @Test
    void validateOrThrow_errors_throwWithIssues() {
        TerragruntConfig config = withParser(ParserConfig.builder().maxIncludeDepth(0));

        assertThatThrownBy(config::validateOrThrow)
            .isInstanceOf(ConfigurationException.class)
            .satisfies(e -> assertThat(((ConfigurationException) e).getErrors())
                .extracting(ConfigValidationIssue::field)
                .containsExactly("parser.maxIncludeDepth"));
    }

    private static TerragruntConfig withParser(ParserConfig.Builder builder) {
        return TerragruntConfig.defaults().withParser(builder.build());
    }

    private static List<String> fields(TerragruntConfig config) {
        return config.validate().stream()
            .filter(ConfigValidationIssue::isError)
            .map(ConfigValidationIssue::field)
            .toList();
    }
}
