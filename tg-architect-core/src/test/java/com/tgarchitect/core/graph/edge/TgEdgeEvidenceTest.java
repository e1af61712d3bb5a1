package com.tgarchitect.core.graph.edge;

import com.tgarchitect.core.config.EdgeConfig;
import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.error.EvidenceValidationException;
import com.tgarchitect.core.model.TerragruntFile;
import com.tgarchitect.core.model.block.DependencyBlock;
import com.tgarchitect.core.model.block.IncludeBlock;
import com.tgarchitect.core.parser.TerragruntParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TgEdgeEvidence}.
 */
class TgEdgeEvidenceTest {

    private final EdgeConfig config = EdgeConfig.defaults();
    private final TerragruntParser parser = TerragruntParser.create();

    @Test
    void build_validFields_succeeds() {
        TgEdgeEvidence evidence = TgEdgeEvidence.builder()
            .file("live/app/terragrunt.hcl")
            .lines(3, 5)
            .snippet("dependency \"vpc\" {}")
            .confidence(100)
            .explicit()
            .description("Explicit dependency")
            .build();

        assertThat(evidence.lineStart()).isEqualTo(3);
        assertThat(evidence.lineEnd()).isEqualTo(5);
        assertThat(evidence.evidenceType()).isEqualTo(EvidenceType.EXPLICIT);
    }

    @Test
    void build_lineEndBeforeLineStart_throwsException() {
        assertThatThrownBy(() -> base().lines(5, 4).build())
            .isInstanceOf(EvidenceValidationException.class)
            .satisfies(e -> {
                EvidenceValidationException ex = (EvidenceValidationException) e;
                assertThat(ex.getField()).isEqualTo("lineEnd");
                assertThat(ex.getCode()).isEqualTo(ErrorCode.INVALID_EVIDENCE);
            });
    }

    @Test
    void build_invalidFields_nameTheField() {
        assertField(base().file(" "), "file");
        assertField(base().lines(0, 0), "lineStart");
        assertField(base().confidence(101), "confidence");
        assertField(base().confidence(-1), "confidence");
        assertField(base().type(null), "evidenceType");
        assertField(base().description(""), "description");
    }

    @Test
    void build_longSnippet_isTruncated() {
        TgEdgeEvidence evidence = base().snippet("x".repeat(500)).build();

        assertThat(evidence.snippet()).hasSize(200);
    }

    @Test
    void validateAll_nullItem_throwsException() {
        assertThatThrownBy(() -> TgEdgeEvidence.validateAll(java.util.Arrays.asList(base().build(), null)))
            .isInstanceOf(EvidenceValidationException.class)
            .hasMessageContaining("evidence");
    }

    @Test
    void fromInclude_resolvedOrNot_switchesTypeAndConfidence() {
        // Given
        TerragruntFile file = parser.parse(
            "include \"root\" {\n  path = find_in_parent_folders()\n}\n", "live/app/terragrunt.hcl");
        IncludeBlock block = file.includeBlocks().get(0);

        // When
        TgEdgeEvidence resolved = TgEdgeEvidence.fromInclude(block, true, config);
        TgEdgeEvidence unresolved = TgEdgeEvidence.fromInclude(block, false, config);

        // Then
        assertThat(resolved.evidenceType()).isEqualTo(EvidenceType.EXPLICIT);
        assertThat(resolved.confidence()).isEqualTo(100);
        assertThat(resolved.file()).isEqualTo("live/app/terragrunt.hcl");
        assertThat(resolved.lineStart()).isEqualTo(1);
        assertThat(resolved.lineEnd()).isEqualTo(3);
        assertThat(resolved.snippet()).startsWith("include \"root\"");
        assertThat(unresolved.evidenceType()).isEqualTo(EvidenceType.HEURISTIC);
        assertThat(unresolved.confidence()).isEqualTo(70);
    }

    @Test
    void fromDependency_usesConfiguredConfidence() {
        TerragruntFile file = parser.parse(
            "dependency \"vpc\" {\n  config_path = \"../vpc\"\n}\n", "live/app/terragrunt.hcl");
        DependencyBlock block = file.dependencyBlocks().get(0);

        TgEdgeEvidence evidence = TgEdgeEvidence.fromDependency(block, true, config.withConfidences(95, null, null));

        assertThat(evidence.confidence()).isEqualTo(95);
        assertThat(evidence.description()).contains("\"vpc\"");
    }

    private static TgEdgeEvidence.Builder base() {
        return TgEdgeEvidence.builder()
            .file("terragrunt.hcl")
            .line(1)
            .confidence(50)
            .heuristic()
            .description("base");
    }

    private static void assertField(TgEdgeEvidence.Builder builder, String field) {
        assertThatThrownBy(builder::build)
            .isInstanceOf(EvidenceValidationException.class)
            .satisfies(e -> assertThat(((EvidenceValidationException) e).getField()).isEqualTo(field));
    }
}
