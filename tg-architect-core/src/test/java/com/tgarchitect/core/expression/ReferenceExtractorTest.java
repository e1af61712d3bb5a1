package com.tgarchitect.core.expression;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ReferenceExtractor}.
 */
class ReferenceExtractorTest {

    private final ExpressionParser parser = new ExpressionParser();

    @Test
    void extractReferences_dependencyOutput_exposesNameAndOutput() {
        // When
        List<ExtractedReference> refs = ReferenceExtractor.extractReferences(
            parser.parse("dependency.vpc.outputs.vpc_id"));

        // Then
        assertThat(refs).hasSize(1);
        ExtractedReference ref = refs.get(0);
        assertThat(ref.type()).isEqualTo(ReferenceType.DEPENDENCY);
        assertThat(ref.name()).contains("vpc");
        assertThat(ref.dependencyOutput()).contains("vpc_id");
        assertThat(ref.parts()).containsExactly("vpc", "outputs", "vpc_id");
    }

    @Test
    void extractReferences_nestedInCallsAndObjects_findsAll() {
        HclExpression expr = parser.parse("merge(local.tags, { env = var.env, id = dependency.app.outputs.id })");

        List<ExtractedReference> refs = ReferenceExtractor.extractReferences(expr);

        assertThat(refs).extracting(ExtractedReference::type)
            .containsExactly(ReferenceType.LOCAL, ReferenceType.VAR, ReferenceType.DEPENDENCY);
    }

    @Test
    void extractReferences_byType_filtersNamespace() {
        HclExpression expr = parser.parse("\"${local.a}-${var.b}-${local.c}\"");

        List<ExtractedReference> locals = ReferenceExtractor.extractReferences(expr, ReferenceType.LOCAL);

        assertThat(locals).extracting(ref -> ref.name().orElseThrow()).containsExactly("a", "c");
    }

    @Test
    void extractReferences_resourceAndData_computeAttribute() {
        ExtractedReference resource = ReferenceExtractor.extractReferences(parser.parse("aws_instance.web.id")).get(0);
        ExtractedReference data = ReferenceExtractor.extractReferences(parser.parse("data.aws_ami.ubuntu.id")).get(0);

        assertThat(resource.type()).isEqualTo(ReferenceType.RESOURCE);
        assertThat(resource.attribute()).isEqualTo("id");
        assertThat(data.type()).isEqualTo(ReferenceType.DATA);
        assertThat(data.attribute()).isEqualTo("id");
    }

    @Test
    void dependencyOutput_nonOutputReference_isEmpty() {
        ExtractedReference ref = ReferenceExtractor.extractReferences(parser.parse("dependency.vpc.config_path")).get(0);

        assertThat(ref.dependencyOutput()).isEmpty();
    }

    @Test
    void extractReferences_null_returnsEmpty() {
        assertThat(ReferenceExtractor.extractReferences(null)).isEmpty();
    }
}
