package com.tgarchitect.core.expression;

import com.tgarchitect.core.expression.HclExpression.ArrayExpr;
import com.tgarchitect.core.expression.HclExpression.Conditional;
import com.tgarchitect.core.expression.HclExpression.ForExpr;
import com.tgarchitect.core.expression.HclExpression.FunctionCall;
import com.tgarchitect.core.expression.HclExpression.Index;
import com.tgarchitect.core.expression.HclExpression.Literal;
import com.tgarchitect.core.expression.HclExpression.ObjectExpr;
import com.tgarchitect.core.expression.HclExpression.Reference;
import com.tgarchitect.core.expression.HclExpression.Splat;
import com.tgarchitect.core.expression.HclExpression.Template;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ExpressionParser}.
 */
class ExpressionParserTest {

    private final ExpressionParser parser = new ExpressionParser();

    @Test
    void parse_literals_returnTypedValues() {
        assertThat(((Literal) parser.parse("null")).value()).isNull();
        assertThat(((Literal) parser.parse("true")).value()).isEqualTo(Boolean.TRUE);
        assertThat(((Literal) parser.parse("42")).value()).isEqualTo(42L);
        assertThat(((Literal) parser.parse("3.5")).value()).isEqualTo(3.5);
        assertThat(parser.parse("\"hello\"").stringValue()).contains("hello");
    }

    @Test
    void parse_blankInput_returnsNullLiteral() {
        HclExpression expr = parser.parse("   ");

        assertThat(HclValues.isNull(expr)).isTrue();
        assertThat(HclValues.isNull(parser.parse(null))).isTrue();
    }

    @Test
    void parse_escapedString_isUnescaped() {
        assertThat(parser.parse("\"a\\nb\"").stringValue()).contains("a\nb");
    }

    @Test
    void parse_interpolatedString_returnsTemplateParts() {
        // When
        HclExpression expr = parser.parse("\"${local.env}-vpc\"");

        // Then
        assertThat(expr).isInstanceOf(Template.class);
        Template template = (Template) expr;
        assertThat(template.parts()).hasSize(2);
        assertThat(template.parts().get(0)).isInstanceOf(Reference.class);
        assertThat(((Reference) template.parts().get(0)).parts()).containsExactly("local", "env");
        assertThat(template.parts().get(1).stringValue()).contains("-vpc");
        assertThat(template.raw()).isEqualTo("\"${local.env}-vpc\"");
    }

    @Test
    void parse_functionCall_parsesArguments() {
        HclExpression expr = parser.parse("find_in_parent_folders(\"root.hcl\")");

        assertThat(expr).isInstanceOf(FunctionCall.class);
        FunctionCall call = (FunctionCall) expr;
        assertThat(call.name()).isEqualTo("find_in_parent_folders");
        assertThat(call.args()).hasSize(1);
        assertThat(call.args().get(0).stringValue()).contains("root.hcl");
    }

    @Test
    void parse_functionCallWithoutArguments_hasEmptyArgs() {
        FunctionCall call = (FunctionCall) parser.parse("get_terragrunt_dir()");

        assertThat(call.args()).isEmpty();
    }

    @Test
    void parse_array_returnsElements() {
        HclExpression expr = parser.parse("[\"a\", \"b\", local.c]");

        assertThat(expr).isInstanceOf(ArrayExpr.class);
        assertThat(((ArrayExpr) expr).elements()).hasSize(3);
        assertThat(HclValues.stringList(expr)).containsExactly("a", "b");
    }

    @Test
    void parse_object_returnsAttributesInOrder() {
        // When
        HclExpression expr = parser.parse("{ name = \"vpc\", \"quoted-key\" = 2 }");

        // Then
        assertThat(expr).isInstanceOf(ObjectExpr.class);
        assertThat(HclValues.attributes(expr)).containsOnlyKeys("name", "quoted-key");
        assertThat(HclValues.attributes(expr).get("name").stringValue()).contains("vpc");
        assertThat(HclValues.number(HclValues.attributes(expr).get("quoted-key"))).contains(2L);
    }

    @Test
    void parse_multilineObject_splitsOnNewlines() {
        HclExpression expr = parser.parse("{\n  a = 1\n  b = 2\n}");

        assertThat(HclValues.attributes(expr)).containsOnlyKeys("a", "b");
    }

    @Test
    void parse_conditional_returnsBranches() {
        HclExpression expr = parser.parse("var.enabled ? \"on\" : \"off\"");

        assertThat(expr).isInstanceOf(Conditional.class);
        Conditional conditional = (Conditional) expr;
        assertThat(conditional.condition()).isInstanceOf(Reference.class);
        assertThat(conditional.trueResult().stringValue()).contains("on");
        assertThat(conditional.falseResult().stringValue()).contains("off");
    }

    @Test
    void parse_forExpression_capturesVariablesAndCollection() {
        HclExpression expr = parser.parse("[for s in var.names : upper(s)]");

        assertThat(expr).isInstanceOf(ForExpr.class);
        ForExpr forExpr = (ForExpr) expr;
        assertThat(forExpr.keyVar()).isNull();
        assertThat(forExpr.valueVar()).isEqualTo("s");
        assertThat(forExpr.objectResult()).isFalse();
        assertThat(forExpr.collection()).isInstanceOf(Reference.class);
        assertThat(forExpr.valueExpr()).isInstanceOf(FunctionCall.class);
    }

    @Test
    void parse_objectForExpression_capturesKeyExpression() {
        HclExpression expr = parser.parse("{for k, v in local.map : k => v if v != null}");

        ForExpr forExpr = (ForExpr) expr;
        assertThat(forExpr.keyVar()).isEqualTo("k");
        assertThat(forExpr.valueVar()).isEqualTo("v");
        assertThat(forExpr.objectResult()).isTrue();
        assertThat(forExpr.keyExpr()).isInstanceOf(Reference.class);
        assertThat(forExpr.condition()).isNotNull();
    }

    @Test
    void parse_indexAccess_returnsIndex() {
        HclExpression expr = parser.parse("local.map[\"key\"]");

        assertThat(expr).isInstanceOf(Index.class);
        assertThat(((Index) expr).key().stringValue()).contains("key");
    }

    @Test
    void parse_splat_returnsSplat() {
        HclExpression expr = parser.parse("var.subnets[*].id");

        assertThat(expr).isInstanceOf(Splat.class);
        assertThat(((Splat) expr).source()).isInstanceOf(Reference.class);
    }

    @Test
    void parse_arithmetic_isKeptAsOpaqueLiteral() {
        HclExpression expr = parser.parse("local.a + local.b");

        assertThat(expr).isInstanceOf(Literal.class);
        assertThat(((Literal) expr).opaque()).isTrue();
        assertThat(HclValues.isNull(expr)).isFalse();
    }

    @Test
    void parse_comparisonInCondition_hidesNestedCallsFromExtraction() {
        HclExpression expr = parser.parse("length(local.subnets) > 2 ? \"multi\" : \"single\"");

        Conditional conditional = (Conditional) expr;
        assertThat(conditional.condition()).isInstanceOf(Literal.class);
        assertThat(((Literal) conditional.condition()).opaque()).isTrue();
        assertThat(new FunctionCallValidator().extractFunctionCalls(expr)).isEmpty();
    }

    @Test
    void parse_withoutRaw_returnsEmptyRawText() {
        ExpressionParser noRaw = new ExpressionParser(false, ExpressionParser.DEFAULT_MAX_DEPTH);

        HclExpression expr = noRaw.parse("dependency.vpc.outputs.id");

        assertThat(expr.raw()).isEmpty();
        assertThat(((Reference) expr).parts()).containsExactly("dependency", "vpc", "outputs", "id");
    }

    @Test
    void parse_nestingBeyondMaxDepth_keepsRawText() {
        // Given
        ExpressionParser shallow = new ExpressionParser(true, 1);

        // When
        HclExpression expr = shallow.parse("[[[1]]]");

        // Then
        ArrayExpr outer = (ArrayExpr) expr;
        ArrayExpr middle = (ArrayExpr) outer.elements().get(0);
        Literal innermost = (Literal) middle.elements().get(0);
        assertThat(innermost.opaque()).isTrue();
        assertThat(innermost.value()).isEqualTo("[1]");
    }

    @Test
    void constructor_zeroDepth_throwsException() {
        assertThatThrownBy(() -> new ExpressionParser(true, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDepth");
    }
}
