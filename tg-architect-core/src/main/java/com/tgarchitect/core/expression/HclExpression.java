package com.tgarchitect.core.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed HCL expression.
 *
 * <p>Ten variants cover every construct Terragrunt files use. Expressions are never
 * evaluated; they are kept as a tree so that function calls, references and literal
 * values can be inspected by later pipeline stages.
 *
 * <p>{@link #children()} returns the direct sub-expressions of a node in source order,
 * which is all a tree walker needs:
 * <pre>{@code
 * void walk(HclExpression expr) {
 *     visit(expr);
 *     expr.children().forEach(this::walk);
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public sealed interface HclExpression permits
        HclExpression.Literal,
        HclExpression.Reference,
        HclExpression.FunctionCall,
        HclExpression.Template,
        HclExpression.ForExpr,
        HclExpression.Conditional,
        HclExpression.Index,
        HclExpression.Splat,
        HclExpression.ObjectExpr,
        HclExpression.ArrayExpr {

    /**
     * Kind discriminator, mainly for logging and serialization.
     *
     * @return expression kind
     */
    ExpressionKind kind();

    /**
     * Original source text, or an empty string when raw text capture is disabled.
     *
     * @return raw text
     */
    String raw();

    /**
     * Direct sub-expressions in source order.
     *
     * @return children, never null
     */
    List<HclExpression> children();

    /**
     * Returns the string value if this is a string literal.
     *
     * @return string value, or empty
     */
    default Optional<String> stringValue() {
        if (this instanceof Literal literal && literal.value() instanceof String s) {
            return Optional.of(s);
        }
        return Optional.empty();
    }

    /**
     * Literal value: string, {@link Long}, {@link Double}, {@link Boolean} or {@code null}.
     *
     * <p>Text the grammar does not understand (operators, attribute access after an index)
     * is kept as a string literal holding the raw text, with {@code opaque} set.
     */
    record Literal(Object value, String raw, boolean opaque) implements HclExpression {
        public Literal {
            raw = raw == null ? "" : raw;
        }

        public Literal(Object value, String raw) {
            this(value, raw, false);
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.LITERAL;
        }

        @Override
        public List<HclExpression> children() {
            return List.of();
        }

        public boolean isNull() {
            return value == null;
        }
    }

    /**
     * Dotted traversal such as {@code local.env} or {@code dependency.vpc.outputs.vpc_id}.
     */
    record Reference(List<String> parts, String raw) implements HclExpression {
        public Reference {
            parts = List.copyOf(parts);
            raw = raw == null ? "" : raw;
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.REFERENCE;
        }

        @Override
        public List<HclExpression> children() {
            return List.of();
        }

        public String root() {
            return parts.isEmpty() ? "" : parts.get(0);
        }

        public String path() {
            return String.join(".", parts);
        }
    }

    record FunctionCall(String name, List<HclExpression> args, String raw) implements HclExpression {
        public FunctionCall {
            Objects.requireNonNull(name, "name must not be null");
            args = args == null ? List.of() : List.copyOf(args);
            raw = raw == null ? "" : raw;
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.FUNCTION;
        }

        @Override
        public List<HclExpression> children() {
            return args;
        }
    }

    /**
     * String template; literal chunks are {@link Literal} parts.
     */
    record Template(List<HclExpression> parts, String raw) implements HclExpression {
        public Template {
            parts = parts == null ? List.of() : List.copyOf(parts);
            raw = raw == null ? "" : raw;
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.TEMPLATE;
        }

        @Override
        public List<HclExpression> children() {
            return parts;
        }
    }

    /**
     * {@code [for v in coll : expr if cond]} or {@code {for k, v in coll : kexpr => vexpr}}.
     *
     * @param keyVar key variable, null when only a value variable is declared
     * @param valueVar value variable
     * @param collection iterated collection
     * @param keyExpr key expression, only for object results
     * @param valueExpr value expression
     * @param condition filter, may be null
     * @param objectResult true for the {@code {}} form
     * @param raw raw text
     */
    record ForExpr(
        String keyVar,
        String valueVar,
        HclExpression collection,
        HclExpression keyExpr,
        HclExpression valueExpr,
        HclExpression condition,
        boolean objectResult,
        String raw
    ) implements HclExpression {
        public ForExpr {
            Objects.requireNonNull(valueVar, "valueVar must not be null");
            Objects.requireNonNull(collection, "collection must not be null");
            Objects.requireNonNull(valueExpr, "valueExpr must not be null");
            raw = raw == null ? "" : raw;
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.FOR;
        }

        @Override
        public List<HclExpression> children() {
            List<HclExpression> result = new ArrayList<>(4);
            result.add(collection);
            if (keyExpr != null) {
                result.add(keyExpr);
            }
            result.add(valueExpr);
            if (condition != null) {
                result.add(condition);
            }
            return Collections.unmodifiableList(result);
        }
    }

    record Conditional(
        HclExpression condition,
        HclExpression trueResult,
        HclExpression falseResult,
        String raw
    ) implements HclExpression {
        public Conditional {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(trueResult, "trueResult must not be null");
            Objects.requireNonNull(falseResult, "falseResult must not be null");
            raw = raw == null ? "" : raw;
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.CONDITIONAL;
        }

        @Override
        public List<HclExpression> children() {
            return List.of(condition, trueResult, falseResult);
        }
    }

    record Index(HclExpression collection, HclExpression key, String raw) implements HclExpression {
        public Index {
            Objects.requireNonNull(collection, "collection must not be null");
            Objects.requireNonNull(key, "key must not be null");
            raw = raw == null ? "" : raw;
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.INDEX;
        }

        @Override
        public List<HclExpression> children() {
            return List.of(collection, key);
        }
    }

    /**
     * {@code source[*].each} or {@code source.*.each}; {@code each} may be null.
     */
    record Splat(HclExpression source, HclExpression each, String raw) implements HclExpression {
        public Splat {
            Objects.requireNonNull(source, "source must not be null");
            raw = raw == null ? "" : raw;
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.SPLAT;
        }

        @Override
        public List<HclExpression> children() {
            return each == null ? List.of(source) : List.of(source, each);
        }
    }

    /**
     * Object constructor; attribute order follows the source.
     */
    record ObjectExpr(Map<String, HclExpression> attributes, String raw) implements HclExpression {
        public ObjectExpr {
            attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            raw = raw == null ? "" : raw;
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.OBJECT;
        }

        @Override
        public List<HclExpression> children() {
            return List.copyOf(attributes.values());
        }
    }

    record ArrayExpr(List<HclExpression> elements, String raw) implements HclExpression {
        public ArrayExpr {
            elements = elements == null ? List.of() : List.copyOf(elements);
            raw = raw == null ? "" : raw;
        }

        @Override
        public ExpressionKind kind() {
            return ExpressionKind.ARRAY;
        }

        @Override
        public List<HclExpression> children() {
            return elements;
        }
    }
}
