package com.tgarchitect.core.expression;

import com.tgarchitect.core.expression.HclExpression.ArrayExpr;
import com.tgarchitect.core.expression.HclExpression.Literal;
import com.tgarchitect.core.expression.HclExpression.ObjectExpr;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static value extraction from unevaluated expressions.
 *
 * <p>Only literal values are extracted; anything that would need evaluation
 * (references, function calls, templates) yields an empty result.
 */
public final class HclValues {

    private HclValues() {
        // Utility class
    }

    public static Optional<String> string(HclExpression expr) {
        return expr == null ? Optional.empty() : expr.stringValue();
    }

    public static Optional<Boolean> bool(HclExpression expr) {
        if (expr instanceof Literal literal && literal.value() instanceof Boolean b) {
            return Optional.of(b);
        }
        return Optional.empty();
    }

    /**
     * Extracts a whole number. Floating point literals are truncated.
     *
     * @param expr expression
     * @return number, or empty
     */
    public static Optional<Long> number(HclExpression expr) {
        if (expr instanceof Literal literal && literal.value() instanceof Number n) {
            return Optional.of(n.longValue());
        }
        return Optional.empty();
    }

    /**
     * Returns the string literal elements of an array expression, skipping everything else.
     *
     * @param expr expression
     * @return strings, empty if the expression is not an array
     */
    public static List<String> stringList(HclExpression expr) {
        if (!(expr instanceof ArrayExpr array)) {
            return List.of();
        }
        return array.elements().stream()
            .map(HclExpression::stringValue)
            .flatMap(Optional::stream)
            .toList();
    }

    public static Map<String, HclExpression> attributes(HclExpression expr) {
        return expr instanceof ObjectExpr object ? object.attributes() : Map.of();
    }

    /**
     * True for a missing expression or a {@code null} literal.
     *
     * @param expr expression, may be null
     * @return whether the expression carries no value
     */
    public static boolean isNull(HclExpression expr) {
        return expr == null || (expr instanceof Literal literal && literal.isNull() && !literal.opaque());
    }

    /**
     * Creates the placeholder used for absent attributes.
     *
     * @return a null literal
     */
    public static Literal nullLiteral() {
        return new Literal(null, "null");
    }
}
