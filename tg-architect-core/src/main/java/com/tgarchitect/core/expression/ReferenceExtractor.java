package com.tgarchitect.core.expression;

import com.tgarchitect.core.expression.HclExpression.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects every reference in an expression tree.
 *
 * <p>All node kinds are visited through {@link HclExpression#children()}, so references in
 * function arguments, template parts, for-expression clauses, conditional branches, index
 * keys, splats, object values and array elements are all found.
 */
public final class ReferenceExtractor {

    private ReferenceExtractor() {
        // Utility class
    }

    /**
     * Extracts references in pre-order.
     *
     * @param expr expression, may be null
     * @return references, empty when none
     */
    public static List<ExtractedReference> extractReferences(HclExpression expr) {
        List<ExtractedReference> refs = new ArrayList<>();
        if (expr != null) {
            walk(expr, refs);
        }
        return refs;
    }

    /**
     * Extracts references of one namespace.
     *
     * @param expr expression
     * @param type namespace
     * @return matching references
     */
    public static List<ExtractedReference> extractReferences(HclExpression expr, ReferenceType type) {
        return extractReferences(expr).stream()
            .filter(ref -> ref.type() == type)
            .toList();
    }

    private static void walk(HclExpression expr, List<ExtractedReference> refs) {
        if (expr instanceof Reference reference) {
            refs.add(classify(reference.parts(), reference.raw()));
            return;
        }
        for (HclExpression child : expr.children()) {
            walk(child, refs);
        }
    }

    static ExtractedReference classify(List<String> parts, String raw) {
        if (parts.isEmpty()) {
            return new ExtractedReference(ReferenceType.RESOURCE, parts, null, raw);
        }
        String first = parts.get(0);
        List<String> rest = parts.subList(1, parts.size());

        return switch (first) {
            case "var" -> new ExtractedReference(ReferenceType.VAR, rest, join(rest, 1), raw);
            case "local" -> new ExtractedReference(ReferenceType.LOCAL, rest, join(rest, 1), raw);
            case "module" -> new ExtractedReference(ReferenceType.MODULE, rest, join(rest, 1), raw);
            case "dependency" -> new ExtractedReference(ReferenceType.DEPENDENCY, rest, join(rest, 1), raw);
            case "include" -> new ExtractedReference(ReferenceType.INCLUDE, rest, join(rest, 1), raw);
            case "data" -> new ExtractedReference(ReferenceType.DATA, rest, join(rest, 2), raw);
            case "each" -> new ExtractedReference(ReferenceType.EACH, rest, join(rest, 0), raw);
            case "count" -> new ExtractedReference(ReferenceType.COUNT, rest, join(rest, 0), raw);
            case "self" -> new ExtractedReference(ReferenceType.SELF, rest, join(rest, 0), raw);
            case "path" -> new ExtractedReference(ReferenceType.PATH, rest, join(rest, 0), raw);
            default -> new ExtractedReference(ReferenceType.RESOURCE, parts, join(parts, 2), raw);
        };
    }

    private static String join(List<String> parts, int from) {
        if (parts.size() <= from) {
            return null;
        }
        return String.join(".", parts.subList(from, parts.size()));
    }
}
