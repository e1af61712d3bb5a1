package com.tgarchitect.core.expression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reference found inside an expression.
 *
 * @param type root namespace
 * @param parts traversal parts after the namespace keyword (all parts for {@link ReferenceType#RESOURCE})
 * @param attribute attribute path after the referenced object, or null
 * @param raw source text
 */
public record ExtractedReference(
    ReferenceType type,
    List<String> parts,
    String attribute,
    String raw
) {
    public ExtractedReference {
        Objects.requireNonNull(type, "type must not be null");
        parts = parts == null ? List.of() : List.copyOf(parts);
        raw = raw == null ? "" : raw;
    }

    /**
     * Returns the referenced object name ({@code vpc} for {@code dependency.vpc.outputs.id}).
     *
     * @return name, or empty when the reference has no parts
     */
    public Optional<String> name() {
        return parts.isEmpty() ? Optional.empty() : Optional.of(parts.get(0));
    }

    /**
     * Returns the output key of a {@code dependency.<name>.outputs.<key>} reference.
     *
     * @return output key, or empty for other references
     */
    public Optional<String> dependencyOutput() {
        if (type != ReferenceType.DEPENDENCY || parts.size() < 3 || !"outputs".equals(parts.get(1))) {
            return Optional.empty();
        }
        return Optional.of(parts.get(2));
    }
}
