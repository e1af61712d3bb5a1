package com.tgarchitect.core.validation;

import com.tgarchitect.core.model.block.BlockKind;

import java.util.Objects;
import java.util.Set;

/**
 * Validation rule definition.
 *
 * @param id rule identifier, e.g. {@code TG001}
 * @param description what the rule checks
 * @param severity severity of a violation
 * @param appliesTo block kinds the rule looks at
 * @param bestPractice whether the rule is switched off with best-practice checks
 */
public record ValidationRule(
    String id,
    String description,
    ValidationSeverity severity,
    Set<BlockKind> appliesTo,
    boolean bestPractice
) {
    public ValidationRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        appliesTo = appliesTo == null ? Set.of() : Set.copyOf(appliesTo);
    }
}
