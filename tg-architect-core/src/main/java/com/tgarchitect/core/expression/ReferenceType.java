package com.tgarchitect.core.expression;

/**
 * Root namespace of an {@link ExtractedReference}.
 */
public enum ReferenceType {
    /** {@code var.name} */
    VAR,
    /** {@code local.name} */
    LOCAL,
    /** {@code module.name.output} */
    MODULE,
    /** {@code data.type.name.attr} */
    DATA,
    /** {@code dependency.name.outputs.key} (Terragrunt) */
    DEPENDENCY,
    /** {@code include.label.attr} (Terragrunt, with {@code expose = true}) */
    INCLUDE,
    /** {@code each.key} / {@code each.value} */
    EACH,
    /** {@code count.index} */
    COUNT,
    /** {@code self.attr} */
    SELF,
    /** {@code path.module} and friends */
    PATH,
    /** Any other traversal, treated as {@code resource_type.name.attr} */
    RESOURCE
}
