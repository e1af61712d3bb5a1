package com.tgarchitect.core.expression;

import java.util.Locale;

/**
 * Discriminator of the {@link HclExpression} variants.
 */
public enum ExpressionKind {
    LITERAL,
    REFERENCE,
    FUNCTION,
    TEMPLATE,
    FOR,
    CONDITIONAL,
    INDEX,
    SPLAT,
    OBJECT,
    ARRAY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
