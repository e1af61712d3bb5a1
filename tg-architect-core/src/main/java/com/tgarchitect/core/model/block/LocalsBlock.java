package com.tgarchitect.core.model.block;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.model.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code locals { ... }} block.
 *
 * @param variables local variables in declaration order
 * @param location location
 * @param raw raw text
 */
public record LocalsBlock(
    Map<String, HclExpression> variables,
    SourceLocation location,
    String raw
) implements TerragruntBlock {

    public LocalsBlock {
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        raw = raw == null ? "" : raw;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.LOCALS;
    }
}
