package com.tgarchitect.core.model.block;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.model.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code inputs = { ... }} attribute.
 *
 * @param values input values in declaration order
 * @param location location
 * @param raw raw text
 */
public record InputsBlock(
    Map<String, HclExpression> values,
    SourceLocation location,
    String raw
) implements TerragruntBlock {

    public InputsBlock {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        raw = raw == null ? "" : raw;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.INPUTS;
    }
}
