package com.tgarchitect.core.model.block;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.model.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level construct without a dedicated type.
 *
 * <p>An attribute such as {@code prevent_destroy = true} becomes a generic block whose
 * single attribute is named after the keyword. A block such as {@code engine "x" { ... }}
 * keeps its labels and attributes.
 *
 * @param keyword top-level keyword
 * @param labels block labels, empty for attributes
 * @param attributes attributes
 * @param attributeStyle true for {@code keyword = expr}
 * @param location location
 * @param raw raw text
 */
public record GenericBlock(
    String keyword,
    List<String> labels,
    Map<String, HclExpression> attributes,
    boolean attributeStyle,
    SourceLocation location,
    String raw
) implements TerragruntBlock {

    public GenericBlock {
        keyword = keyword == null ? "" : keyword;
        labels = labels == null ? List.of() : List.copyOf(labels);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        raw = raw == null ? "" : raw;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.GENERIC;
    }

    /**
     * Value of an attribute-style construct.
     *
     * @return the assigned expression, empty for labeled blocks
     */
    public Optional<HclExpression> value() {
        return attributeStyle ? Optional.ofNullable(attributes.get(keyword)) : Optional.empty();
    }
}
