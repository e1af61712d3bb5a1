package com.tgarchitect.core.model.block;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.expression.HclValues;
import com.tgarchitect.core.model.MergeStrategy;
import com.tgarchitect.core.model.SourceLocation;

/**
 * {@code include "label" { ... }} block.
 *
 * @param label block label, empty for an unlabeled include
 * @param path path expression, a null literal when missing
 * @param exposeAsVariable the {@code expose} attribute
 * @param mergeStrategy merge strategy, {@link MergeStrategy#NO_MERGE} by default
 * @param location location
 * @param raw raw text
 */
public record IncludeBlock(
    String label,
    HclExpression path,
    boolean exposeAsVariable,
    MergeStrategy mergeStrategy,
    SourceLocation location,
    String raw
) implements TerragruntBlock {

    public IncludeBlock {
        label = label == null ? "" : label;
        path = path == null ? HclValues.nullLiteral() : path;
        mergeStrategy = mergeStrategy == null ? MergeStrategy.NO_MERGE : mergeStrategy;
        raw = raw == null ? "" : raw;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.INCLUDE;
    }

    public boolean hasPath() {
        return !HclValues.isNull(path);
    }
}
