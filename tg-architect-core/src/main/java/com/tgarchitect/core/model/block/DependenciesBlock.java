package com.tgarchitect.core.model.block;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.expression.HclExpression.ArrayExpr;
import com.tgarchitect.core.model.SourceLocation;

import java.util.List;

/**
 * {@code dependencies { paths = [...] }} block.
 *
 * @param paths paths expression, an empty array when missing
 * @param location location
 * @param raw raw text
 */
public record DependenciesBlock(
    HclExpression paths,
    SourceLocation location,
    String raw
) implements TerragruntBlock {

    public DependenciesBlock {
        paths = paths == null ? new ArrayExpr(List.of(), "[]") : paths;
        raw = raw == null ? "" : raw;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.DEPENDENCIES;
    }

    /**
     * Elements of the paths array; non-array values yield a single element.
     *
     * @return path expressions
     */
    public List<HclExpression> pathExpressions() {
        return paths instanceof ArrayExpr array ? array.elements() : List.of(paths);
    }
}
