package com.tgarchitect.core.model.block;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.expression.HclValues;
import com.tgarchitect.core.model.SourceLocation;

/**
 * {@code generate "label" { ... }} block.
 *
 * @param label block label
 * @param path target file expression
 * @param contents contents expression
 * @param ifExists if_exists value, null when not declared
 * @param commentPrefix comment_prefix
 * @param disableSignature disable_signature
 * @param location location
 * @param raw raw text
 */
public record GenerateBlock(
    String label,
    HclExpression path,
    HclExpression contents,
    String ifExists,
    String commentPrefix,
    boolean disableSignature,
    SourceLocation location,
    String raw
) implements TerragruntBlock {

    public static final String DEFAULT_IF_EXISTS = "overwrite_terragrunt";
    public static final String DEFAULT_COMMENT_PREFIX = "# ";

    public GenerateBlock {
        label = label == null ? "" : label;
        path = path == null ? HclValues.nullLiteral() : path;
        contents = contents == null ? HclValues.nullLiteral() : contents;
        commentPrefix = commentPrefix == null ? DEFAULT_COMMENT_PREFIX : commentPrefix;
        raw = raw == null ? "" : raw;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.GENERATE;
    }

    /**
     * Declared if_exists, or the Terragrunt default {@code overwrite_terragrunt}.
     *
     * @return effective behaviour
     */
    public String effectiveIfExists() {
        return ifExists != null ? ifExists : DEFAULT_IF_EXISTS;
    }
}
