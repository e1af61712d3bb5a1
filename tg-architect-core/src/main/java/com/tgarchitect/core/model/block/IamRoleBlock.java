package com.tgarchitect.core.model.block;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.expression.HclValues;
import com.tgarchitect.core.model.SourceLocation;

/**
 * IAM role configuration, written either as {@code iam_role = "arn"} or as a block.
 *
 * @param roleArn role ARN expression
 * @param sessionDuration session duration in seconds, null when not declared
 * @param webIdentityToken web identity token, or null
 * @param location location
 * @param raw raw text
 */
public record IamRoleBlock(
    HclExpression roleArn,
    Long sessionDuration,
    HclExpression webIdentityToken,
    SourceLocation location,
    String raw
) implements TerragruntBlock {

    public IamRoleBlock {
        roleArn = roleArn == null ? HclValues.nullLiteral() : roleArn;
        raw = raw == null ? "" : raw;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.IAM_ROLE;
    }
}
