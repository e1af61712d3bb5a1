package com.tgarchitect.core.expression;

import com.tgarchitect.core.expression.HclExpression.FunctionCall;
import com.tgarchitect.core.model.ParseError;

import java.util.List;
import java.util.Objects;

/**
 * Function call found somewhere inside an expression tree.
 *
 * @param call the call node
 * @param definition catalog entry, null for functions that are not Terragrunt builtins
 * @param errors findings for this call alone
 * @param argumentReferences references used in the call's arguments
 */
public record ExtractedFunctionCall(
    FunctionCall call,
    TerragruntFunction definition,
    List<ParseError> errors,
    List<ExtractedReference> argumentReferences
) {
    public ExtractedFunctionCall {
        Objects.requireNonNull(call, "call must not be null");
        errors = errors == null ? List.of() : List.copyOf(errors);
        argumentReferences = argumentReferences == null ? List.of() : List.copyOf(argumentReferences);
    }

    public String name() {
        return call.name();
    }

    public List<HclExpression> args() {
        return call.args();
    }

    public boolean isTerragruntFunction() {
        return definition != null;
    }

    public boolean isValid() {
        return errors.stream().noneMatch(ParseError::isError);
    }
}
