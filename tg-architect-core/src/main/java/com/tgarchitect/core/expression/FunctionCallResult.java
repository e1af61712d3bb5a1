package com.tgarchitect.core.expression;

import com.tgarchitect.core.model.ParseError;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link FunctionCallValidator#parseFunctionCall(String)}.
 *
 * @param expression parsed expression
 * @param terragruntFunction true if the expression calls a Terragrunt builtin
 * @param definition catalog entry, null for non-builtins
 * @param errors validation findings
 */
public record FunctionCallResult(
    HclExpression expression,
    boolean terragruntFunction,
    TerragruntFunction definition,
    List<ParseError> errors
) {
    public FunctionCallResult {
        Objects.requireNonNull(expression, "expression must not be null");
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public Optional<TerragruntFunction> getDefinition() {
        return Optional.ofNullable(definition);
    }

    /**
     * True when there are no error-level findings. Warnings do not invalidate a call.
     *
     * @return validity
     */
    public boolean isValid() {
        return errors.stream().noneMatch(ParseError::isError);
    }
}
