package com.tgarchitect.core.model.block;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.expression.HclExpression.Template;
import com.tgarchitect.core.model.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code terraform { ... }} block.
 *
 * @param source module source expression, or null when absent
 * @param extraArguments extra_arguments blocks
 * @param beforeHooks before_hook blocks
 * @param afterHooks after_hook blocks
 * @param errorHooks error_hook blocks
 * @param includeInCopy include_in_copy globs
 * @param location location
 * @param raw raw text
 */
public record TerraformBlock(
    HclExpression source,
    List<ExtraArguments> extraArguments,
    List<TerraformHook> beforeHooks,
    List<TerraformHook> afterHooks,
    List<TerraformHook> errorHooks,
    List<String> includeInCopy,
    SourceLocation location,
    String raw
) implements TerragruntBlock {

    public TerraformBlock {
        extraArguments = extraArguments == null ? List.of() : List.copyOf(extraArguments);
        beforeHooks = beforeHooks == null ? List.of() : List.copyOf(beforeHooks);
        afterHooks = afterHooks == null ? List.of() : List.copyOf(afterHooks);
        errorHooks = errorHooks == null ? List.of() : List.copyOf(errorHooks);
        includeInCopy = includeInCopy == null ? List.of() : List.copyOf(includeInCopy);
        raw = raw == null ? "" : raw;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.TERRAFORM;
    }

    /**
     * Returns the source as text: the literal value, or the template text with
     * interpolations left unevaluated.
     *
     * @return source string, or empty when absent or not representable
     */
    public Optional<String> sourceString() {
        if (source == null) {
            return Optional.empty();
        }
        Optional<String> literal = source.stringValue();
        if (literal.isPresent()) {
            return literal;
        }
        if (source instanceof Template template && template.raw().length() >= 2 && template.raw().startsWith("\"")) {
            return Optional.of(template.raw().substring(1, template.raw().length() - 1));
        }
        return Optional.empty();
    }

    public List<TerraformHook> allHooks() {
        List<TerraformHook> hooks = new ArrayList<>(beforeHooks);
        hooks.addAll(afterHooks);
        hooks.addAll(errorHooks);
        return List.copyOf(hooks);
    }
}
