package com.tgarchitect.core.model.block;

import com.tgarchitect.core.model.SourceLocation;

/**
 * Top-level block of a Terragrunt configuration file.
 *
 * <p>Each variant is an immutable record. Consumers dispatch with pattern matching:
 * <pre>{@code
 * for (TerragruntBlock block : file.blocks()) {
 *     if (block instanceof DependencyBlock dependency) {
 *         log.debug("Dependency {}", dependency.name());
 *     }
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public sealed interface TerragruntBlock permits
        TerraformBlock,
        RemoteStateBlock,
        IncludeBlock,
        LocalsBlock,
        DependencyBlock,
        DependenciesBlock,
        GenerateBlock,
        InputsBlock,
        IamRoleBlock,
        RetryConfigBlock,
        GenericBlock {

    BlockKind kind();

    SourceLocation location();

    /**
     * Source text of the block, or an empty string when raw capture is disabled.
     *
     * @return raw text
     */
    String raw();
}
