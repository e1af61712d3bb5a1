package com.tgarchitect.core.model.block;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.model.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code remote_state { ... }} block.
 *
 * @param backend backend name, null when the attribute is missing
 * @param generate backend file generation settings, or null
 * @param config backend configuration
 * @param disableInit disable_init
 * @param disableDependencyOptimization disable_dependency_optimization
 * @param location location
 * @param raw raw text
 */
public record RemoteStateBlock(
    String backend,
    RemoteStateGenerate generate,
    Map<String, HclExpression> config,
    boolean disableInit,
    boolean disableDependencyOptimization,
    SourceLocation location,
    String raw
) implements TerragruntBlock {

    public RemoteStateBlock {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        raw = raw == null ? "" : raw;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.REMOTE_STATE;
    }

    public boolean hasBackend() {
        return backend != null && !backend.isBlank();
    }
}
