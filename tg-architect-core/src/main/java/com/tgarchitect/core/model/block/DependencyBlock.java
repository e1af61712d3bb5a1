package com.tgarchitect.core.model.block;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.expression.HclValues;
import com.tgarchitect.core.model.MergeStrategy;
import com.tgarchitect.core.model.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code dependency "name" { ... }} block.
 *
 * @param name dependency name
 * @param configPath config_path expression, a null literal when missing
 * @param skipOutputs skip_outputs
 * @param mockOutputs mock_outputs
 * @param mockOutputsMergeStrategyWithState mock_outputs_merge_strategy_with_state
 * @param mockOutputsAllowedTerraformCommands mock_outputs_allowed_terraform_commands
 * @param location location
 * @param raw raw text
 */
public record DependencyBlock(
    String name,
    HclExpression configPath,
    boolean skipOutputs,
    Map<String, HclExpression> mockOutputs,
    MergeStrategy mockOutputsMergeStrategyWithState,
    List<String> mockOutputsAllowedTerraformCommands,
    SourceLocation location,
    String raw
) implements TerragruntBlock {

    public DependencyBlock {
        name = name == null ? "" : name;
        configPath = configPath == null ? HclValues.nullLiteral() : configPath;
        mockOutputs = mockOutputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(mockOutputs));
        mockOutputsMergeStrategyWithState = mockOutputsMergeStrategyWithState == null
            ? MergeStrategy.NO_MERGE
            : mockOutputsMergeStrategyWithState;
        mockOutputsAllowedTerraformCommands = mockOutputsAllowedTerraformCommands == null
            ? List.of()
            : List.copyOf(mockOutputsAllowedTerraformCommands);
        raw = raw == null ? "" : raw;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.DEPENDENCY;
    }

    public boolean hasConfigPath() {
        return !HclValues.isNull(configPath);
    }

    public boolean hasMockOutputs() {
        return !mockOutputs.isEmpty();
    }
}
