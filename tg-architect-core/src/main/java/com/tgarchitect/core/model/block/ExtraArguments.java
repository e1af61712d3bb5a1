package com.tgarchitect.core.model.block;

import com.tgarchitect.core.expression.HclExpression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code extra_arguments} inside a terraform block.
 *
 * @param name block label
 * @param commands terraform commands the arguments apply to
 * @param arguments extra CLI arguments
 * @param envVars environment variables
 * @param requiredVarFiles var files that must exist
 * @param optionalVarFiles var files used when present
 */
public record ExtraArguments(
    String name,
    List<String> commands,
    List<String> arguments,
    Map<String, HclExpression> envVars,
    List<String> requiredVarFiles,
    List<String> optionalVarFiles
) {
    public ExtraArguments {
        name = name == null ? "" : name;
        commands = commands == null ? List.of() : List.copyOf(commands);
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        envVars = envVars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(envVars));
        requiredVarFiles = requiredVarFiles == null ? List.of() : List.copyOf(requiredVarFiles);
        optionalVarFiles = optionalVarFiles == null ? List.of() : List.copyOf(optionalVarFiles);
    }
}
