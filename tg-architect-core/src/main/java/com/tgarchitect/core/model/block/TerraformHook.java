package com.tgarchitect.core.model.block;

import java.util.List;
import java.util.Objects;

/**
 * {@code before_hook}, {@code after_hook} or {@code error_hook} inside a terraform block.
 *
 * @param type hook type
 * @param name hook label
 * @param commands terraform commands triggering the hook
 * @param execute command line to run
 * @param runOnError whether the hook also runs after a failure
 * @param workingDir working directory, or null
 */
public record TerraformHook(
    HookType type,
    String name,
    List<String> commands,
    List<String> execute,
    boolean runOnError,
    String workingDir
) {
    public TerraformHook {
        Objects.requireNonNull(type, "type must not be null");
        name = name == null ? "" : name;
        commands = commands == null ? List.of() : List.copyOf(commands);
        execute = execute == null ? List.of() : List.copyOf(execute);
    }
}
