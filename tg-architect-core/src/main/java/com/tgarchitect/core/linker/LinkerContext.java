package com.tgarchitect.core.linker;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Inputs for resolving the source of one configuration file.
 *
 * @param scanId scan identifier
 * @param configPath path of the configuration file declaring the source
 * @param repositoryRoot repository root
 * @param moduleMap known module directories (absolute and repository relative) to node ids,
 *                  as built by {@link TerraformLinker#buildModuleMap}
 */
public record LinkerContext(
    String scanId,
    Path configPath,
    Path repositoryRoot,
    Map<String, String> moduleMap
) {
    public LinkerContext {
        Objects.requireNonNull(scanId, "scanId must not be null");
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(repositoryRoot, "repositoryRoot must not be null");
        configPath = configPath.toAbsolutePath().normalize();
        repositoryRoot = repositoryRoot.toAbsolutePath().normalize();
        moduleMap = moduleMap == null ? Map.of() : Map.copyOf(moduleMap);
    }

    public Path configDir() {
        Path parent = configPath.getParent();
        return parent != null ? parent : configPath;
    }

    /**
     * Context for a configuration in another directory, sharing scan and module map.
     *
     * @param newConfigPath configuration file path
     * @return new context
     */
    public LinkerContext withConfigPath(Path newConfigPath) {
        return new LinkerContext(scanId, newConfigPath, repositoryRoot, moduleMap);
    }
}
