package com.tgarchitect.cli;

import com.tgarchitect.core.config.ConfigLoader;
import com.tgarchitect.core.config.EnvironmentConfigLoader;
import com.tgarchitect.core.config.TerragruntConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

/**
 * Resolves the configuration of a command run: YAML file, then environment overrides.
 */
final class CliConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CliConfiguration.class);

    private CliConfiguration() {
        // Utility class
    }

    /**
     * Loads and validates the configuration.
     *
     * @param projectPath scanned directory; relative config paths resolve against it
     * @param configPath config file, or null for {@code tg-architect.yaml} in the project
     * @param env environment variables
     * @return validated configuration
     * @throws com.tgarchitect.core.error.ConfigurationException if the result is invalid
     */
    static TerragruntConfig load(Path projectPath, Path configPath, Map<String, String> env) {
        Path file = configPath == null ? Path.of(ConfigLoader.DEFAULT_FILE_NAME) : configPath;
        Path absolute = file.isAbsolute() ? file : projectPath.resolve(file);

        log.debug("Loading configuration from: {}", absolute);
        TerragruntConfig config = EnvironmentConfigLoader.apply(ConfigLoader.load(absolute), env);
        return config.validateOrThrow();
    }
}
