package com.tgarchitect.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading tg-architect configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code tg-architect.yaml} into {@link TerragruntConfig}.
 * If the config file is missing or invalid, returns {@link TerragruntConfig#defaults()}.
 * Range checks are not done here; callers run {@link TerragruntConfig#validateOrThrow()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TerragruntConfig config = ConfigLoader.load(Paths.get("tg-architect.yaml"));
 * int depth = config.parser().maxIncludeDepth();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Default configuration file name.
     */
    public static final String DEFAULT_FILE_NAME = "tg-architect.yaml";

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code tg-architect.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static TerragruntConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return TerragruntConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return TerragruntConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            TerragruntConfig config = YAML_MAPPER.readValue(configPath.toFile(), TerragruntConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return TerragruntConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return TerragruntConfig.defaults();
        }
    }
}
