package com.tgarchitect.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tgarchitect.core.error.ConfigurationException;

import java.util.List;

/**
 * Root configuration passed to every pipeline component.
 *
 * <p>Built once per run, in increasing precedence: defaults, {@code tg-architect.yaml}
 * ({@link ConfigLoader}), environment ({@link EnvironmentConfigLoader}) and explicit
 * overrides such as CLI flags. Components never read the environment themselves.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * parser:
 *   maxIncludeDepth: 5
 * edge:
 *   maxEvidencePerEdge: 5
 * linker:
 *   createSyntheticNodes: false
 * }</pre>
 *
 * @param parser parser settings
 * @param edge edge factory settings
 * @param linker source linker settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TerragruntConfig(
    @JsonProperty("parser") ParserConfig parser,
    @JsonProperty("edge") EdgeConfig edge,
    @JsonProperty("linker") LinkerConfig linker
) {
    public TerragruntConfig {
        parser = parser == null ? ParserConfig.defaults() : parser;
        edge = edge == null ? EdgeConfig.defaults() : edge;
        linker = linker == null ? LinkerConfig.defaults() : linker;
    }

    /**
     * Creates the default configuration.
     *
     * @return defaults
     */
    public static TerragruntConfig defaults() {
        return new TerragruntConfig(null, null, null);
    }

    public TerragruntConfig withParser(ParserConfig newParser) {
        return new TerragruntConfig(newParser, edge, linker);
    }

    public TerragruntConfig withEdge(EdgeConfig newEdge) {
        return new TerragruntConfig(parser, newEdge, linker);
    }

    public TerragruntConfig withLinker(LinkerConfig newLinker) {
        return new TerragruntConfig(parser, edge, newLinker);
    }

    public List<ConfigValidationIssue> validate() {
        return ConfigValidator.validate(this);
    }

    public boolean isValid() {
        return validate().stream().noneMatch(ConfigValidationIssue::isError);
    }

    /**
     * Validates and fails fast.
     *
     * @return this configuration, for chaining
     * @throws ConfigurationException if any error-level issue exists
     */
    public TerragruntConfig validateOrThrow() {
        List<ConfigValidationIssue> issues = validate();
        if (issues.stream().anyMatch(ConfigValidationIssue::isError)) {
            throw new ConfigurationException(issues);
        }
        return this;
    }
}
