package com.tgarchitect.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Applies environment variable overrides to a configuration.
 *
 * <p>The environment is passed in as a map so that nothing below the entry point reads
 * {@link System#getenv()} directly. Boolean variables are true only for {@code "true"}
 * (case-insensitive). Values that do not parse are logged and ignored.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TerragruntConfig config = EnvironmentConfigLoader.apply(ConfigLoader.load(path), System.getenv());
 * }</pre>
 */
public final class EnvironmentConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentConfigLoader.class);

    static final String PARSER_PREFIX = "TERRAGRUNT_PARSER_";
    static final String EDGE_PREFIX = "TG_EDGE_";
    static final String LINKER_PREFIX = "TG_LINKER_";

    private EnvironmentConfigLoader() {
        // Utility class
    }

    /**
     * Builds a configuration from defaults and the environment.
     *
     * @param env environment variables
     * @return configuration
     */
    public static TerragruntConfig load(Map<String, String> env) {
        return apply(TerragruntConfig.defaults(), env);
    }

    /**
     * Layers environment overrides on top of a base configuration.
     *
     * @param base configuration from defaults or YAML
     * @param env environment variables
     * @return new configuration
     */
    public static TerragruntConfig apply(TerragruntConfig base, Map<String, String> env) {
        return new TerragruntConfig(
            applyParser(base.parser(), env),
            applyEdge(base.edge(), env),
            applyLinker(base.linker(), env));
    }

    static ParserConfig applyParser(ParserConfig base, Map<String, String> env) {
        ParserConfig.Builder builder = base.toBuilder();
        readInt(env, PARSER_PREFIX + "MAX_INCLUDE_DEPTH", builder::maxIncludeDepth);
        readLong(env, PARSER_PREFIX + "MAX_FILE_SIZE", builder::maxFileSize);
        readInt(env, PARSER_PREFIX + "MAX_CACHE_SIZE", builder::maxCacheSize);
        readLong(env, PARSER_PREFIX + "CACHE_TTL_MS", builder::cacheTtlMs);
        readBoolean(env, PARSER_PREFIX + "ERROR_RECOVERY", builder::errorRecovery);
        readBoolean(env, PARSER_PREFIX + "ENABLE_CACHE", builder::enableCache);
        readBoolean(env, PARSER_PREFIX + "RESOLVE_FILE_SYSTEM", builder::resolveFileSystem);
        return builder.build();
    }

    static EdgeConfig applyEdge(EdgeConfig base, Map<String, String> env) {
        EdgeConfig[] edge = {base};
        readInt(env, EDGE_PREFIX + "DEFAULT_CONFIDENCE", v -> edge[0] = edge[0].withConfidences(v, v, v));
        readInt(env, EDGE_PREFIX + "EXPLICIT_CONFIDENCE", v -> edge[0] = edge[0].withConfidences(
            v, edge[0].inferredConfidence(), edge[0].heuristicConfidence()));
        readInt(env, EDGE_PREFIX + "INFERRED_CONFIDENCE", v -> edge[0] = edge[0].withConfidences(
            edge[0].explicitConfidence(), v, edge[0].heuristicConfidence()));
        readInt(env, EDGE_PREFIX + "HEURISTIC_CONFIDENCE", v -> edge[0] = edge[0].withConfidences(
            edge[0].explicitConfidence(), edge[0].inferredConfidence(), v));
        readInt(env, EDGE_PREFIX + "MAX_EVIDENCE", v -> {
            if (v >= 1) {
                edge[0] = edge[0].withMaxEvidencePerEdge(v);
            } else {
                log.warn("Ignoring {}MAX_EVIDENCE={}: must be at least 1", EDGE_PREFIX, v);
            }
        });
        readBoolean(env, EDGE_PREFIX + "CREATE_CONTAINMENT", v -> edge[0] = edge[0].withCreateContainmentEdges(v));
        readBoolean(env, EDGE_PREFIX + "VALIDATE_ON_CREATE", v -> edge[0] = edge[0].withValidateOnCreate(v));
        return edge[0];
    }

    static LinkerConfig applyLinker(LinkerConfig base, Map<String, String> env) {
        Boolean[] synthetic = {base.createSyntheticNodes()};
        Integer[] local = {base.localSourceConfidence()};
        Integer[] external = {base.externalSourceConfidence()};
        Integer[] recursion = {base.maxRecursionDepth()};

        readBoolean(env, LINKER_PREFIX + "CREATE_SYNTHETIC", v -> synthetic[0] = v);
        readInt(env, LINKER_PREFIX + "LOCAL_CONFIDENCE", v -> local[0] = v);
        readInt(env, LINKER_PREFIX + "EXTERNAL_CONFIDENCE", v -> external[0] = v);
        readInt(env, LINKER_PREFIX + "MAX_RECURSION", v -> {
            if (v >= 1) {
                recursion[0] = v;
            } else {
                log.warn("Ignoring {}MAX_RECURSION={}: must be at least 1", LINKER_PREFIX, v);
            }
        });
        return new LinkerConfig(synthetic[0], local[0], external[0], recursion[0]);
    }

    // ==================== Parsing ====================

    private static void readInt(Map<String, String> env, String name, Consumer<Integer> target) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return;
        }
        try {
            target.accept(Integer.parseInt(value.strip()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer", name, value);
        }
    }

    private static void readLong(Map<String, String> env, String name, Consumer<Long> target) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return;
        }
        try {
            target.accept(Long.parseLong(value.strip()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer", name, value);
        }
    }

    private static void readBoolean(Map<String, String> env, String name, Consumer<Boolean> target) {
        String value = env.get(name);
        if (value != null && !value.isBlank()) {
            target.accept("true".equalsIgnoreCase(value.strip()));
        }
    }
}
