package com.tgarchitect.core.graph;

import com.tgarchitect.core.config.ParserConfig;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Per-scan settings for {@link NodeFactory}.
 *
 * @param scanId scan identifier stored in every node and used to derive ids
 * @param repositoryRoot absolute repository root; node locations are relative to it
 * @param idPrefix prefix of every node id
 * @param generateRandomIds random UUID ids instead of deterministic hashes
 * @param includeAbsolutePaths use absolute paths in node locations
 */
public record NodeFactoryOptions(
    String scanId,
    Path repositoryRoot,
    String idPrefix,
    boolean generateRandomIds,
    boolean includeAbsolutePaths
) {
    public NodeFactoryOptions {
        Objects.requireNonNull(scanId, "scanId must not be null");
        Objects.requireNonNull(repositoryRoot, "repositoryRoot must not be null");
        idPrefix = idPrefix == null ? ParserConfig.DEFAULT_NODE_ID_PREFIX : idPrefix;
    }

    public static NodeFactoryOptions of(String scanId, Path repositoryRoot) {
        return new NodeFactoryOptions(scanId, repositoryRoot, null, false, false);
    }

    public static NodeFactoryOptions from(ParserConfig config, String scanId, Path repositoryRoot) {
        return new NodeFactoryOptions(scanId, repositoryRoot, config.nodeIdPrefix(),
            config.generateRandomIds(), config.includeAbsolutePaths());
    }
}
