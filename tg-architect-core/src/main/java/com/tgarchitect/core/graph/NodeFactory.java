package com.tgarchitect.core.graph;

import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.error.ValidationException;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.ResolvedDependency;
import com.tgarchitect.core.model.ResolvedInclude;
import com.tgarchitect.core.model.SourceLocation;
import com.tgarchitect.core.model.TerragruntFile;
import com.tgarchitect.core.model.block.DependenciesBlock;
import com.tgarchitect.core.model.block.DependencyBlock;
import com.tgarchitect.core.model.block.GenerateBlock;
import com.tgarchitect.core.model.block.IncludeBlock;
import com.tgarchitect.core.model.block.InputsBlock;
import com.tgarchitect.core.model.block.TerraformBlock;
import com.tgarchitect.core.model.block.TerragruntBlock;
import com.tgarchitect.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns parsed {@link TerragruntFile}s into {@link GraphNode}s and relationship hints.
 *
 * <p>Node ids are {@code prefix + IdGenerator.generate(scanId, relativePath)} unless random
 * ids are requested, in which case a UUID follows the prefix.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * NodeFactoryOptions options = NodeFactoryOptions.of("scan-1", repoRoot);
 * NodeBatchResult result = NodeFactory.createTerragruntConfigNodesWithRelationships(files, options);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class NodeFactory {

    private static final Logger log = LoggerFactory.getLogger(NodeFactory.class);

    /** Name given to a configuration that sits at the filesystem root. */
    public static final String ROOT_NAME = "root";

    private NodeFactory() {
        // Utility class
    }

    // ==================== Single node ====================

    /**
     * Creates the configuration node for one file.
     *
     * @param file parsed file
     * @param options factory options
     * @return graph node
     * @throws ValidationException if the options are invalid
     */
    public static GraphNode createTerragruntConfigNode(TerragruntFile file, NodeFactoryOptions options) {
        validateFactoryOptions(options);
        Path absolute = absolutePath(file.path());
        String relativePath = relativePath(options.repositoryRoot(), absolute);

        List<String> dependencyNames = file.dependencyBlocks().stream()
            .map(DependencyBlock::name)
            .toList();
        int dependencyCount = dependencyNames.size() + file.blocksOf(DependenciesBlock.class).stream()
            .mapToInt(block -> block.pathExpressions().size())
            .sum();
        List<String> includeLabels = file.includeBlocks().stream().map(IncludeBlock::label).toList();
        List<String> generateBlocks = file.blocksOf(GenerateBlock.class).stream()
            .map(GenerateBlock::label)
            .toList();
        int inputCount = file.blocksOf(InputsBlock.class).stream()
            .mapToInt(block -> block.values().size())
            .sum();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("scanId", options.scanId());
        metadata.put("absolutePath", absolute.toString());
        metadata.put("blockCount", file.blocks().size());
        metadata.put("errorCount", file.errors().size());
        metadata.put("inputCount", inputCount);
        metadata.put("generateBlocks", generateBlocks);
        metadata.put("dependencyNames", dependencyNames);
        metadata.put("includeLabels", includeLabels);
        metadata.put("encoding", file.encoding());
        metadata.put("size", file.size());
        file.remoteStateBlock()
            .filter(block -> block.hasBackend())
            .ifPresent(block -> metadata.put("remoteStateBackend", block.backend()));

        String locationFile = options.includeAbsolutePaths() ? absolute.toString() : relativePath;
        GraphNode node = new GraphNode(
            nodeId(options, relativePath),
            NodeType.TG_CONFIG,
            deriveNodeName(absolute),
            nodeLocation(locationFile, file.blocks()),
            dependencyCount,
            file.includeBlocks().size(),
            file.remoteStateBlock().isPresent(),
            file.terraformBlock().flatMap(TerraformBlock::sourceString).orElse(null),
            metadata);
        log.debug("Created node {} for {}", node.id(), relativePath);
        return node;
    }

    // ==================== Batch ====================

    /**
     * Creates nodes for every file, then derives include and dependency hints between them.
     *
     * <p>A file that cannot be converted is reported in {@link NodeBatchResult#errors()} and the
     * remaining files are still processed.
     *
     * @param files parsed and resolved files
     * @param options factory options
     * @return nodes, hints and the path to id map
     * @throws ValidationException if the options are invalid
     */
    public static NodeBatchResult createTerragruntConfigNodesWithRelationships(
            Collection<TerragruntFile> files, NodeFactoryOptions options) {
        validateFactoryOptions(options);
        List<GraphNode> nodes = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();
        Map<String, String> pathToId = new LinkedHashMap<>();
        // Files whose node could not be created are absent.
        Map<TerragruntFile, String> nodeIds = new IdentityHashMap<>();

        for (TerragruntFile file : files) {
            try {
                GraphNode node = createTerragruntConfigNode(file, options);
                pathToId.put(absolutePath(file.path()).toString(), node.id());
                nodes.add(node);
                nodeIds.put(file, node.id());
            } catch (RuntimeException e) {
                log.warn("Failed to create node for {}: {}", file.path(), e.getMessage());
                errors.add(ParseError.error(
                    ErrorCode.VALIDATION_FAILED,
                    "Failed to create node: " + e.getMessage(),
                    SourceLocation.at(file.path(), 1, 1)));
            }
        }

        List<DependencyHint> dependencyHints = new ArrayList<>();
        List<IncludeHint> includeHints = new ArrayList<>();
        for (TerragruntFile file : files) {
            String sourceId = nodeIds.get(file);
            if (sourceId == null) {
                continue;
            }
            for (ResolvedDependency dependency : file.dependencies()) {
                if (dependency.isResolved()) {
                    dependencyHints.add(new DependencyHint(
                        sourceId,
                        dependency.resolvedPath(),
                        pathToId.get(dependency.resolvedPath()),
                        dependency.name(),
                        true));
                }
            }
            for (ResolvedInclude include : file.includes()) {
                if (include.isResolved()) {
                    includeHints.add(new IncludeHint(
                        sourceId,
                        include.resolvedPath(),
                        pathToId.get(include.resolvedPath()),
                        include.label(),
                        include.mergeStrategy(),
                        include.exposeAsVariable(),
                        true));
                }
            }
        }

        log.debug("Created {} nodes, {} dependency hints, {} include hints",
            nodes.size(), dependencyHints.size(), includeHints.size());
        return new NodeBatchResult(nodes, dependencyHints, includeHints, pathToId, errors);
    }

    // ==================== Helpers ====================

    /**
     * Checks the factory options.
     *
     * @param options options to check
     * @throws ValidationException if the scan id is blank or the repository root is not absolute
     */
    public static void validateFactoryOptions(NodeFactoryOptions options) {
        if (options.scanId().isBlank()) {
            throw new ValidationException("scanId", "scanId must not be blank");
        }
        if (!options.repositoryRoot().isAbsolute()) {
            throw new ValidationException("repositoryRoot",
                "repositoryRoot must be absolute: " + options.repositoryRoot());
        }
    }

    /**
     * Derives the node name from the directory holding the file.
     *
     * @param filePath configuration file path
     * @return parent directory name, or {@code root}
     */
    public static String deriveNodeName(Path filePath) {
        Path parent = filePath.getParent();
        if (parent == null || parent.getFileName() == null) {
            return ROOT_NAME;
        }
        String name = parent.getFileName().toString();
        return name.isEmpty() || ".".equals(name) ? ROOT_NAME : name;
    }

    static String relativePath(Path repositoryRoot, Path absolute) {
        Path root = repositoryRoot.toAbsolutePath().normalize();
        String relative = absolute.startsWith(root)
            ? root.relativize(absolute).toString()
            : absolute.toString();
        return relative.replace('\\', '/');
    }

    private static String nodeId(NodeFactoryOptions options, String relativePath) {
        if (options.generateRandomIds()) {
            return options.idPrefix() + UUID.randomUUID();
        }
        return options.idPrefix() + IdGenerator.generate(options.scanId(), relativePath);
    }

    private static NodeLocation nodeLocation(String file, List<TerragruntBlock> blocks) {
        int lineStart = Integer.MAX_VALUE;
        int lineEnd = 1;
        for (TerragruntBlock block : blocks) {
            SourceLocation location = block.location();
            if (location == null) {
                continue;
            }
            lineStart = Math.min(lineStart, location.line());
            lineEnd = Math.max(lineEnd, location.endLine());
        }
        return new NodeLocation(file, lineStart == Integer.MAX_VALUE ? 1 : lineStart, lineEnd);
    }

    private static Path absolutePath(String path) {
        try {
            return Path.of(path).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new ValidationException("path", "Invalid file path: " + path);
        }
    }
}
