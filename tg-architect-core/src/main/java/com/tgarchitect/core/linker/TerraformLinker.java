package com.tgarchitect.core.linker;

import com.tgarchitect.core.config.LinkerConfig;
import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.graph.GraphNode;
import com.tgarchitect.core.graph.NodeLocation;
import com.tgarchitect.core.graph.NodeType;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.SourceLocation;
import com.tgarchitect.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Links {@code terraform.source} references to module nodes.
 *
 * <p>Local sources are resolved against the declaring configuration's directory and looked
 * up in the module map, first by absolute path and then by repository relative path. External
 * sources, and local sources that match no known module, become synthetic
 * {@link NodeType#TERRAFORM_MODULE} nodes when {@code createSyntheticNodes} is enabled.
 * Synthetic node ids are derived from the scan id and the module location, so every
 * configuration referencing the same module links to the same node.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TerraformLinker linker = new TerraformLinker(config.linker());
 * Map<String, String> modules = TerraformLinker.buildModuleMap(nodes, repoRoot);
 * SourceResolution resolution = linker.resolve("../modules/vpc",
 *     new LinkerContext(scanId, configFile, repoRoot, modules));
 * }</pre>
 *
 * @since 1.0.0
 */
public class TerraformLinker {

    private static final Logger log = LoggerFactory.getLogger(TerraformLinker.class);

    /** Prefix of synthetic module node ids. */
    public static final String MODULE_ID_PREFIX = "tf-";

    private final LinkerConfig config;

    public TerraformLinker(LinkerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public TerraformLinker() {
        this(LinkerConfig.defaults());
    }

    public TerraformSourceExpression parseSource(String raw) {
        return SourceExpressionParser.parseSource(raw);
    }

    public boolean isExternal(TerraformSourceExpression source) {
        return source.isExternal();
    }

    public SourceResolution resolve(String raw, LinkerContext context) {
        return resolve(parseSource(raw), context);
    }

    /**
     * Resolves a parsed source to a target node.
     *
     * @param source parsed source
     * @param context resolution context
     * @return linked, synthetic or failed resolution
     */
    public SourceResolution resolve(TerraformSourceExpression source, LinkerContext context) {
        if (source.type() == SourceType.LOCAL) {
            return resolveLocal(source, context);
        }
        if (source.raw().isEmpty()) {
            return SourceResolution.failed(source, null, ErrorCode.SOURCE_UNRESOLVABLE, "Source is empty");
        }
        if (!config.createSyntheticNodes()) {
            return SourceResolution.failed(source, null, ErrorCode.SOURCE_UNRESOLVABLE,
                "External source " + source.raw() + " not linked: synthetic nodes are disabled");
        }
        GraphNode node = syntheticNode(source, null, context);
        return SourceResolution.synthetic(source, node, null, config.externalSourceConfidence());
    }

    private SourceResolution resolveLocal(TerraformSourceExpression source, LinkerContext context) {
        if (source.path() == null || source.path().isBlank()) {
            return SourceResolution.failed(source, null, ErrorCode.SOURCE_UNRESOLVABLE, "Local source has no path");
        }
        Path resolved;
        try {
            resolved = context.configDir().resolve(source.path()).normalize();
        } catch (InvalidPathException e) {
            return SourceResolution.failed(source, null, ErrorCode.SOURCE_UNRESOLVABLE,
                "Invalid local source path: " + source.path());
        }
        String absolute = resolved.toString();
        String id = context.moduleMap().get(absolute);
        if (id == null) {
            id = context.moduleMap().get(relative(context.repositoryRoot(), resolved));
        }
        if (id != null) {
            return SourceResolution.linked(source, id, absolute, config.localSourceConfidence());
        }
        if (!config.createSyntheticNodes()) {
            log.warn("Local source {} of {} matches no known module", source.raw(), context.configPath());
            return SourceResolution.failed(source, absolute, ErrorCode.SOURCE_UNRESOLVABLE,
                "No module found at " + absolute);
        }
        GraphNode node = syntheticNode(source, resolved, context);
        return SourceResolution.synthetic(source, node, absolute, config.localSourceConfidence());
    }

    /**
     * Follows a chain of local module references.
     *
     * <p>Each local hop resolves to a module directory; {@code nextSource} returns the source
     * declared by that directory, if any, and the chain continues from there. The chain ends
     * at an external source, a directory without a further source, or a failed resolution.
     *
     * @param raw first source
     * @param context context of the declaring configuration
     * @param nextSource module directory to the source it declares
     * @return hops, with an error when a cycle or the depth bound stopped the chain
     */
    public ChainResolution resolveChain(
            String raw, LinkerContext context, Function<Path, Optional<String>> nextSource) {
        List<SourceResolution> links = new ArrayList<>();
        List<String> visited = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        visited.add(context.configDir().toString());
        seen.add(context.configDir().toString());

        LinkerContext current = context;
        String currentRaw = raw;
        while (true) {
            if (links.size() >= config.maxRecursionDepth()) {
                return new ChainResolution(links, ParseError.error(ErrorCode.MAX_DEPTH_EXCEEDED,
                    "Module chain exceeds maximum depth of " + config.maxRecursionDepth(),
                    SourceLocation.at(context.configPath().toString(), 1, 1)));
            }
            SourceResolution resolution = resolve(currentRaw, current);
            links.add(resolution);
            if (!resolution.isSuccess()) {
                return new ChainResolution(links, ParseError.warning(resolution.errorCode(), resolution.error(),
                    SourceLocation.at(current.configPath().toString(), 1, 1)));
            }
            if (resolution.sourceType() != SourceType.LOCAL || resolution.resolvedPath() == null) {
                return new ChainResolution(links, null);
            }

            Path moduleDir = Path.of(resolution.resolvedPath());
            visited.add(moduleDir.toString());
            if (!seen.add(moduleDir.toString())) {
                return new ChainResolution(links, ParseError.error(ErrorCode.SOURCE_CIRCULAR_REFERENCE,
                    "Circular module reference: " + String.join(" -> ", visited),
                    SourceLocation.at(context.configPath().toString(), 1, 1)));
            }
            Optional<String> next = nextSource.apply(moduleDir);
            if (next.isEmpty()) {
                return new ChainResolution(links, null);
            }
            current = current.withConfigPath(moduleDir.resolve("terragrunt.hcl"));
            currentRaw = next.get();
        }
    }

    /**
     * Indexes nodes by the module directory they stand for.
     *
     * <p>Configuration nodes are keyed by their directory, synthetic module nodes by their
     * resolved path. Both the absolute and the repository relative form are added.
     *
     * @param nodes known nodes
     * @param repositoryRoot repository root
     * @return directory to node id
     */
    public static Map<String, String> buildModuleMap(Collection<GraphNode> nodes, Path repositoryRoot) {
        Path root = repositoryRoot.toAbsolutePath().normalize();
        Map<String, String> map = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            Optional<Path> dir = moduleDirectory(node);
            if (dir.isEmpty()) {
                continue;
            }
            map.putIfAbsent(dir.get().toString(), node.id());
            map.putIfAbsent(relative(root, dir.get()), node.id());
        }
        return map;
    }

    private static Optional<Path> moduleDirectory(GraphNode node) {
        try {
            if (node.type() == NodeType.TG_CONFIG) {
                return node.metadataString("absolutePath")
                    .map(Path::of)
                    .map(Path::getParent);
            }
            return node.metadataString("resolvedPath").map(Path::of);
        } catch (InvalidPathException e) {
            log.debug("Ignoring node {} with invalid path: {}", node.id(), e.getMessage());
            return Optional.empty();
        }
    }

    // ==================== Synthetic nodes ====================

    private GraphNode syntheticNode(TerraformSourceExpression source, Path resolved, LinkerContext context) {
        String key = resolved != null ? resolved.toString() : source.raw();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("synthetic", true);
        metadata.put("scanId", context.scanId());
        metadata.put("sourceExpression", source.raw());
        metadata.put("sourceType", source.type().wireName());
        if (resolved != null) {
            metadata.put("resolvedPath", resolved.toString());
        }
        putIfPresent(metadata, "gitRef", source.ref());
        putIfPresent(metadata, "versionConstraint", source.version());
        putIfPresent(metadata, "registryAddress", source.registryAddress());
        putIfPresent(metadata, "bucket", source.bucket());
        putIfPresent(metadata, "subdirectory", source.subdirectory());

        String file = resolved != null ? relative(context.repositoryRoot(), resolved) : source.raw();
        return new GraphNode(
            MODULE_ID_PREFIX + IdGenerator.generate(context.scanId(), key),
            NodeType.TERRAFORM_MODULE,
            moduleName(source),
            new NodeLocation(file.isEmpty() ? "." : file, 1, 1),
            0,
            0,
            false,
            source.raw(),
            metadata);
    }

    static String moduleName(TerraformSourceExpression source) {
        switch (source.type()) {
            case LOCAL:
                return lastSegment(source.path()).orElse("unknown-local");
            case REGISTRY:
                if (source.registryAddress() != null) {
                    String[] parts = source.registryAddress().split("/");
                    return parts.length >= 2 ? parts[1] : source.registryAddress();
                }
                return "unknown-registry";
            case GIT:
                if (source.subdirectory() != null) {
                    return lastSegment(source.subdirectory()).orElse("unknown-git");
                }
                return lastSegment(source.url())
                    .map(name -> name.endsWith(".git") ? name.substring(0, name.length() - 4) : name)
                    .orElse("unknown-git");
            case S3:
            case GCS:
                if (source.bucket() != null) {
                    return source.subdirectory() != null
                        ? source.bucket() + "/" + source.subdirectory()
                        : source.bucket();
                }
                return "unknown-" + source.type().wireName();
            case HTTP:
                return lastSegment(source.url()).orElse("unknown-http");
            default:
                return "unknown-module";
        }
    }

    private static Optional<String> lastSegment(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf(':'));
        String segment = trimmed.substring(slash + 1);
        return segment.isEmpty() || ".".equals(segment) || "..".equals(segment)
            ? Optional.empty()
            : Optional.of(segment);
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, String value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }

    private static String relative(Path root, Path path) {
        if (!path.startsWith(root)) {
            return path.toString();
        }
        return root.relativize(path).toString().replace('\\', '/');
    }
}
