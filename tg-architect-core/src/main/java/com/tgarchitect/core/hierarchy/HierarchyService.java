package com.tgarchitect.core.hierarchy;

import com.tgarchitect.core.config.TerragruntConfig;
import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.model.MergeStrategy;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.ResolvedDependency;
import com.tgarchitect.core.model.ResolvedInclude;
import com.tgarchitect.core.model.SourceLocation;
import com.tgarchitect.core.model.TerragruntFile;
import com.tgarchitect.core.parser.TerragruntParser;
import com.tgarchitect.core.resolver.IncludeResolver;
import com.tgarchitect.core.resolver.PathEvaluationContext;
import com.tgarchitect.core.resolver.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Works with configuration files as a hierarchy: include chains, merged configuration,
 * and the dependency graph with its execution order.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HierarchyService service = new HierarchyService(TerragruntConfig.defaults());
 * MergedConfiguration merged = service.getMergedConfiguration(Path.of("live/prod/vpc/terragrunt.hcl"));
 * DependencyGraph graph = service.buildDependencyGraph(files);
 * List<String> order = service.getExecutionOrder(graph, List.of(target));
 * }</pre>
 *
 * <p>Parsed files are cached per instance until {@link #clearCache()}.
 *
 * @since 1.0.0
 */
public class HierarchyService {

    private static final Logger log = LoggerFactory.getLogger(HierarchyService.class);

    private final TerragruntParser parser;
    private final IncludeResolver resolver;
    private final int maxIncludeDepth;
    private final Map<String, TerragruntFile> parsedFiles = new ConcurrentHashMap<>();

    public HierarchyService(TerragruntConfig config) {
        this(TerragruntParser.create(config), new IncludeResolver(config.parser()), config.parser().maxIncludeDepth());
    }

    public HierarchyService(TerragruntParser parser, IncludeResolver resolver, int maxIncludeDepth) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.maxIncludeDepth = maxIncludeDepth;
    }

    // ==================== Hierarchy ====================

    /**
     * Follows the include chain of a file upward.
     *
     * <p>Cycles are reported as {@code CIRCULAR_INCLUDE} and chains longer than
     * {@code maxIncludeDepth} as {@code MAX_DEPTH_EXCEEDED}; in both cases the offending
     * include is not followed.
     *
     * @param file starting file
     * @return hierarchy rooted at the starting file
     */
    public HierarchyNode buildHierarchy(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path originalDir = parentOf(absolute);
        TerragruntFile parsed = load(absolute, originalDir);
        return buildNode(absolute.toString(), parsed, 0, new LinkedHashSet<>(), null, originalDir);
    }

    private HierarchyNode buildNode(
            String path,
            TerragruntFile file,
            int depth,
            Set<String> chain,
            MergeStrategy strategy,
            Path originalDir) {
        chain.add(path);
        List<HierarchyNode> parents = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();

        for (ResolvedInclude include : file.includes()) {
            labels.add(include.label());
            if (!include.isResolved()) {
                continue;
            }
            String target = include.resolvedPath();
            SourceLocation location = SourceLocation.at(path, 1, 1);
            if (chain.contains(target)) {
                List<String> members = new ArrayList<>(chain);
                List<String> cycle = new ArrayList<>(members.subList(members.indexOf(target), members.size()));
                cycle.add(target);
                errors.add(ParseError.error(ErrorCode.CIRCULAR_INCLUDE,
                    "Circular include: " + String.join(" -> ", cycle), location));
                log.warn("Circular include detected at {}", path);
                continue;
            }
            if (depth + 1 > maxIncludeDepth) {
                errors.add(ParseError.error(ErrorCode.MAX_DEPTH_EXCEEDED,
                    "Include chain exceeds maximum depth of " + maxIncludeDepth + " at " + target, location));
                continue;
            }
            TerragruntFile parentFile = load(Path.of(target), originalDir);
            parents.add(buildNode(target, parentFile, depth + 1, chain, include.mergeStrategy(), originalDir));
        }

        chain.remove(path);
        return new HierarchyNode(path, file, parents, depth, labels, strategy, errors);
    }

    // ==================== Merging ====================

    /**
     * Computes the effective configuration of a file with its ancestors merged in.
     *
     * @param file starting file
     * @return merged configuration and its trace
     */
    public MergedConfiguration getMergedConfiguration(Path file) {
        return ConfigMerger.merge(buildHierarchy(file));
    }

    // ==================== Dependency graph ====================

    /**
     * Parses and resolves files and builds their dependency graph.
     *
     * @param files configuration files
     * @return dependency graph
     */
    public DependencyGraph buildDependencyGraph(Collection<Path> files) {
        List<TerragruntFile> resolved = new ArrayList<>();
        for (Path file : files) {
            Path absolute = file.toAbsolutePath().normalize();
            resolved.add(load(absolute, parentOf(absolute)));
        }
        return buildDependencyGraphFromFiles(resolved);
    }

    /**
     * Builds the dependency graph of already resolved files. An edge A to B is added for
     * every resolved include or dependency of A pointing at B.
     *
     * @param files resolved files
     * @return dependency graph
     */
    public DependencyGraph buildDependencyGraphFromFiles(Collection<TerragruntFile> files) {
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (TerragruntFile file : files) {
            String node = normalize(file.path());
            Set<String> targets = adjacency.computeIfAbsent(node, k -> new LinkedHashSet<>());
            file.includes().stream()
                .filter(ResolvedInclude::isResolved)
                .forEach(include -> targets.add(include.resolvedPath()));
            file.dependencies().stream()
                .filter(ResolvedDependency::isResolved)
                .forEach(dependency -> targets.add(dependency.resolvedPath()));
        }
        DependencyGraph graph = DependencyGraph.of(adjacency);
        graph.cycles().forEach(cycle -> log.warn(cycle.message()));
        log.debug("Dependency graph: {} nodes, {} ordered, {} cycles",
            graph.nodes().size(), graph.executionOrder().size(), graph.cycles().size());
        return graph;
    }

    /**
     * Returns the execution order restricted to the targets and their transitive dependencies.
     *
     * @param graph dependency graph
     * @param targets node ids
     * @return ordered nodes, dependencies first
     */
    public List<String> getExecutionOrder(DependencyGraph graph, Collection<String> targets) {
        Set<String> needed = graph.transitiveDependencies(targets);
        return graph.executionOrder().stream().filter(needed::contains).toList();
    }

    public List<String> getExecutionOrder(DependencyGraph graph) {
        return graph.executionOrder();
    }

    // ==================== Cache ====================

    public void clearCache() {
        parsedFiles.clear();
        parser.clearCache();
    }

    int cachedFileCount() {
        return parsedFiles.size();
    }

    private TerragruntFile load(Path path, Path originalDir) {
        TerragruntFile parsed = parsedFiles.computeIfAbsent(path.toString(), key -> parser.parseFile(path));
        Path dir = parentOf(path);
        PathEvaluationContext context = new PathEvaluationContext(
            dir,
            originalDir,
            resolver.findRepoRoot(dir).orElse(null),
            null,
            IncludeResolver.locals(parsed));
        ResolutionResult result = resolver.resolveReferences(parsed, context);
        return parsed.withResolution(result.includes(), result.dependencies(), result.errors());
    }

    private static Path parentOf(Path file) {
        Path parent = file.getParent();
        return parent == null ? file : parent;
    }

    private static String normalize(String path) {
        return Path.of(path).toAbsolutePath().normalize().toString();
    }
}
