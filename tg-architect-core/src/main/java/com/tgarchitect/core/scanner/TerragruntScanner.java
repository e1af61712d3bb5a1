package com.tgarchitect.core.scanner;

import com.tgarchitect.core.config.TerragruntConfig;
import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.graph.DependencyHint;
import com.tgarchitect.core.graph.GraphNode;
import com.tgarchitect.core.graph.NodeBatchResult;
import com.tgarchitect.core.graph.NodeFactory;
import com.tgarchitect.core.graph.NodeFactoryOptions;
import com.tgarchitect.core.graph.edge.EdgeBatchResult;
import com.tgarchitect.core.graph.edge.EdgeCreationOutcome;
import com.tgarchitect.core.graph.edge.EdgeFactory;
import com.tgarchitect.core.graph.edge.EdgeRequest;
import com.tgarchitect.core.graph.edge.TgEdgeEvidence;
import com.tgarchitect.core.hierarchy.DependencyGraph;
import com.tgarchitect.core.hierarchy.HierarchyService;
import com.tgarchitect.core.linker.LinkerContext;
import com.tgarchitect.core.linker.SourceResolution;
import com.tgarchitect.core.linker.TerraformLinker;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.SourceLocation;
import com.tgarchitect.core.model.TerragruntFile;
import com.tgarchitect.core.model.block.TerraformBlock;
import com.tgarchitect.core.parser.TerragruntFileDetector;
import com.tgarchitect.core.parser.TerragruntParser;
import com.tgarchitect.core.resolver.IncludeResolver;
import com.tgarchitect.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Scans a directory tree of Terragrunt configurations into a graph.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Discover files matching the configured patterns</li>
 *   <li>Parse and resolve each file on a fixed thread pool</li>
 *   <li>Create configuration nodes with include and dependency hints</li>
 *   <li>Create include, dependency, input and source edges</li>
 *   <li>Build the dependency graph and report cycles</li>
 * </ol>
 *
 * <p>Per-file failures become findings on that file; only an unreadable root or an invalid
 * configuration fails the whole scan.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TerragruntScanner scanner = new TerragruntScanner(TerragruntConfig.defaults());
 * ScanResult result = scanner.scan(ScanContext.of(Path.of("live")));
 * result.graph().executionOrder().forEach(System.out::println);
 * }</pre>
 *
 * @since 1.0.0
 */
public class TerragruntScanner {

    private static final Logger log = LoggerFactory.getLogger(TerragruntScanner.class);

    private final TerragruntConfig config;
    private final TerragruntParser parser;
    private final IncludeResolver resolver;
    private final HierarchyService hierarchy;
    private final TerraformLinker linker;
    private final Charset charset;

    /**
     * Creates a scanner.
     *
     * @param config configuration, validated here
     * @throws com.tgarchitect.core.error.ConfigurationException if the configuration is invalid
     */
    public TerragruntScanner(TerragruntConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null").validateOrThrow();
        this.parser = TerragruntParser.create(config);
        this.resolver = new IncludeResolver(config.parser());
        this.hierarchy = new HierarchyService(parser, resolver, config.parser().maxIncludeDepth());
        this.linker = new TerraformLinker(config.linker());
        this.charset = Charset.forName(config.parser().encoding());
    }

    public TerragruntConfig getConfig() {
        return config;
    }

    /**
     * Runs a full scan.
     *
     * @param context scan inputs
     * @return scan result, never null
     */
    public ScanResult scan(ScanContext context) {
        Objects.requireNonNull(context, "context must not be null");
        long start = System.currentTimeMillis();
        Path root = context.rootPath();
        log.info("Starting scan {} of {}", context.scanId(), root);

        if (!Files.isDirectory(root)) {
            log.error("Scan root {} is not a directory", root);
            return ScanResult.failed(context.scanId(), List.of(ParseError.error(ErrorCode.FILE_READ_ERROR,
                "Scan root is not a directory: " + root, null)));
        }

        List<Path> candidates;
        try {
            candidates = context.findFiles(config.parser());
        } catch (IOException e) {
            log.error("Cannot walk {}: {}", root, e.getMessage());
            return ScanResult.failed(context.scanId(), List.of(ParseError.error(ErrorCode.FILE_READ_ERROR,
                "Cannot walk scan root: " + e.getMessage(), null)));
        }
        log.debug("Discovered {} candidate files", candidates.size());

        ParsePhase parsed = parseAll(candidates, context);
        List<TerragruntFile> files = parsed.files();
        if (parsed.cancelled()) {
            log.warn("Scan {} cancelled after {} files", context.scanId(), files.size());
        }

        List<ParseError> findings = new ArrayList<>();
        files.forEach(file -> findings.addAll(file.errors()));

        // Nodes and hints
        NodeFactoryOptions nodeOptions = NodeFactoryOptions.from(config.parser(), context.scanId(), root);
        NodeBatchResult nodeBatch = NodeFactory.createTerragruntConfigNodesWithRelationships(files, nodeOptions);
        findings.addAll(nodeBatch.errors());

        // Sorted by node id so edges and synthetic nodes come out in a stable order
        Map<String, TerragruntFile> filesByNodeId = new TreeMap<>();
        for (TerragruntFile file : files) {
            String nodeId = nodeBatch.pathToId().get(normalize(file.path()));
            if (nodeId != null) {
                filesByNodeId.put(nodeId, file);
            }
        }

        // Edges
        EdgeFactory edgeFactory = new EdgeFactory(config.edge(), context.scanId(),
            config.parser().generateRandomIds());
        List<GraphNode> nodes = new ArrayList<>(nodeBatch.nodes());
        EdgeBatchResult edges = edgeFactory.createEdgesFromHints(
            nodeBatch.includeHints(), nodeBatch.dependencyHints(), filesByNodeId);

        Map<String, Map<String, String>> dependencyTargets = dependencyTargets(nodeBatch.dependencyHints());
        for (Map.Entry<String, TerragruntFile> entry : filesByNodeId.entrySet()) {
            Map<String, String> targets = dependencyTargets.getOrDefault(entry.getKey(), Map.of());
            if (!targets.isEmpty()) {
                edges = edges.merge(edgeFactory.createInputEdges(entry.getValue(), entry.getKey(), targets));
            }
        }

        SourcePhase sources = linkSources(filesByNodeId, nodes, edgeFactory, context);
        nodes.addAll(sources.syntheticNodes());
        edges = edges.merge(sources.edges());
        findings.addAll(sources.findings());
        edges.errors().forEach(error -> findings.add(error.toParseError()));

        // Dependency graph
        DependencyGraph graph = hierarchy.buildDependencyGraphFromFiles(files);
        graph.cycles().forEach(cycle -> findings.add(cycle.toException().toParseError()));

        List<ParseError> errors = findings.stream().filter(ParseError::isError).toList();
        List<ParseError> warnings = findings.stream().filter(error -> !error.isError()).toList();

        int withErrors = (int) files.stream().filter(TerragruntFile::hasErrors).count();
        ScanStatistics statistics = new ScanStatistics.Builder()
            .filesDiscovered(candidates.size())
            .filesScanned(files.size())
            .filesParsedSuccessfully(files.size() - withErrors)
            .filesWithErrors(withErrors)
            .filesSkipped(candidates.size() - files.size())
            .nodesCreated(nodes.size())
            .edgesCreated(edges.edges().size())
            .cyclesDetected(graph.cycles().size())
            .durationMillis(System.currentTimeMillis() - start)
            .errorCounts(countByCode(findings))
            .build();

        log.info("Scan {} finished: {}", context.scanId(), statistics.getSummary());
        return new ScanResult(context.scanId(), !parsed.cancelled(), parsed.cancelled(), files, nodes,
            edges.edges(), graph, errors, warnings, statistics);
    }

    /**
     * Parses and resolves a single file without scanning its directory.
     *
     * @param path configuration file
     * @return resolved file, never null
     */
    public TerragruntFile scanFile(Path path) {
        return resolver.resolve(parser.parseFile(path));
    }

    /**
     * Drops cached parse results.
     */
    public void clearCache() {
        hierarchy.clearCache();
    }

    // ==================== Parsing ====================

    private ParsePhase parseAll(List<Path> candidates, ScanContext context) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(context.maxConcurrency(),
            Math.max(1, candidates.size())));
        try {
            List<Future<Optional<TerragruntFile>>> futures = new ArrayList<>();
            for (Path candidate : candidates) {
                futures.add(executor.submit(() -> context.isCancelled()
                    ? Optional.<TerragruntFile>empty()
                    : parseCandidate(candidate)));
            }

            List<TerragruntFile> files = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get().ifPresent(files::add);
                } catch (ExecutionException e) {
                    Path candidate = candidates.get(i);
                    log.error("Failed to process {}: {}", candidate, e.getCause().getMessage(), e.getCause());
                    files.add(failedFile(candidate, e.getCause()));
                }
            }
            return new ParsePhase(files, context.isCancelled());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scan {} interrupted", context.scanId());
            return new ParsePhase(List.of(), true);
        } finally {
            executor.shutdownNow();
        }
    }

    private Optional<TerragruntFile> parseCandidate(Path candidate) throws IOException {
        if (!TerragruntFileDetector.TERRAGRUNT_FILE_NAME.equals(candidate.getFileName().toString())) {
            if (Files.size(candidate) > config.parser().maxFileSize()) {
                log.debug("Skipping oversized {}", candidate);
                return Optional.empty();
            }
            String content = FileUtils.readString(candidate, charset);
            if (!parser.canParse(candidate, content)) {
                log.debug("Skipping {}: not a Terragrunt configuration", candidate);
                return Optional.empty();
            }
            return Optional.of(resolver.resolve(parser.parse(content, candidate.toString())));
        }
        return Optional.of(scanFile(candidate));
    }

    private TerragruntFile failedFile(Path candidate, Throwable cause) {
        ParseError error = ParseError.error(ErrorCode.FILE_READ_ERROR,
            "Failed to process file: " + cause.getMessage(), SourceLocation.at(candidate.toString(), 1, 1));
        return new TerragruntFile(candidate.toString(), List.of(), List.of(), List.of(), List.of(error),
            config.parser().encoding(), 0);
    }

    // ==================== Sources ====================

    private SourcePhase linkSources(
            Map<String, TerragruntFile> filesByNodeId,
            List<GraphNode> nodes,
            EdgeFactory edgeFactory,
            ScanContext context) {
        Map<String, String> moduleMap = TerraformLinker.buildModuleMap(nodes, context.rootPath());
        Map<String, GraphNode> synthetic = new LinkedHashMap<>();
        List<EdgeCreationOutcome> outcomes = new ArrayList<>();
        List<ParseError> findings = new ArrayList<>();

        for (Map.Entry<String, TerragruntFile> entry : filesByNodeId.entrySet()) {
            TerragruntFile file = entry.getValue();
            Optional<TerraformBlock> terraform = file.terraformBlock();
            Optional<String> raw = terraform.flatMap(TerraformBlock::sourceString);
            if (raw.isEmpty()) {
                continue;
            }
            TerraformBlock block = terraform.get();
            LinkerContext linkerContext = new LinkerContext(context.scanId(), Path.of(file.path()),
                context.rootPath(), moduleMap);
            SourceResolution resolution = linker.resolve(raw.get(), linkerContext);
            if (!resolution.isSuccess()) {
                findings.add(ParseError.warning(resolution.errorCode(), resolution.error(), block.location()));
                continue;
            }
            resolution.getSyntheticNode().ifPresent(node -> synthetic.putIfAbsent(node.id(), node));
            outcomes.add(edgeFactory.createSourcesEdge(new EdgeRequest.Sources(
                entry.getKey(),
                resolution.targetNodeId(),
                resolution.source().raw(),
                resolution.sourceType(),
                resolution.source().versionConstraint(),
                List.of(
                    TgEdgeEvidence.fromSource(block, resolution.sourceType(), edgeFactory.getConfig()),
                    TgEdgeEvidence.fromSourceResolution(block, resolution)))));
        }
        log.debug("Linked sources: {} edges, {} synthetic modules, {} unresolved",
            outcomes.size(), synthetic.size(), findings.size());
        return new SourcePhase(List.copyOf(synthetic.values()), EdgeBatchResult.fromOutcomes(outcomes), findings);
    }

    // ==================== Helpers ====================

    private static Map<String, Map<String, String>> dependencyTargets(List<DependencyHint> hints) {
        Map<String, Map<String, String>> targets = new HashMap<>();
        for (DependencyHint hint : hints) {
            if (hint.targetId() != null && !hint.dependencyName().isEmpty()) {
                targets.computeIfAbsent(hint.sourceId(), k -> new HashMap<>())
                    .put(hint.dependencyName(), hint.targetId());
            }
        }
        return targets;
    }

    private static Map<String, Integer> countByCode(List<ParseError> findings) {
        Map<String, Integer> counts = new TreeMap<>();
        findings.forEach(finding -> counts.merge(finding.code().name(), 1, Integer::sum));
        return counts;
    }

    private static String normalize(String path) {
        return Path.of(path).toAbsolutePath().normalize().toString();
    }

    private record ParsePhase(List<TerragruntFile> files, boolean cancelled) {
    }

    private record SourcePhase(List<GraphNode> syntheticNodes, EdgeBatchResult edges, List<ParseError> findings) {
    }
}
