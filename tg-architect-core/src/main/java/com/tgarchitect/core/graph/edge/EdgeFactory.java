package com.tgarchitect.core.graph.edge;

import com.tgarchitect.core.config.EdgeConfig;
import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.error.ValidationException;
import com.tgarchitect.core.expression.ExtractedReference;
import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.expression.ReferenceExtractor;
import com.tgarchitect.core.expression.ReferenceType;
import com.tgarchitect.core.graph.DependencyHint;
import com.tgarchitect.core.graph.IncludeHint;
import com.tgarchitect.core.model.MergeStrategy;
import com.tgarchitect.core.model.ResolvedDependency;
import com.tgarchitect.core.model.TerragruntFile;
import com.tgarchitect.core.model.block.BlockKind;
import com.tgarchitect.core.model.block.DependenciesBlock;
import com.tgarchitect.core.model.block.DependencyBlock;
import com.tgarchitect.core.model.block.IncludeBlock;
import com.tgarchitect.core.model.block.InputsBlock;
import com.tgarchitect.core.model.block.TerragruntBlock;
import com.tgarchitect.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Creates validated {@link TgEdge}s.
 *
 * <p>Every request is checked in a fixed order: source id, target id, self reference,
 * evidence, then the kind specific fields. A failed check yields an
 * {@link EdgeCreationOutcome} carrying an {@link EdgeCreationError}; nothing is thrown for
 * bad requests. Evidence beyond {@code maxEvidencePerEdge} is dropped, weakest first, and
 * the remaining items are scored with {@link ConfidenceAggregator}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EdgeFactory factory = new EdgeFactory(config.edge(), scanId);
 * EdgeBatchResult edges = factory.createEdgesFromHints(includeHints, dependencyHints, filesByNodeId);
 * }</pre>
 *
 * @since 1.0.0
 */
public class EdgeFactory {

    private static final Logger log = LoggerFactory.getLogger(EdgeFactory.class);

    private final EdgeConfig config;
    private final String scanId;
    private final boolean generateRandomIds;

    public EdgeFactory(EdgeConfig config, String scanId) {
        this(config, scanId, false);
    }

    /**
     * @param config confidence and evidence settings
     * @param scanId scan identifier stored in every edge
     * @param generateRandomIds random UUID ids instead of deterministic hashes
     * @throws ValidationException if the scan id is blank or the evidence limit is below 1
     */
    public EdgeFactory(EdgeConfig config, String scanId, boolean generateRandomIds) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.scanId = scanId;
        this.generateRandomIds = generateRandomIds;
        validateFactoryOptions();
    }

    private void validateFactoryOptions() {
        if (scanId == null || scanId.isBlank()) {
            throw new ValidationException("scanId", "scanId must not be blank");
        }
        if (config.maxEvidencePerEdge() < 1) {
            throw new ValidationException("maxEvidencePerEdge",
                "maxEvidencePerEdge must be at least 1, was " + config.maxEvidencePerEdge());
        }
    }

    public EdgeConfig getConfig() {
        return config;
    }

    // ==================== Single edges ====================

    /**
     * Validates the request and creates the edge.
     *
     * @param request edge fields
     * @return the edge, or the reason it was rejected
     */
    public EdgeCreationOutcome create(EdgeRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        try {
            validate(request);
            return EdgeCreationOutcome.success(build(request));
        } catch (ValidationException e) {
            log.debug("Rejected {} edge {} -> {}: {}",
                request.type().wireName(), request.sourceNodeId(), request.targetNodeId(), e.getMessage());
            return EdgeCreationOutcome.failure(new EdgeCreationError(
                request.type(), request.sourceNodeId(), request.targetNodeId(),
                e.getCode(), e.getField(), e.getMessage()));
        }
    }

    public EdgeCreationOutcome createIncludesEdge(EdgeRequest.Includes request) {
        return create(request);
    }

    public EdgeCreationOutcome createDependsOnEdge(EdgeRequest.DependsOn request) {
        return create(request);
    }

    public EdgeCreationOutcome createPassesInputEdge(EdgeRequest.PassesInput request) {
        return create(request);
    }

    public EdgeCreationOutcome createSourcesEdge(EdgeRequest.Sources request) {
        return create(request);
    }

    // ==================== Batch ====================

    /**
     * Creates every requested edge. Rejected requests do not stop the batch.
     *
     * @param requests edge requests
     * @return edges, errors and summary
     */
    public EdgeBatchResult createEdges(Collection<? extends EdgeRequest> requests) {
        List<EdgeCreationOutcome> outcomes = new ArrayList<>();
        for (EdgeRequest request : requests) {
            outcomes.add(create(request));
        }
        EdgeBatchResult result = EdgeBatchResult.fromOutcomes(outcomes);
        if (result.hasErrors()) {
            log.warn("{} of {} edge requests rejected", result.errors().size(), requests.size());
        }
        return result;
    }

    /**
     * Creates {@code tg_includes} and {@code tg_depends_on} edges from node factory hints.
     *
     * <p>Hints whose target was not scanned have no target node and are skipped. Evidence
     * comes from the declaring block in the source file when it can be found.
     *
     * @param includeHints include hints
     * @param dependencyHints dependency hints
     * @param filesByNodeId parsed file of each node
     * @return edges, errors and summary
     */
    public EdgeBatchResult createEdgesFromHints(
            Collection<IncludeHint> includeHints,
            Collection<DependencyHint> dependencyHints,
            Map<String, TerragruntFile> filesByNodeId) {
        List<EdgeRequest> requests = new ArrayList<>();
        for (IncludeHint hint : includeHints) {
            if (hint.targetId() == null) {
                log.debug("Skipping include of unscanned file {}", hint.targetPath());
                continue;
            }
            requests.add(includeRequest(hint, filesByNodeId.get(hint.sourceId()), filesByNodeId.get(hint.targetId())));
        }
        for (DependencyHint hint : dependencyHints) {
            if (hint.targetId() == null) {
                log.debug("Skipping dependency on unscanned file {}", hint.targetPath());
                continue;
            }
            requests.add(dependencyRequest(hint, filesByNodeId.get(hint.sourceId())));
        }
        return createEdges(requests);
    }

    /**
     * Creates {@code tg_passes_input} edges for every input that references
     * {@code dependency.<name>.outputs.<key>}.
     *
     * @param file parsed file owning the inputs
     * @param sourceNodeId node of that file
     * @param dependencyTargets dependency name to the node it resolves to
     * @return edges, errors and summary
     */
    public EdgeBatchResult createInputEdges(
            TerragruntFile file, String sourceNodeId, Map<String, String> dependencyTargets) {
        List<EdgeRequest> requests = new ArrayList<>();
        for (InputsBlock block : file.blocksOf(InputsBlock.class)) {
            block.values().forEach((inputName, expression) -> {
                referencedDependencies(expression).forEach((dependencyName, reference) -> {
                    String targetId = dependencyTargets.get(dependencyName);
                    if (targetId == null) {
                        return;
                    }
                    requests.add(new EdgeRequest.PassesInput(
                        sourceNodeId,
                        targetId,
                        inputName,
                        isBlank(expression.raw()) ? reference : expression.raw(),
                        true,
                        dependencyName,
                        List.of(TgEdgeEvidence.inputEvidence(inputName, expression, block.location(), config)
                            .buildUnsafe())));
                });
            });
        }
        return createEdges(requests);
    }

    // ==================== Validation ====================

    private void validate(EdgeRequest request) {
        if (isBlank(request.sourceNodeId())) {
            throw new ValidationException(ErrorCode.EDGE_MISSING_NODE, "sourceNodeId", "sourceNodeId is required");
        }
        if (isBlank(request.targetNodeId())) {
            throw new ValidationException(ErrorCode.EDGE_MISSING_NODE, "targetNodeId", "targetNodeId is required");
        }
        if (request.sourceNodeId().equals(request.targetNodeId())) {
            throw new ValidationException(ErrorCode.EDGE_SELF_REFERENTIAL, "targetNodeId",
                "Edge from node " + request.sourceNodeId() + " to itself");
        }
        if (!config.validateOnCreate()) {
            return;
        }
        TgEdgeEvidence.validateAll(request.evidence());

        if (request instanceof EdgeRequest.Includes includes) {
            requireField(includes.includeName(), "includeName");
            requireField(includes.mergeStrategy(), "mergeStrategy");
        } else if (request instanceof EdgeRequest.DependsOn dependsOn) {
            requireField(dependsOn.dependencyName(), "dependencyName");
        } else if (request instanceof EdgeRequest.PassesInput passesInput) {
            requireField(passesInput.inputName(), "inputName");
            requireField(passesInput.sourceExpression(), "sourceExpression");
        } else if (request instanceof EdgeRequest.Sources sources) {
            requireField(sources.sourceExpression(), "sourceExpression");
            requireField(sources.sourceType(), "sourceType");
        }
    }

    private static void requireField(Object value, String field) {
        if (value == null || (value instanceof String text && text.isBlank())) {
            throw new ValidationException(ErrorCode.EDGE_INVALID_FIELD, field, field + " is required");
        }
    }

    // ==================== Construction ====================

    private TgEdge build(EdgeRequest request) {
        List<TgEdgeEvidence> evidence = strongest(request.evidence());
        int confidence = ConfidenceAggregator.aggregate(evidence);
        boolean implicit = evidence.stream().noneMatch(e -> e.evidenceType() == EvidenceType.EXPLICIT);
        String source = request.sourceNodeId();
        String target = request.targetNodeId();

        if (request instanceof EdgeRequest.Includes r) {
            String label = EdgeType.INCLUDES.label(r.includeName());
            return new TgEdge.Includes(edgeId(request, label), source, target, label, scanId,
                evidence, confidence, implicit,
                r.includeName(), r.mergeStrategy(), r.inheritedBlocks(), r.exposeAsVariable());
        }
        if (request instanceof EdgeRequest.DependsOn r) {
            String label = EdgeType.DEPENDS_ON.label(r.dependencyName());
            return new TgEdge.DependsOn(edgeId(request, label), source, target, label, scanId,
                evidence, confidence, implicit,
                r.dependencyName(), r.skipOutputs(), r.outputsConsumed(), r.hasMockOutputs());
        }
        if (request instanceof EdgeRequest.PassesInput r) {
            String label = EdgeType.PASSES_INPUT.label(r.inputName());
            return new TgEdge.PassesInput(edgeId(request, label), source, target, label, scanId,
                evidence, confidence, implicit,
                r.inputName(), r.sourceExpression(), r.viaDependencyOutputs(), r.dependencyName());
        }
        EdgeRequest.Sources r = (EdgeRequest.Sources) request;
        String typeName = r.sourceType() == null ? "unknown" : r.sourceType().wireName();
        String label = EdgeType.SOURCES.label(typeName);
        return new TgEdge.Sources(edgeId(request, label), source, target, label, scanId,
            evidence, confidence, implicit,
            r.sourceExpression(), r.sourceType(), r.versionConstraint());
    }

    private List<TgEdgeEvidence> strongest(List<TgEdgeEvidence> evidence) {
        return evidence.stream()
            .filter(Objects::nonNull)
            .sorted(Comparator.comparingInt(TgEdgeEvidence::confidence).reversed())
            .limit(config.maxEvidencePerEdge())
            .toList();
    }

    private String edgeId(EdgeRequest request, String label) {
        if (generateRandomIds) {
            return UUID.randomUUID().toString();
        }
        return IdGenerator.generate(scanId, request.type().wireName(),
            request.sourceNodeId(), request.targetNodeId(), label);
    }

    // ==================== Hint conversion ====================

    // Evidence is built unvalidated here; create() rejects it per request.

    private EdgeRequest.Includes includeRequest(IncludeHint hint, TerragruntFile sourceFile, TerragruntFile targetFile) {
        Optional<IncludeBlock> block = sourceFile == null
            ? Optional.empty()
            : sourceFile.includeBlocks().stream()
                .filter(b -> b.label().equals(hint.includeLabel()))
                .findFirst();
        TgEdgeEvidence evidence = block
            .map(b -> TgEdgeEvidence.includeEvidence(b, hint.resolved(), config).buildUnsafe())
            .orElseGet(() -> fallbackEvidence(hint.targetPath(), "include", hint.resolved()));

        List<String> inherited = new ArrayList<>();
        if (hint.mergeStrategy() != MergeStrategy.NO_MERGE && targetFile != null) {
            Set<String> kinds = new LinkedHashSet<>();
            for (TerragruntBlock targetBlock : targetFile.blocks()) {
                if (targetBlock.kind() != BlockKind.INCLUDE) {
                    kinds.add(targetBlock.kind().keyword());
                }
            }
            inherited.addAll(kinds);
        }

        String name = hint.includeLabel().isEmpty() ? fileName(hint.targetPath()) : hint.includeLabel();
        return new EdgeRequest.Includes(hint.sourceId(), hint.targetId(), name, hint.mergeStrategy(),
            inherited, hint.exposeAsVariable(), List.of(evidence));
    }

    private EdgeRequest.DependsOn dependencyRequest(DependencyHint hint, TerragruntFile sourceFile) {
        if (hint.dependencyName().isEmpty()) {
            // Entry of a dependencies block.
            Optional<DependenciesBlock> block = sourceFile == null
                ? Optional.empty()
                : sourceFile.blocksOf(DependenciesBlock.class).stream().findFirst();
            TgEdgeEvidence evidence = block
                .filter(b -> b.location() != null)
                .map(b -> TgEdgeEvidence.builder()
                    .file(b.location().file())
                    .lines(b.location().line(), b.location().endLine())
                    .snippet(b.raw().isBlank() ? "dependencies { paths = [...] }" : b.raw())
                    .confidence(hint.resolved() ? config.explicitConfidence() : config.heuristicConfidence())
                    .type(hint.resolved() ? EvidenceType.EXPLICIT : EvidenceType.HEURISTIC)
                    .description("dependencies block entry " + hint.targetPath())
                    .buildUnsafe())
                .orElseGet(() -> fallbackEvidence(hint.targetPath(), "dependencies", hint.resolved()));
            return new EdgeRequest.DependsOn(hint.sourceId(), hint.targetId(), directoryName(hint.targetPath()),
                false, List.of(), false, List.of(evidence));
        }

        Optional<DependencyBlock> block = sourceFile == null
            ? Optional.empty()
            : sourceFile.dependencyBlocks().stream()
                .filter(b -> b.name().equals(hint.dependencyName()))
                .findFirst();
        List<String> outputs = sourceFile == null
            ? List.of()
            : sourceFile.dependencies().stream()
                .filter(d -> d.name().equals(hint.dependencyName()))
                .map(ResolvedDependency::outputsUsed)
                .findFirst()
                .orElse(List.of());
        TgEdgeEvidence evidence = block
            .map(b -> TgEdgeEvidence.dependencyEvidence(b, hint.resolved(), config).buildUnsafe())
            .orElseGet(() -> fallbackEvidence(hint.targetPath(), "dependency", hint.resolved()));
        return new EdgeRequest.DependsOn(hint.sourceId(), hint.targetId(), hint.dependencyName(),
            block.map(DependencyBlock::skipOutputs).orElse(false),
            outputs,
            block.map(DependencyBlock::hasMockOutputs).orElse(false),
            List.of(evidence));
    }

    private TgEdgeEvidence fallbackEvidence(String targetPath, String keyword, boolean resolved) {
        return TgEdgeEvidence.builder()
            .file(targetPath)
            .line(1)
            .snippet(keyword + " -> " + targetPath)
            .confidence(resolved ? config.inferredConfidence() : config.heuristicConfidence())
            .type(resolved ? EvidenceType.INFERRED : EvidenceType.HEURISTIC)
            .description(keyword + " reference to " + targetPath)
            .buildUnsafe();
    }

    /**
     * Maps each dependency whose outputs the expression reads to the first such reference.
     */
    private static Map<String, String> referencedDependencies(HclExpression expression) {
        Map<String, String> names = new LinkedHashMap<>();
        for (ExtractedReference reference : ReferenceExtractor.extractReferences(expression, ReferenceType.DEPENDENCY)) {
            if (reference.dependencyOutput().isPresent() && reference.name().isPresent()) {
                names.putIfAbsent(reference.name().get(), "dependency." + String.join(".", reference.parts()));
            }
        }
        return names;
    }

    private static String fileName(String path) {
        Path fileName = Path.of(path).getFileName();
        return fileName == null ? path : fileName.toString();
    }

    private static String directoryName(String path) {
        Path parent = Path.of(path).getParent();
        return parent == null || parent.getFileName() == null ? path : parent.getFileName().toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
