package com.tgarchitect.core.graph.edge;

import com.tgarchitect.core.config.EdgeConfig;
import com.tgarchitect.core.error.EvidenceValidationException;
import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.linker.SourceResolution;
import com.tgarchitect.core.linker.SourceType;
import com.tgarchitect.core.model.SourceLocation;
import com.tgarchitect.core.model.block.DependencyBlock;
import com.tgarchitect.core.model.block.IncludeBlock;
import com.tgarchitect.core.model.block.TerraformBlock;

import java.util.Collection;

/**
 * One piece of evidence supporting an edge.
 *
 * <p>Values are created through {@link #builder()}, which validates on {@link Builder#build()},
 * or through the {@code from*} helpers for parsed blocks.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TgEdgeEvidence evidence = TgEdgeEvidence.builder()
 *     .file("live/prod/app/terragrunt.hcl")
 *     .lines(3, 5)
 *     .snippet("dependency \"vpc\" { ... }")
 *     .confidence(100)
 *     .explicit()
 *     .description("Explicit dependency block")
 *     .build();
 * }</pre>
 *
 * @param file file holding the evidence
 * @param lineStart first line, at least 1
 * @param lineEnd last line, at least {@code lineStart}
 * @param snippet source excerpt
 * @param confidence confidence in [0, 100]
 * @param evidenceType evidence type
 * @param description human readable description
 * @since 1.0.0
 */
public record TgEdgeEvidence(
    String file,
    int lineStart,
    int lineEnd,
    String snippet,
    int confidence,
    EvidenceType evidenceType,
    String description
) {
    private static final int MAX_SNIPPET_LENGTH = 200;

    public TgEdgeEvidence {
        snippet = snippet == null ? "" : snippet;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks every field constraint.
     *
     * @throws EvidenceValidationException naming the first invalid field
     */
    public void validate() {
        if (file == null || file.isBlank()) {
            throw new EvidenceValidationException("file", "must not be empty");
        }
        if (lineStart < 1) {
            throw new EvidenceValidationException("lineStart", "must be at least 1, was " + lineStart);
        }
        if (lineEnd < lineStart) {
            throw new EvidenceValidationException("lineEnd",
                "must not be before lineStart (" + lineStart + "), was " + lineEnd);
        }
        if (confidence < 0 || confidence > ConfidenceAggregator.MAX_CONFIDENCE) {
            throw new EvidenceValidationException("confidence", "must be within 0-100, was " + confidence);
        }
        if (evidenceType == null) {
            throw new EvidenceValidationException("evidenceType", "must be explicit, inferred or heuristic");
        }
        if (description == null || description.isBlank()) {
            throw new EvidenceValidationException("description", "must not be empty");
        }
    }

    public static void validateAll(Collection<TgEdgeEvidence> evidence) {
        for (TgEdgeEvidence item : evidence) {
            if (item == null) {
                throw new EvidenceValidationException("evidence", "must not contain null items");
            }
            item.validate();
        }
    }

    // ==================== Helpers ====================

    /**
     * Evidence for an {@code include} block.
     *
     * @param block include block
     * @param resolved whether the include path resolved
     * @param config confidence settings
     * @return explicit evidence when resolved, heuristic otherwise
     */
    public static TgEdgeEvidence fromInclude(IncludeBlock block, boolean resolved, EdgeConfig config) {
        return includeEvidence(block, resolved, config).build();
    }

    static Builder includeEvidence(IncludeBlock block, boolean resolved, EdgeConfig config) {
        String label = block.label().isEmpty() ? "" : " \"" + block.label() + "\"";
        return fromLocation(block.location(), block.raw(), "include" + label + " { path = " + rawOf(block.path()) + " }")
            .confidence(resolved ? config.explicitConfidence() : config.heuristicConfidence())
            .type(resolved ? EvidenceType.EXPLICIT : EvidenceType.HEURISTIC)
            .description(resolved
                ? "Explicit include block" + label
                : "Include block" + label + " with unresolved path");
    }

    /**
     * Evidence for a {@code dependency} block.
     *
     * @param block dependency block
     * @param resolved whether config_path resolved
     * @param config confidence settings
     * @return explicit evidence when resolved, heuristic otherwise
     */
    public static TgEdgeEvidence fromDependency(DependencyBlock block, boolean resolved, EdgeConfig config) {
        return dependencyEvidence(block, resolved, config).build();
    }

    static Builder dependencyEvidence(DependencyBlock block, boolean resolved, EdgeConfig config) {
        return fromLocation(block.location(), block.raw(),
                "dependency \"" + block.name() + "\" { config_path = " + rawOf(block.configPath()) + " }")
            .confidence(resolved ? config.explicitConfidence() : config.heuristicConfidence())
            .type(resolved ? EvidenceType.EXPLICIT : EvidenceType.HEURISTIC)
            .description(resolved
                ? "Explicit dependency block \"" + block.name() + "\""
                : "Dependency block \"" + block.name() + "\" with unresolved config_path");
    }

    /**
     * Evidence for an input wired to another module's outputs.
     *
     * @param inputName input name
     * @param expression input value
     * @param location location of the inputs block
     * @param config confidence settings
     * @return inferred evidence
     */
    public static TgEdgeEvidence fromInput(
            String inputName, HclExpression expression, SourceLocation location, EdgeConfig config) {
        return inputEvidence(inputName, expression, location, config).build();
    }

    static Builder inputEvidence(
            String inputName, HclExpression expression, SourceLocation location, EdgeConfig config) {
        return fromLocation(location, null, inputName + " = " + rawOf(expression))
            .confidence(config.inferredConfidence())
            .type(EvidenceType.INFERRED)
            .description("Input \"" + inputName + "\" references dependency outputs");
    }

    /**
     * Evidence for a {@code terraform.source} reference.
     *
     * @param block terraform block
     * @param sourceType classified source type
     * @param config confidence settings
     * @return explicit evidence
     */
    public static TgEdgeEvidence fromSource(TerraformBlock block, SourceType sourceType, EdgeConfig config) {
        return fromLocation(block.location(), null,
                "terraform { source = " + rawOf(block.source()) + " }")
            .confidence(config.explicitConfidence())
            .type(EvidenceType.EXPLICIT)
            .description("Terraform source reference of type \"" + sourceType.wireName() + "\"")
            .build();
    }

    /**
     * Evidence for how a source was linked to its module node.
     *
     * @param block terraform block
     * @param resolution successful linker resolution
     * @return inferred evidence scored with the linker confidence
     */
    public static TgEdgeEvidence fromSourceResolution(TerraformBlock block, SourceResolution resolution) {
        String description = resolution.getResolvedPath()
            .map(path -> (resolution.isSynthetic() ? "Local module not scanned, expected at " : "Local module at ") + path)
            .orElse("External " + resolution.sourceType().wireName() + " module " + resolution.source().raw());
        return fromLocation(block.location(), null, resolution.source().raw())
            .confidence(resolution.confidence())
            .type(EvidenceType.INFERRED)
            .description(description)
            .build();
    }

    private static Builder fromLocation(SourceLocation location, String raw, String fallbackSnippet) {
        Builder builder = builder().snippet(raw == null || raw.isBlank() ? fallbackSnippet : raw);
        if (location != null) {
            builder.file(location.file()).lines(location.line(), location.endLine());
        } else {
            builder.line(1);
        }
        return builder;
    }

    private static String rawOf(HclExpression expression) {
        return expression == null || expression.raw() == null ? "..." : expression.raw();
    }

    /**
     * Accumulates evidence fields.
     */
    public static final class Builder {
        private String file;
        private int lineStart;
        private int lineEnd;
        private String snippet = "";
        private int confidence = -1;
        private EvidenceType evidenceType;
        private String description;

        private Builder() {
        }

        public Builder file(String value) {
            this.file = value;
            return this;
        }

        public Builder line(int line) {
            return lines(line, line);
        }

        public Builder lines(int start, int end) {
            this.lineStart = start;
            this.lineEnd = end;
            return this;
        }

        public Builder snippet(String value) {
            this.snippet = value;
            return this;
        }

        public Builder confidence(int value) {
            this.confidence = value;
            return this;
        }

        public Builder type(EvidenceType value) {
            this.evidenceType = value;
            return this;
        }

        public Builder explicit() {
            return type(EvidenceType.EXPLICIT);
        }

        public Builder inferred() {
            return type(EvidenceType.INFERRED);
        }

        public Builder heuristic() {
            return type(EvidenceType.HEURISTIC);
        }

        public Builder description(String value) {
            this.description = value;
            return this;
        }

        /**
         * Builds and validates the evidence.
         *
         * @return evidence
         * @throws EvidenceValidationException naming the first invalid field
         */
        public TgEdgeEvidence build() {
            TgEdgeEvidence evidence = buildUnsafe();
            evidence.validate();
            return evidence;
        }

        /**
         * Builds without validation, for synthetic evidence and tests.
         *
         * @return evidence, possibly invalid
         */
        public TgEdgeEvidence buildUnsafe() {
            String text = snippet;
            if (text != null && text.length() > MAX_SNIPPET_LENGTH) {
                text = text.substring(0, MAX_SNIPPET_LENGTH);
            }
            return new TgEdgeEvidence(file, lineStart, lineEnd, text, confidence, evidenceType, description);
        }
    }
}
