package com.tgarchitect.core.graph.edge;

import com.tgarchitect.core.linker.SourceType;
import com.tgarchitect.core.model.MergeStrategy;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, evidence-backed edge between two graph nodes.
 *
 * <p>Instances are created by {@link EdgeFactory}, which validates the fields and computes
 * {@link #aggregatedConfidence()} and {@link #implicit()}.
 *
 * @since 1.0.0
 */
public sealed interface TgEdge permits TgEdge.Includes, TgEdge.DependsOn, TgEdge.PassesInput, TgEdge.Sources {

    String id();

    EdgeType type();

    String sourceNodeId();

    String targetNodeId();

    String label();

    String scanId();

    List<TgEdgeEvidence> evidence();

    int aggregatedConfidence();

    /**
     * Returns whether no evidence item is explicit.
     *
     * @return true for edges derived only from inferred or heuristic evidence
     */
    boolean implicit();

    private static void requireBase(String id, String sourceNodeId, String targetNodeId) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sourceNodeId, "sourceNodeId must not be null");
        Objects.requireNonNull(targetNodeId, "targetNodeId must not be null");
    }

    /**
     * {@code include} relationship: the source configuration includes the target.
     */
    record Includes(
        String id,
        String sourceNodeId,
        String targetNodeId,
        String label,
        String scanId,
        List<TgEdgeEvidence> evidence,
        int aggregatedConfidence,
        boolean implicit,
        String includeName,
        MergeStrategy mergeStrategy,
        List<String> inheritedBlocks,
        boolean exposeAsVariable
    ) implements TgEdge {
        public Includes {
            requireBase(id, sourceNodeId, targetNodeId);
            evidence = List.copyOf(evidence);
            inheritedBlocks = inheritedBlocks == null ? List.of() : List.copyOf(inheritedBlocks);
        }

        @Override
        public EdgeType type() {
            return EdgeType.INCLUDES;
        }
    }

    /**
     * {@code dependency} relationship: the source configuration runs after the target.
     */
    record DependsOn(
        String id,
        String sourceNodeId,
        String targetNodeId,
        String label,
        String scanId,
        List<TgEdgeEvidence> evidence,
        int aggregatedConfidence,
        boolean implicit,
        String dependencyName,
        boolean skipOutputs,
        List<String> outputsConsumed,
        boolean hasMockOutputs
    ) implements TgEdge {
        public DependsOn {
            requireBase(id, sourceNodeId, targetNodeId);
            evidence = List.copyOf(evidence);
            outputsConsumed = outputsConsumed == null ? List.of() : List.copyOf(outputsConsumed);
        }

        @Override
        public EdgeType type() {
            return EdgeType.DEPENDS_ON;
        }
    }

    /**
     * Data flow: an input of the source configuration is fed from the target's outputs.
     */
    record PassesInput(
        String id,
        String sourceNodeId,
        String targetNodeId,
        String label,
        String scanId,
        List<TgEdgeEvidence> evidence,
        int aggregatedConfidence,
        boolean implicit,
        String inputName,
        String sourceExpression,
        boolean viaDependencyOutputs,
        String dependencyName
    ) implements TgEdge {
        public PassesInput {
            requireBase(id, sourceNodeId, targetNodeId);
            evidence = List.copyOf(evidence);
        }

        @Override
        public EdgeType type() {
            return EdgeType.PASSES_INPUT;
        }

        public Optional<String> getDependencyName() {
            return Optional.ofNullable(dependencyName);
        }
    }

    /**
     * {@code terraform.source} relationship: the source configuration deploys the target module.
     */
    record Sources(
        String id,
        String sourceNodeId,
        String targetNodeId,
        String label,
        String scanId,
        List<TgEdgeEvidence> evidence,
        int aggregatedConfidence,
        boolean implicit,
        String sourceExpression,
        SourceType sourceType,
        String versionConstraint
    ) implements TgEdge {
        public Sources {
            requireBase(id, sourceNodeId, targetNodeId);
            evidence = List.copyOf(evidence);
        }

        @Override
        public EdgeType type() {
            return EdgeType.SOURCES;
        }

        public Optional<String> getVersionConstraint() {
            return Optional.ofNullable(versionConstraint);
        }
    }
}
