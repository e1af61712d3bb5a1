package com.tgarchitect.core.graph.edge;

import com.tgarchitect.core.linker.SourceType;
import com.tgarchitect.core.model.MergeStrategy;

import java.util.List;

/**
 * Unvalidated edge fields handed to {@link EdgeFactory}. One variant per {@link TgEdge} kind.
 *
 * <p>Components may be null; {@link EdgeFactory} reports missing fields as
 * {@link EdgeCreationError}s instead of failing here.
 */
public sealed interface EdgeRequest permits
        EdgeRequest.Includes, EdgeRequest.DependsOn, EdgeRequest.PassesInput, EdgeRequest.Sources {

    EdgeType type();

    String sourceNodeId();

    String targetNodeId();

    List<TgEdgeEvidence> evidence();

    record Includes(
        String sourceNodeId,
        String targetNodeId,
        String includeName,
        MergeStrategy mergeStrategy,
        List<String> inheritedBlocks,
        boolean exposeAsVariable,
        List<TgEdgeEvidence> evidence
    ) implements EdgeRequest {
        public Includes {
            evidence = evidence == null ? List.of() : evidence;
        }

        @Override
        public EdgeType type() {
            return EdgeType.INCLUDES;
        }
    }

    record DependsOn(
        String sourceNodeId,
        String targetNodeId,
        String dependencyName,
        boolean skipOutputs,
        List<String> outputsConsumed,
        boolean hasMockOutputs,
        List<TgEdgeEvidence> evidence
    ) implements EdgeRequest {
        public DependsOn {
            evidence = evidence == null ? List.of() : evidence;
        }

        @Override
        public EdgeType type() {
            return EdgeType.DEPENDS_ON;
        }
    }

    record PassesInput(
        String sourceNodeId,
        String targetNodeId,
        String inputName,
        String sourceExpression,
        boolean viaDependencyOutputs,
        String dependencyName,
        List<TgEdgeEvidence> evidence
    ) implements EdgeRequest {
        public PassesInput {
            evidence = evidence == null ? List.of() : evidence;
        }

        @Override
        public EdgeType type() {
            return EdgeType.PASSES_INPUT;
        }
    }

    record Sources(
        String sourceNodeId,
        String targetNodeId,
        String sourceExpression,
        SourceType sourceType,
        String versionConstraint,
        List<TgEdgeEvidence> evidence
    ) implements EdgeRequest {
        public Sources {
            evidence = evidence == null ? List.of() : evidence;
        }

        @Override
        public EdgeType type() {
            return EdgeType.SOURCES;
        }
    }
}
