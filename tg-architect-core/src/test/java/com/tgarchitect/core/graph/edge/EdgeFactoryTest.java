package com.tgarchitect.core.graph.edge;

import com.tgarchitect.core.config.EdgeConfig;
import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.error.ValidationException;
import com.tgarchitect.core.graph.GraphNode;
import com.tgarchitect.core.graph.NodeBatchResult;
import com.tgarchitect.core.graph.NodeFactory;
import com.tgarchitect.core.graph.NodeFactoryOptions;
import com.tgarchitect.core.model.MergeStrategy;
import com.tgarchitect.core.model.ResolvedDependency;
import com.tgarchitect.core.model.ResolvedInclude;
import com.tgarchitect.core.model.TerragruntFile;
import com.tgarchitect.core.parser.TerragruntParser;
import com.tgarchitect.core.util.IdGenerator;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link EdgeFactory}.
 */
class EdgeFactoryTest {

    private static final Path REPO = Path.of("/repo").toAbsolutePath();
    private static final String APP = REPO.resolve("live/app/terragrunt.hcl").toString();
    private static final String VPC = REPO.resolve("live/vpc/terragrunt.hcl").toString();
    private static final String ROOT = REPO.resolve("root.hcl").toString();

    private final EdgeFactory factory = new EdgeFactory(EdgeConfig.defaults(), "scan-1");
    private final TerragruntParser parser = TerragruntParser.create();

    // ==================== Validation ====================

    @Test
    void constructor_blankScanId_throwsException() {
        assertThatThrownBy(() -> new EdgeFactory(EdgeConfig.defaults(), " "))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("scanId");
    }

    @Test
    void constructor_evidenceLimitBelowOne_throwsException() {
        assertThatThrownBy(() -> new EdgeFactory(EdgeConfig.defaults().withMaxEvidencePerEdge(0), "scan-1"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("maxEvidencePerEdge");
    }

    @Test
    void create_sameSourceAndTarget_isRejected() {
        EdgeCreationOutcome outcome = factory.createDependsOnEdge(dependsOn("a", "a", "vpc", explicit()));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getError()).hasValueSatisfying(error -> {
            assertThat(error.code()).isEqualTo(ErrorCode.EDGE_SELF_REFERENTIAL);
            assertThat(error.edgeType()).isEqualTo(EdgeType.DEPENDS_ON);
        });
    }

    @Test
    void create_blankSource_isRejected() {
        EdgeCreationOutcome outcome = factory.createDependsOnEdge(dependsOn("", "b", "vpc", explicit()));

        assertThat(outcome.getError()).hasValueSatisfying(error -> {
            assertThat(error.code()).isEqualTo(ErrorCode.EDGE_MISSING_NODE);
            assertThat(error.field()).isEqualTo("sourceNodeId");
        });
    }

    @Test
    void create_blankIncludeName_isRejected() {
        EdgeRequest.Includes request = new EdgeRequest.Includes(
            "a", "b", " ", MergeStrategy.SHALLOW, List.of(), false, List.of(explicit()));

        EdgeCreationOutcome outcome = factory.createIncludesEdge(request);

        assertThat(outcome.getError()).hasValueSatisfying(error -> {
            assertThat(error.code()).isEqualTo(ErrorCode.EDGE_INVALID_FIELD);
            assertThat(error.field()).isEqualTo("includeName");
        });
    }

    @Test
    void create_invalidEvidence_namesEvidenceField() {
        TgEdgeEvidence broken = TgEdgeEvidence.builder()
            .file("terragrunt.hcl")
            .lines(5, 2)
            .confidence(100)
            .explicit()
            .description("broken")
            .buildUnsafe();

        EdgeCreationOutcome outcome = factory.createDependsOnEdge(dependsOn("a", "b", "vpc", broken));

        assertThat(outcome.getError()).hasValueSatisfying(error -> {
            assertThat(error.code()).isEqualTo(ErrorCode.INVALID_EVIDENCE);
            assertThat(error.field()).isEqualTo("lineEnd");
            assertThat(error.toParseError().code()).isEqualTo(ErrorCode.INVALID_EVIDENCE);
        });
    }

    @Test
    void create_validationDisabled_skipsFieldChecks() {
        EdgeFactory lenient = new EdgeFactory(EdgeConfig.defaults().withValidateOnCreate(false), "scan-1");
        EdgeRequest.PassesInput request = new EdgeRequest.PassesInput(
            "a", "b", "vpc_id", null, true, null, List.of(inferred(85)));

        assertThat(lenient.createPassesInputEdge(request).isSuccess()).isTrue();
        assertThat(factory.createPassesInputEdge(request).isSuccess()).isFalse();
    }

    // ==================== Construction ====================

    @Test
    void create_validDependsOn_buildsLabeledEdge() {
        // When
        TgEdge edge = factory.createDependsOnEdge(dependsOn("a", "b", "vpc", explicit())).getEdge().orElseThrow();

        // Then
        assertThat(edge).isInstanceOf(TgEdge.DependsOn.class);
        assertThat(edge.type()).isEqualTo(EdgeType.DEPENDS_ON);
        assertThat(edge.label()).isEqualTo("depends_on:vpc");
        assertThat(edge.scanId()).isEqualTo("scan-1");
        assertThat(edge.aggregatedConfidence()).isEqualTo(100);
        assertThat(edge.implicit()).isFalse();
        assertThat(edge.id()).isEqualTo(IdGenerator.generate("scan-1", "tg_depends_on", "a", "b", "depends_on:vpc"));
    }

    @Test
    void create_onlyInferredEvidence_isImplicit() {
        TgEdge edge = factory.create(dependsOn("a", "b", "vpc", inferred(85))).getEdge().orElseThrow();

        assertThat(edge.implicit()).isTrue();
        assertThat(edge.aggregatedConfidence()).isEqualTo(85);
    }

    @Test
    void create_moreEvidenceThanLimit_keepsStrongest() {
        EdgeFactory limited = new EdgeFactory(EdgeConfig.defaults().withMaxEvidencePerEdge(1), "scan-1");
        EdgeRequest.DependsOn request = new EdgeRequest.DependsOn(
            "a", "b", "vpc", false, List.of(), false, List.of(inferred(70), explicit()));

        TgEdge edge = limited.create(request).getEdge().orElseThrow();

        assertThat(edge.evidence()).hasSize(1);
        assertThat(edge.evidence().get(0).confidence()).isEqualTo(100);
        assertThat(edge.implicit()).isFalse();
    }

    @Test
    void createSourcesEdge_labelUsesSourceType() {
        EdgeRequest.Sources request = new EdgeRequest.Sources(
            "a", "m", "../modules/vpc", com.tgarchitect.core.linker.SourceType.LOCAL, null, List.of(explicit()));

        TgEdge edge = factory.createSourcesEdge(request).getEdge().orElseThrow();

        assertThat(edge.label()).isEqualTo("sources:local");
        assertThat(((TgEdge.Sources) edge).getVersionConstraint()).isEmpty();
    }

    @Test
    void createEdges_mixedRequests_collectsEdgesAndErrors() {
        EdgeBatchResult result = factory.createEdges(List.of(
            dependsOn("a", "b", "vpc", explicit()),
            dependsOn("a", "a", "self", explicit())));

        assertThat(result.edges()).hasSize(1);
        assertThat(result.errors()).hasSize(1);
        assertThat(result.hasErrors()).isTrue();
        assertThat(result.summary().total()).isEqualTo(1);
        assertThat(result.summary().errorCount()).isEqualTo(1);
        assertThat(result.summary().byType())
            .containsEntry(EdgeType.DEPENDS_ON, 1)
            .containsEntry(EdgeType.INCLUDES, 0);
    }

    // ==================== Hints ====================

    @Test
    void createEdgesFromHints_scannedTargets_buildIncludeAndDependencyEdges() {
        // Given
        TerragruntFile app = parser.parse("""
            include "root" {
              path           = find_in_parent_folders("root.hcl")
              merge_strategy = "deep"
            }

            dependency "vpc" {
              config_path = "../vpc"
            }
            """, APP);
        app = app.withResolution(
            List.of(ResolvedInclude.of(app.includeBlocks().get(0), ROOT)),
            List.of(ResolvedDependency.of("vpc", app.dependencyBlocks().get(0).configPath(), VPC, List.of("vpc_id"))),
            List.of());
        TerragruntFile root = parser.parse("""
            remote_state {
              backend = "s3"
            }

            locals {
              region = "eu-west-1"
            }
            """, ROOT);
        TerragruntFile vpc = parser.parse("terraform {\n  source = \"../modules/vpc\"\n}\n", VPC);
        NodeBatchResult nodes = NodeFactory.createTerragruntConfigNodesWithRelationships(
            List.of(app, root, vpc), NodeFactoryOptions.of("scan-1", REPO));

        // When
        EdgeBatchResult result = factory.createEdgesFromHints(
            nodes.includeHints(), nodes.dependencyHints(), filesByNodeId(nodes, app, root, vpc));

        // Then
        assertThat(result.errors()).isEmpty();
        assertThat(result.edges()).hasSize(2);

        TgEdge.Includes include = (TgEdge.Includes) result.edges().get(0);
        assertThat(include.label()).isEqualTo("includes:root");
        assertThat(include.mergeStrategy()).isEqualTo(MergeStrategy.DEEP);
        assertThat(include.inheritedBlocks()).containsExactly("remote_state", "locals");
        assertThat(include.targetNodeId()).isEqualTo(nodes.pathToId().get(ROOT));
        assertThat(include.evidence().get(0).evidenceType()).isEqualTo(EvidenceType.EXPLICIT);

        TgEdge.DependsOn dependsOn = (TgEdge.DependsOn) result.edges().get(1);
        assertThat(dependsOn.dependencyName()).isEqualTo("vpc");
        assertThat(dependsOn.outputsConsumed()).containsExactly("vpc_id");
        assertThat(dependsOn.evidence().get(0).lineStart()).isEqualTo(6);
    }

    @Test
    void createEdgesFromHints_unscannedTarget_isSkipped() {
        TerragruntFile app = parser.parse("include {\n  path = find_in_parent_folders()\n}\n", APP);
        app = app.withResolution(List.of(ResolvedInclude.of(app.includeBlocks().get(0), ROOT)), List.of(), List.of());
        NodeBatchResult nodes = NodeFactory.createTerragruntConfigNodesWithRelationships(
            List.of(app), NodeFactoryOptions.of("scan-1", REPO));

        EdgeBatchResult result = factory.createEdgesFromHints(
            nodes.includeHints(), nodes.dependencyHints(), filesByNodeId(nodes, app));

        assertThat(nodes.includeHints()).hasSize(1);
        assertThat(result.edges()).isEmpty();
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    void createEdgesFromHints_unlabeledInclude_usesTargetFileName() {
        TerragruntFile app = parser.parse("include {\n  path = find_in_parent_folders()\n}\n", APP);
        app = app.withResolution(List.of(ResolvedInclude.of(app.includeBlocks().get(0), ROOT)), List.of(), List.of());
        TerragruntFile root = parser.parse("locals {\n  a = 1\n}\n", ROOT);
        NodeBatchResult nodes = NodeFactory.createTerragruntConfigNodesWithRelationships(
            List.of(app, root), NodeFactoryOptions.of("scan-1", REPO));

        EdgeBatchResult result = factory.createEdgesFromHints(
            nodes.includeHints(), nodes.dependencyHints(), filesByNodeId(nodes, app, root));

        assertThat(result.edges()).singleElement()
            .satisfies(edge -> assertThat(edge.label()).isEqualTo("includes:root.hcl"));
    }

    @Test
    void createInputEdges_dependencyOutputReference_buildsPassesInputEdge() {
        // Given
        TerragruntFile app = parser.parse("""
            inputs = {
              vpc_id = dependency.vpc.outputs.vpc_id
              region = "eu-west-1"
              db     = dependency.db.outputs.endpoint
            }
            """, APP);

        // When
        EdgeBatchResult result = factory.createInputEdges(app, "app", Map.of("vpc", "vpc-node"));

        // Then
        assertThat(result.edges()).singleElement().satisfies(edge -> {
            TgEdge.PassesInput input = (TgEdge.PassesInput) edge;
            assertThat(input.label()).isEqualTo("passes:vpc_id");
            assertThat(input.targetNodeId()).isEqualTo("vpc-node");
            assertThat(input.sourceExpression()).isEqualTo("dependency.vpc.outputs.vpc_id");
            assertThat(input.getDependencyName()).contains("vpc");
            assertThat(input.aggregatedConfidence()).isEqualTo(85);
            assertThat(input.implicit()).isTrue();
        });
    }

    @Test
    void createInputEdges_fileWithoutPath_reportsEvidenceErrorInsteadOfThrowing() {
        TerragruntFile unnamed = parser.parse("inputs = { vpc_id = dependency.vpc.outputs.vpc_id }", "");

        EdgeBatchResult result = factory.createInputEdges(unnamed, "app", Map.of("vpc", "vpc-node"));

        assertThat(result.edges()).isEmpty();
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(ErrorCode.INVALID_EVIDENCE);
            assertThat(error.field()).isEqualTo("file");
            assertThat(error.edgeType()).isEqualTo(EdgeType.PASSES_INPUT);
        });
    }

    @Test
    void createEdges_invalidEvidenceInOneRequest_keepsTheRest() {
        TgEdgeEvidence blankFile = TgEdgeEvidence.builder()
            .file("")
            .line(1)
            .snippet("dependency \"db\" {}")
            .confidence(90)
            .type(EvidenceType.EXPLICIT)
            .description("Dependency without a file")
            .buildUnsafe();

        EdgeBatchResult result = factory.createEdges(List.of(
            dependsOn("app", "vpc", "vpc", explicit()),
            dependsOn("app", "db", "db", blankFile)));

        assertThat(result.edges()).extracting(TgEdge::targetNodeId).containsExactly("vpc");
        assertThat(result.errors()).extracting(EdgeCreationError::targetNodeId).containsExactly("db");
    }

    // ==================== Helpers ====================

    private static Map<String, TerragruntFile> filesByNodeId(NodeBatchResult nodes, TerragruntFile... files) {
        Map<String, TerragruntFile> byId = new HashMap<>();
        for (TerragruntFile file : files) {
            byId.put(nodes.pathToId().get(Path.of(file.path()).toAbsolutePath().normalize().toString()), file);
        }
        assertThat(nodes.nodes()).extracting(GraphNode::id).containsAll(byId.keySet());
        return byId;
    }

    private static EdgeRequest.DependsOn dependsOn(String source, String target, String name, TgEdgeEvidence evidence) {
        return new EdgeRequest.DependsOn(source, target, name, false, List.of(), false, List.of(evidence));
    }

    private static TgEdgeEvidence explicit() {
        return TgEdgeEvidence.builder()
            .file("live/app/terragrunt.hcl")
            .lines(1, 3)
            .confidence(100)
            .explicit()
            .description("Explicit dependency block")
            .build();
    }

    private static TgEdgeEvidence inferred(int confidence) {
        return TgEdgeEvidence.builder()
            .file("live/app/terragrunt.hcl")
            .line(2)
            .confidence(confidence)
            .inferred()
            .description("Inferred reference")
            .build();
    }
}
