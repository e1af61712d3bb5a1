package com.tgarchitect.core.linker;

import com.tgarchitect.core.config.LinkerConfig;
import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.graph.GraphNode;
import com.tgarchitect.core.graph.NodeFactory;
import com.tgarchitect.core.graph.NodeFactoryOptions;
import com.tgarchitect.core.graph.NodeType;
import com.tgarchitect.core.parser.TerragruntParser;
import com.tgarchitect.core.util.IdGenerator;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TerraformLinker}.
 */
class TerraformLinkerTest {

    private static final Path REPO = Path.of("/repo").toAbsolutePath();
    private static final Path APP_CONFIG = REPO.resolve("live/app/terragrunt.hcl");
    private static final String MODULES = REPO.resolve("modules").toString();

    private final TerraformLinker linker = new TerraformLinker();

    @Test
    void resolve_localSourceOfKnownModule_linksByAbsolutePath() {
        String vpcDir = REPO.resolve("modules/vpc").toString();

        SourceResolution resolution = linker.resolve("../../modules/vpc", context(Map.of(vpcDir, "m1")));

        assertThat(resolution.isSuccess()).isTrue();
        assertThat(resolution.isSynthetic()).isFalse();
        assertThat(resolution.targetNodeId()).isEqualTo("m1");
        assertThat(resolution.getResolvedPath()).contains(vpcDir);
        assertThat(resolution.confidence()).isEqualTo(100);
    }

    @Test
    void resolve_localSourceOfKnownModule_linksByRelativePath() {
        SourceResolution resolution = linker.resolve("../../modules/vpc", context(Map.of("modules/vpc", "m2")));

        assertThat(resolution.targetNodeId()).isEqualTo("m2");
    }

    @Test
    void resolve_unknownLocalModule_createsSyntheticNode() {
        // When
        SourceResolution resolution = linker.resolve("../../modules/db", context(Map.of()));

        // Then
        String dbDir = REPO.resolve("modules/db").toString();
        GraphNode node = resolution.getSyntheticNode().orElseThrow();
        assertThat(node.type()).isEqualTo(NodeType.TERRAFORM_MODULE);
        assertThat(node.id()).isEqualTo(TerraformLinker.MODULE_ID_PREFIX + IdGenerator.generate("scan-1", dbDir));
        assertThat(node.name()).isEqualTo("db");
        assertThat(node.location().file()).isEqualTo("modules/db");
        assertThat(node.metadata())
            .containsEntry("synthetic", true)
            .containsEntry("sourceType", "local")
            .containsEntry("resolvedPath", dbDir);
    }

    @Test
    void resolve_unknownLocalModuleWithoutSynthetics_fails() {
        TerraformLinker strict = new TerraformLinker(new LinkerConfig(false, null, null, null));

        SourceResolution resolution = strict.resolve("../../modules/db", context(Map.of()));

        assertThat(resolution.isSuccess()).isFalse();
        assertThat(resolution.errorCode()).isEqualTo(ErrorCode.SOURCE_UNRESOLVABLE);
        assertThat(resolution.getResolvedPath()).contains(REPO.resolve("modules/db").toString());
    }

    @Test
    void resolve_externalSource_sharesSyntheticNodeAcrossConfigs() {
        String source = "terraform-aws-modules/vpc/aws?version=5.0.0";

        SourceResolution first = linker.resolve(source, context(Map.of()));
        SourceResolution second = linker.resolve(source,
            context(Map.of()).withConfigPath(REPO.resolve("live/other/terragrunt.hcl")));

        assertThat(first.targetNodeId()).isEqualTo(second.targetNodeId());
        assertThat(first.confidence()).isEqualTo(90);
        assertThat(first.getSyntheticNode()).hasValueSatisfying(node -> {
            assertThat(node.name()).isEqualTo("vpc");
            assertThat(node.metadata())
                .containsEntry("registryAddress", "terraform-aws-modules/vpc/aws")
                .containsEntry("versionConstraint", "5.0.0");
        });
    }

    @Test
    void resolve_emptySource_fails() {
        SourceResolution resolution = linker.resolve("", context(Map.of()));

        assertThat(resolution.isSuccess()).isFalse();
        assertThat(resolution.errorCode()).isEqualTo(ErrorCode.SOURCE_UNRESOLVABLE);
    }

    @Test
    void moduleName_perSourceType() {
        assertThat(TerraformLinker.moduleName(
            SourceExpressionParser.parseSource("git::https://github.com/org/repo.git//modules/vpc?ref=v1.0")))
            .isEqualTo("vpc");
        assertThat(TerraformLinker.moduleName(SourceExpressionParser.parseSource("git@github.com:org/network.git")))
            .isEqualTo("network");
        assertThat(TerraformLinker.moduleName(
            SourceExpressionParser.parseSource("s3::https://s3.amazonaws.com/my-bucket/vpc.zip")))
            .isEqualTo("my-bucket");
        assertThat(TerraformLinker.moduleName(SourceExpressionParser.parseSource("https://example.com/vpc.zip")))
            .isEqualTo("vpc.zip");
        assertThat(TerraformLinker.moduleName(SourceExpressionParser.parseSource("vpc")))
            .isEqualTo("unknown-module");
    }

    @Test
    void resolveChain_localHops_followsUntilNoFurtherSource() {
        // Given
        Map<String, String> next = Map.of(MODULES + "/a", "../b");

        // When
        ChainResolution chain = linker.resolveChain("../../modules/a", context(Map.of()),
            dir -> Optional.ofNullable(next.get(dir.toString())));

        // Then
        assertThat(chain.isComplete()).isTrue();
        assertThat(chain.links()).extracting(SourceResolution::resolvedPath)
            .containsExactly(MODULES + "/a", MODULES + "/b");
    }

    @Test
    void resolveChain_externalHop_endsChain() {
        Map<String, String> next = Map.of(MODULES + "/a", "git::https://github.com/org/repo.git?ref=v2");

        ChainResolution chain = linker.resolveChain("../../modules/a", context(Map.of()),
            dir -> Optional.ofNullable(next.get(dir.toString())));

        assertThat(chain.isComplete()).isTrue();
        assertThat(chain.terminal()).hasValueSatisfying(last ->
            assertThat(last.sourceType()).isEqualTo(SourceType.GIT));
    }

    @Test
    void resolveChain_cycle_reportsCircularReference() {
        Map<String, String> next = Map.of(MODULES + "/a", "../b", MODULES + "/b", "../a");

        ChainResolution chain = linker.resolveChain("../../modules/a", context(Map.of()),
            dir -> Optional.ofNullable(next.get(dir.toString())));

        assertThat(chain.getError()).hasValueSatisfying(error -> {
            assertThat(error.code()).isEqualTo(ErrorCode.SOURCE_CIRCULAR_REFERENCE);
            assertThat(error.message()).contains(MODULES + "/a -> " + MODULES + "/b -> " + MODULES + "/a");
        });
    }

    @Test
    void resolveChain_tooDeep_stopsAtBound() {
        TerraformLinker shallow = new TerraformLinker(new LinkerConfig(null, null, null, 2));
        Map<String, String> next = Map.of(MODULES + "/a", "../b", MODULES + "/b", "../c", MODULES + "/c", "../d");

        ChainResolution chain = shallow.resolveChain("../../modules/a", context(Map.of()),
            dir -> Optional.ofNullable(next.get(dir.toString())));

        assertThat(chain.links()).hasSize(2);
        assertThat(chain.getError()).hasValueSatisfying(error ->
            assertThat(error.code()).isEqualTo(ErrorCode.MAX_DEPTH_EXCEEDED));
    }

    @Test
    void buildModuleMap_configNode_keyedByDirectory() {
        GraphNode node = NodeFactory.createTerragruntConfigNode(
            TerragruntParser.create().parse("", REPO.resolve("modules/vpc/terragrunt.hcl").toString()),
            NodeFactoryOptions.of("scan-1", REPO));

        Map<String, String> map = TerraformLinker.buildModuleMap(List.of(node), REPO);

        assertThat(map)
            .containsEntry(MODULES + "/vpc", node.id())
            .containsEntry("modules/vpc", node.id());
    }

    private static LinkerContext context(Map<String, String> modules) {
        return new LinkerContext("scan-1", APP_CONFIG, REPO, modules);
    }
}
