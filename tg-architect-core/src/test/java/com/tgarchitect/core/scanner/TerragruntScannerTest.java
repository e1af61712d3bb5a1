package com.tgarchitect.core.scanner;

import com.tgarchitect.core.config.ParserConfig;
import com.tgarchitect.core.config.TerragruntConfig;
import com.tgarchitect.core.error.ConfigurationException;
import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.graph.GraphNode;
import com.tgarchitect.core.graph.NodeType;
import com.tgarchitect.core.graph.edge.EdgeType;
import com.tgarchitect.core.graph.edge.TgEdge;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.TerragruntFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TerragruntScanner}.
 */
class TerragruntScannerTest {

    @TempDir
    Path tempDir;

    private TerragruntScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new TerragruntScanner(TerragruntConfig.defaults());
    }

    @Test
    void scan_repository_buildsNodesEdgesAndOrder() throws IOException {
        // Given
        writeRepository();

        // When
        ScanResult result = scanner.scan(new ScanContext(tempDir, "scan-1", 2, null));

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.scanId()).isEqualTo("scan-1");
        assertThat(result.errors()).isEmpty();
        assertThat(result.files()).hasSize(3);

        assertThat(result.nodes()).filteredOn(node -> node.type() == NodeType.TG_CONFIG)
            .extracting(GraphNode::name)
            .containsExactlyInAnyOrder(tempDir.getFileName().toString(), "vpc", "app");
        assertThat(result.nodes()).filteredOn(node -> node.type() == NodeType.TERRAFORM_MODULE)
            .hasSize(2);

        Map<EdgeType, Long> byType = result.edges().stream()
            .collect(Collectors.groupingBy(TgEdge::type, Collectors.counting()));
        assertThat(byType)
            .containsEntry(EdgeType.INCLUDES, 2L)
            .containsEntry(EdgeType.DEPENDS_ON, 1L)
            .containsEntry(EdgeType.PASSES_INPUT, 1L)
            .containsEntry(EdgeType.SOURCES, 2L);

        assertThat(result.hasCycles()).isFalse();
        assertThat(result.graph().executionOrder()).containsExactly(
            path("root.hcl"), path("live/vpc/terragrunt.hcl"), path("live/app/terragrunt.hcl"));
    }

    @Test
    void scan_repository_countsStatistics() throws IOException {
        writeRepository();

        ScanStatistics statistics = scanner.scan(new ScanContext(tempDir, "scan-1", 1, null)).statistics();

        assertThat(statistics.filesDiscovered()).isEqualTo(4);
        assertThat(statistics.filesScanned()).isEqualTo(3);
        assertThat(statistics.filesSkipped()).isEqualTo(1);
        assertThat(statistics.filesParsedSuccessfully()).isEqualTo(3);
        assertThat(statistics.nodesCreated()).isEqualTo(5);
        assertThat(statistics.edgesCreated()).isEqualTo(6);
        assertThat(statistics.cyclesDetected()).isZero();
    }

    @Test
    void scan_sameRepositoryTwice_producesSameIds() throws IOException {
        writeRepository();

        ScanResult first = scanner.scan(new ScanContext(tempDir, "scan-1", 2, null));
        scanner.clearCache();
        ScanResult second = scanner.scan(new ScanContext(tempDir, "scan-1", 2, null));

        assertThat(second.nodes()).extracting(GraphNode::id)
            .containsExactlyInAnyOrderElementsOf(first.nodes().stream().map(GraphNode::id).toList());
        assertThat(second.edges()).extracting(TgEdge::id)
            .containsExactlyInAnyOrderElementsOf(first.edges().stream().map(TgEdge::id).toList());
    }

    @Test
    void scan_excludedDirectory_isNotScanned() throws IOException {
        write("live/vpc/terragrunt.hcl", "terraform {\n  source = \"../../modules/vpc\"\n}\n");
        write("live/vpc/.terragrunt-cache/abc/terragrunt.hcl", "terraform {\n  source = \"x\"\n}\n");

        ScanResult result = scanner.scan(ScanContext.of(tempDir));

        assertThat(result.files()).extracting(TerragruntFile::path)
            .containsExactly(path("live/vpc/terragrunt.hcl"));
    }

    @Test
    void scan_dependencyCycle_reportsCycle() throws IOException {
        write("a/terragrunt.hcl", "dependency \"b\" {\n  config_path = \"../b\"\n}\n");
        write("b/terragrunt.hcl", "dependency \"a\" {\n  config_path = \"../a\"\n}\n");

        ScanResult result = scanner.scan(ScanContext.of(tempDir));

        assertThat(result.hasCycles()).isTrue();
        assertThat(result.graph().executionOrder()).isEmpty();
        assertThat(result.errors()).extracting(ParseError::code).contains(ErrorCode.GRAPH_CYCLE);
        assertThat(result.statistics().cyclesDetected()).isEqualTo(1);
    }

    @Test
    void scan_cancelled_stopsWithoutFiles() throws IOException {
        writeRepository();

        ScanResult result = scanner.scan(new ScanContext(tempDir, null, 1, () -> true));

        assertThat(result.cancelled()).isTrue();
        assertThat(result.success()).isFalse();
        assertThat(result.files()).isEmpty();
        assertThat(result.scanId()).isNotBlank();
    }

    @Test
    void scan_rootIsNotDirectory_fails() throws IOException {
        Path file = write("terragrunt.hcl", "locals {}\n");

        ScanResult result = scanner.scan(ScanContext.of(file));

        assertThat(result.success()).isFalse();
        assertThat(result.errors()).extracting(ParseError::code).containsExactly(ErrorCode.FILE_READ_ERROR);
    }

    @Test
    void scan_unparsableFile_isCountedWithErrors() throws IOException {
        write("live/broken/terragrunt.hcl", "terraform {\n  source = \"x\"\n");

        ScanResult result = scanner.scan(ScanContext.of(tempDir));

        assertThat(result.files()).hasSize(1);
        assertThat(result.hasErrors()).isTrue();
        assertThat(result.statistics().filesWithErrors()).isEqualTo(1);
        assertThat(result.statistics().getSuccessRate()).isZero();
    }

    @Test
    void scanFile_resolvesIncludes() throws IOException {
        writeRepository();

        TerragruntFile file = scanner.scanFile(tempDir.resolve("live/app/terragrunt.hcl"));

        assertThat(file.includes()).singleElement()
            .satisfies(include -> assertThat(include.resolvedPath()).isEqualTo(path("root.hcl")));
        assertThat(file.dependencies()).singleElement()
            .satisfies(dependency -> assertThat(dependency.outputsUsed()).containsExactly("vpc_id"));
    }

    @Test
    void constructor_invalidConfig_throwsException() {
        TerragruntConfig invalid = TerragruntConfig.defaults()
            .withParser(ParserConfig.builder().maxIncludeDepth(0).build());

        assertThatThrownBy(() -> new TerragruntScanner(invalid))
            .isInstanceOf(ConfigurationException.class);
    }

    // ==================== Fixtures ====================

    private void writeRepository() throws IOException {
        write("root.hcl", """
            remote_state {
              backend = "s3"
              config = {
                bucket = "state"
              }
            }
            """);
        write("live/vpc/terragrunt.hcl", """
            include "root" {
              path = find_in_parent_folders("root.hcl")
            }

            terraform {
              source = "../../modules/vpc"
            }
            """);
        write("live/app/terragrunt.hcl", """
            include "root" {
              path = find_in_parent_folders("root.hcl")
            }

            terraform {
              source = "tfr:///terraform-aws-modules/eks/aws?version=19.0.0"
            }

            dependency "vpc" {
              config_path = "../vpc"
            }

            inputs = {
              vpc_id = dependency.vpc.outputs.vpc_id
            }
            """);
        write("modules/vpc/versions.hcl", "required_version = \">= 1.5\"\n");
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private String path(String relative) {
        return tempDir.resolve(relative).toAbsolutePath().normalize().toString();
    }
}
