package com.tgarchitect.core.resolver;

import com.tgarchitect.core.config.ParserConfig;
import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.ResolvedDependency;
import com.tgarchitect.core.model.ResolvedInclude;
import com.tgarchitect.core.model.TerragruntFile;
import com.tgarchitect.core.parser.TerragruntParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link IncludeResolver} against a real directory tree.
 */
class IncludeResolverTest {

    @TempDir
    Path tempDir;

    private TerragruntParser parser;
    private IncludeResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        parser = TerragruntParser.create(ParserConfig.builder().enableCache(false).build());
        resolver = new IncludeResolver(ParserConfig.defaults());
        write("live/root.hcl", "remote_state {\n  backend = \"s3\"\n}\n");
        write("live/prod/vpc/terragrunt.hcl",
            "include \"root\" {\n  path = find_in_parent_folders(\"root.hcl\")\n}\n");
    }

    @Test
    void resolve_findInParentFolders_resolvesToAncestorFile() {
        // When
        TerragruntFile file = resolve("live/prod/vpc/terragrunt.hcl");

        // Then
        assertThat(file.includes()).hasSize(1);
        ResolvedInclude include = file.includes().get(0);
        assertThat(include.isResolved()).isTrue();
        assertThat(include.label()).isEqualTo("root");
        assertThat(include.resolvedPath()).isEqualTo(abs("live/root.hcl"));
        assertThat(file.errors()).isEmpty();
    }

    @Test
    void resolve_dependencyDirectory_targetsItsTerragruntFile() throws IOException {
        // Given
        write("live/prod/app/terragrunt.hcl", """
            dependency "vpc" {
              config_path = "../vpc"
            }

            inputs = {
              vpc_id     = dependency.vpc.outputs.vpc_id
              subnet_ids = dependency.vpc.outputs.private_subnets
              again      = dependency.vpc.outputs.vpc_id
            }
            """);

        // When
        TerragruntFile file = resolve("live/prod/app/terragrunt.hcl");

        // Then
        ResolvedDependency dependency = file.dependencies().get(0);
        assertThat(dependency.name()).isEqualTo("vpc");
        assertThat(dependency.resolvedPath()).isEqualTo(abs("live/prod/vpc/terragrunt.hcl"));
        assertThat(dependency.outputsUsed()).containsExactly("vpc_id", "private_subnets");
    }

    @Test
    void resolve_dependenciesBlock_resolvesEachEntry() throws IOException {
        write("live/prod/app/terragrunt.hcl", "dependencies {\n  paths = [\"../vpc\", \"../db\"]\n}\n");

        TerragruntFile file = resolve("live/prod/app/terragrunt.hcl");

        assertThat(file.dependencies()).hasSize(2);
        assertThat(file.dependencies().get(0).isResolved()).isTrue();
        assertThat(file.dependencies().get(0).name()).isEmpty();
        assertThat(file.dependencies().get(1).isResolved()).isFalse();
        assertThat(file.errors()).extracting(ParseError::code).containsExactly(ErrorCode.DEPENDENCY_NOT_FOUND);
        assertThat(file.hasErrors()).isFalse();
    }

    @Test
    void resolve_missingIncludeFile_reportsIncludeNotFound() throws IOException {
        write("live/prod/app/terragrunt.hcl", "include {\n  path = \"../missing.hcl\"\n}\n");

        TerragruntFile file = resolve("live/prod/app/terragrunt.hcl");

        assertThat(file.includes().get(0).isResolved()).isFalse();
        assertThat(file.includes().get(0).failureReason()).contains("missing.hcl");
        assertThat(file.errors()).extracting(ParseError::code).containsExactly(ErrorCode.INCLUDE_NOT_FOUND);
    }

    @Test
    void resolve_selfInclude_reportsCircularInclude() throws IOException {
        write("live/prod/app/terragrunt.hcl", "include {\n  path = \"terragrunt.hcl\"\n}\n");

        TerragruntFile file = resolve("live/prod/app/terragrunt.hcl");

        assertThat(file.includes().get(0).isResolved()).isFalse();
        assertThat(file.errors()).extracting(ParseError::code).containsExactly(ErrorCode.CIRCULAR_INCLUDE);
    }

    @Test
    void resolve_dynamicPath_reportsUnresolvedPath() throws IOException {
        write("live/prod/app/terragrunt.hcl", "include {\n  path = run_cmd(\"pwd\")\n}\n");

        TerragruntFile file = resolve("live/prod/app/terragrunt.hcl");

        assertThat(file.includes().get(0).failureReason()).contains("run_cmd");
        assertThat(file.errors()).extracting(ParseError::code).containsExactly(ErrorCode.UNRESOLVED_PATH);
    }

    @Test
    void resolve_localReference_usesFileLocals() throws IOException {
        write("live/prod/app/terragrunt.hcl", """
            locals {
              root_file = "${get_terragrunt_dir()}/../../root.hcl"
            }

            include {
              path = local.root_file
            }
            """);

        TerragruntFile file = resolve("live/prod/app/terragrunt.hcl");

        assertThat(file.includes().get(0).resolvedPath()).isEqualTo(abs("live/root.hcl"));
    }

    @Test
    void resolve_withoutFileSystemChecks_acceptsMissingTargets() throws IOException {
        // Given
        IncludeResolver offline = new IncludeResolver(ParserConfig.builder().resolveFileSystem(false).build());
        write("live/prod/app/terragrunt.hcl", "dependency \"db\" {\n  config_path = \"../db\"\n}\n");

        // When
        TerragruntFile file = offline.resolve(parser.parseFile(tempDir.resolve("live/prod/app/terragrunt.hcl")));

        // Then
        assertThat(file.dependencies().get(0).resolvedPath()).isEqualTo(abs("live/prod/db/terragrunt.hcl"));
        assertThat(file.errors()).isEmpty();
    }

    @Test
    void findRepoRoot_gitDirectoryAbove_returnsIt() throws IOException {
        Files.createDirectories(tempDir.resolve(".git"));

        assertThat(resolver.findRepoRoot(tempDir.resolve("live/prod/vpc")))
            .contains(tempDir.toAbsolutePath().normalize());
    }

    private TerragruntFile resolve(String relative) {
        return resolver.resolve(parser.parseFile(tempDir.resolve(relative)));
    }

    private String abs(String relative) {
        return tempDir.resolve(relative).toAbsolutePath().normalize().toString();
    }

    private void write(String relative, String content) throws IOException {
        Path path = tempDir.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
    }
}
