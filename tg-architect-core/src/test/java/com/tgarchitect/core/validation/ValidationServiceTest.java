package com.tgarchitect.core.validation;

import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.hierarchy.DependencyGraph;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.ResolvedDependency;
import com.tgarchitect.core.model.ResolvedInclude;
import com.tgarchitect.core.model.SourceLocation;
import com.tgarchitect.core.model.TerragruntFile;
import com.tgarchitect.core.model.block.BlockKind;
import com.tgarchitect.core.parser.TerragruntParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidationService}.
 */
class ValidationServiceTest {

    private static final String FILE = "live/app/terragrunt.hcl";

    private final TerragruntParser parser = TerragruntParser.create();
    private final ValidationService service = new ValidationService();

    @Test
    void validate_wellFormedFile_noIssues() {
        // Given
        TerragruntFile file = parse("""
            include "root" {
              path = find_in_parent_folders()
            }

            terraform {
              source = "../modules/vpc"
            }

            remote_state {
              backend = "s3"
              config = {
                encrypt = true
              }
            }

            dependency "vpc" {
              config_path = "../vpc"
              mock_outputs = {
                vpc_id = "vpc-123"
              }
            }
            """);

        // When
        ValidationResult result = service.validate(file);

        // Then
        assertThat(result.valid()).isTrue();
        assertThat(result.issues()).isEmpty();
        assertThat(result.rulesChecked()).contains("TG001", "TG010", "TG020", "TG030");
    }

    @Test
    void validate_missingRequiredAttributes_reportsErrors() {
        TerragruntFile file = parse("""
            include "root" {
              merge_strategy = "deep"
            }

            remote_state {
              config = {
                bucket = "state"
              }
            }

            dependency "vpc" {
              skip_outputs = true
            }

            generate "provider" {
              if_exists = "overwrite"
            }
            """);

        ValidationResult result = service.validate(file);

        assertThat(result.valid()).isFalse();
        assertThat(result.issues()).extracting(ValidationIssue::code)
            .containsExactly("TG002", "TG001", "TG003", "TG004", "TG004");
        assertThat(result.errorCount()).isEqualTo(5);
    }

    @Test
    void validate_terraformWithoutSource_warns() {
        ValidationResult result = service.validate(parse("terraform {\n  include_in_copy = [\"*.json\"]\n}\n"));

        assertThat(result.valid()).isTrue();
        assertThat(result.issuesWithCode("TG005")).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(ValidationSeverity.WARNING);
            assertThat(issue.blockKind()).isEqualTo(BlockKind.TERRAFORM);
            assertThat(issue.location().line()).isEqualTo(1);
            assertThat(issue.suggestion()).contains("source");
        });
    }

    @Test
    void validate_duplicateBlocks_reportsEachDuplicate() {
        TerragruntFile file = parse("""
            include {
              path = find_in_parent_folders()
            }
            include {
              path = find_in_parent_folders()
            }
            dependency "vpc" {
              config_path = "../vpc"
              skip_outputs = true
            }
            dependency "vpc" {
              config_path = "../vpc2"
              skip_outputs = true
            }
            terraform {
              source = "a"
            }
            terraform {
              source = "b"
            }
            """);

        ValidationResult result = service.validate(file);

        assertThat(result.issues()).extracting(ValidationIssue::code)
            .containsExactly("TG010", "TG011", "TG014");
        assertThat(result.issuesWithCode("TG010").get(0).message()).contains("\"default\"");
        assertThat(result.issuesWithCode("TG011").get(0).location().line()).isEqualTo(11);
    }

    @Test
    void validate_bestPractices_reportsWarningsAndInfo() {
        // Given
        TerragruntFile file = parse("""
            remote_state {
              backend = "s3"
              config = {
                encrypt = false
              }
            }

            dependency "vpc" {
              config_path = "../vpc"
            }

            generate "provider" {
              path     = "provider.tf"
              contents = "provider {}"
            }

            iam_role = "arn:aws:iam::123456789012:role/deploy"

            locals {
              path_relative_to_include = "x"
            }
            """);

        // When
        ValidationResult result = service.validate(file);

        // Then
        assertThat(result.valid()).isTrue();
        assertThat(result.issues()).extracting(ValidationIssue::code)
            .containsExactly("TG031", "TG030", "TG032", "TG033", "TG034");
        assertThat(result.warningCount()).isEqualTo(2);
        assertThat(result.infoCount()).isEqualTo(3);
    }

    @Test
    void validate_encryptFromLocal_isTrusted() {
        TerragruntFile file = parse("""
            remote_state {
              backend = "s3"
              config = {
                encrypt = local.encrypt
              }
            }
            """);

        assertThat(service.validate(file).issuesWithCode("TG031")).isEmpty();
    }

    @Test
    void validate_bestPracticesDisabled_skipsThoseRules() {
        ValidationService lenient = new ValidationService(ValidationOptions.defaults().withBestPractices(false));

        ValidationResult result = lenient.validate(parse("dependency \"vpc\" {\n  config_path = \"../vpc\"\n}\n"));

        assertThat(result.issues()).isEmpty();
        assertThat(result.rulesChecked()).doesNotContain("TG030", "TG031").contains("TG003");
    }

    @Test
    void validate_disabledRule_isNotChecked() {
        ValidationService service = new ValidationService(
            ValidationOptions.defaults().withDisabledRules(Set.of("TG030")));

        ValidationResult result = service.validate(parse("dependency \"vpc\" {\n  config_path = \"../vpc\"\n}\n"));

        assertThat(result.issuesWithCode("TG030")).isEmpty();
        assertThat(result.rulesChecked()).doesNotContain("TG030");
    }

    @Test
    void validate_unresolvedReferences_reportsCrossReferenceIssues() {
        // Given
        TerragruntFile parsed = parse("""
            include "root" {
              path = "../missing.hcl"
            }

            dependency "db" {
              config_path = "../db"
              skip_outputs = true
            }
            """);
        SourceLocation location = SourceLocation.at(FILE, 1, 1);
        TerragruntFile file = parsed.withResolution(
            List.of(ResolvedInclude.failed(parsed.includeBlocks().get(0), "not found")),
            List.of(ResolvedDependency.failed("db", parsed.dependencyBlocks().get(0).configPath(), List.of(),
                "not found")),
            List.of(ParseError.error(ErrorCode.CIRCULAR_INCLUDE, "Circular include: a -> b -> a", location)));

        // When
        ValidationResult result = service.validate(file);

        // Then
        assertThat(result.issues()).extracting(ValidationIssue::code)
            .containsExactly("TG020", "TG021", "TG022");
        assertThat(result.issuesWithCode("TG020").get(0).message()).contains("../missing.hcl", "not found");
        assertThat(result.issuesWithCode("TG021").get(0).severity()).isEqualTo(ValidationSeverity.WARNING);
        assertThat(result.errorCount()).isEqualTo(2);
    }

    @Test
    void validateGraph_cycle_reportsCircularDependency() {
        DependencyGraph graph = DependencyGraph.of(Map.of("a", List.of("b"), "b", List.of("a")));

        ValidationResult result = service.validateGraph(graph);

        assertThat(result.valid()).isFalse();
        assertThat(result.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo("TG023");
            assertThat(issue.message()).startsWith("Circular dependency:");
        });
    }

    @Test
    void validateBlock_singleBlock_runsBlockRules() {
        TerragruntFile file = parse("generate \"x\" {\n  path = \"x.tf\"\n}\n");

        List<ValidationIssue> issues = service.validateBlock(file.blocks().get(0));

        assertThat(issues).extracting(ValidationIssue::code).containsExactly("TG004", "TG032");
    }

    @Test
    void getRules_listsBuiltinRules() {
        assertThat(service.getRules()).hasSize(19);
        assertThat(ValidationRules.find("TG031")).hasValueSatisfying(rule -> assertThat(rule.bestPractice()).isTrue());
        assertThat(ValidationRules.find("TG999")).isEmpty();
    }

    private TerragruntFile parse(String content) {
        return parser.parse(content, FILE);
    }
}
