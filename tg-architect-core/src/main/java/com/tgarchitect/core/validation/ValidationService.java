package com.tgarchitect.core.validation;

import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.expression.HclValues;
import com.tgarchitect.core.hierarchy.CycleError;
import com.tgarchitect.core.hierarchy.DependencyGraph;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.ResolvedDependency;
import com.tgarchitect.core.model.ResolvedInclude;
import com.tgarchitect.core.model.SourceLocation;
import com.tgarchitect.core.model.TerragruntFile;
import com.tgarchitect.core.model.block.BlockKind;
import com.tgarchitect.core.model.block.DependencyBlock;
import com.tgarchitect.core.model.block.GenerateBlock;
import com.tgarchitect.core.model.block.IamRoleBlock;
import com.tgarchitect.core.model.block.IncludeBlock;
import com.tgarchitect.core.model.block.LocalsBlock;
import com.tgarchitect.core.model.block.RemoteStateBlock;
import com.tgarchitect.core.model.block.TerraformBlock;
import com.tgarchitect.core.model.block.TerragruntBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rule-based validation of parsed Terragrunt files.
 *
 * <p>Runs the rules of {@link ValidationRules} that are enabled by the options. Structure
 * rules always run; duplicate, cross-reference and best-practice rules can be switched off,
 * and single rules can be disabled by id.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ValidationService service = new ValidationService(
 *     ValidationOptions.defaults().withDisabledRules(Set.of("TG030")));
 * ValidationResult result = service.validate(resolvedFile);
 * result.issues().forEach(System.out::println);
 * }</pre>
 *
 * @since 1.0.0
 */
public class ValidationService {

    private static final Logger log = LoggerFactory.getLogger(ValidationService.class);

    private static final Set<String> RESERVED_LOCAL_NAMES =
        Set.of("dependency", "dependencies", "include", "local", "path_relative_to_include");

    private final ValidationOptions options;

    public ValidationService(ValidationOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public ValidationService() {
        this(ValidationOptions.defaults());
    }

    public ValidationOptions getOptions() {
        return options;
    }

    public List<ValidationRule> getRules() {
        return ValidationRules.BUILTIN;
    }

    /**
     * Validates a file. Cross-reference rules only find something on files passed through
     * {@link com.tgarchitect.core.resolver.IncludeResolver}.
     *
     * @param file parsed file
     * @return result, never null
     */
    public ValidationResult validate(TerragruntFile file) {
        Objects.requireNonNull(file, "file must not be null");
        long start = System.currentTimeMillis();
        Checker checker = new Checker();

        if (options.checkDuplicates()) {
            checkDuplicates(file, checker);
        }
        for (TerragruntBlock block : file.blocks()) {
            checkBlock(block, checker);
        }
        if (options.checkCrossReferences()) {
            checkCrossReferences(file, checker);
        }

        ValidationResult result = ValidationResult.of(checker.issues, checker.rulesChecked,
            System.currentTimeMillis() - start);
        log.debug("Validated {}: {} errors, {} warnings, {} info",
            file.path(), result.errorCount(), result.warningCount(), result.infoCount());
        return result;
    }

    /**
     * Validates a single block with the structure and best-practice rules.
     *
     * @param block block to check
     * @return issues found
     */
    public List<ValidationIssue> validateBlock(TerragruntBlock block) {
        Checker checker = new Checker();
        checkBlock(block, checker);
        return List.copyOf(checker.issues);
    }

    /**
     * Reports every cycle of a dependency graph as a circular dependency.
     *
     * @param graph dependency graph
     * @return result, never null
     */
    public ValidationResult validateGraph(DependencyGraph graph) {
        Checker checker = new Checker();
        if (options.checkCrossReferences() && checker.check(ValidationRules.CIRCULAR_DEPENDENCY)) {
            for (CycleError cycle : graph.cycles()) {
                checker.add(ValidationRules.CIRCULAR_DEPENDENCY, cycle.message(), null, BlockKind.DEPENDENCY,
                    "Restructure dependencies to break the cycle");
            }
        }
        return ValidationResult.of(checker.issues, checker.rulesChecked, 0);
    }

    // ==================== Block rules ====================

    private void checkBlock(TerragruntBlock block, Checker checker) {
        if (block instanceof TerraformBlock terraform) {
            checkTerraform(terraform, checker);
        } else if (block instanceof RemoteStateBlock remoteState) {
            checkRemoteState(remoteState, checker);
        } else if (block instanceof IncludeBlock include) {
            if (checker.check(ValidationRules.INCLUDE_PATH) && !include.hasPath()) {
                checker.add(ValidationRules.INCLUDE_PATH, "Include block must specify a path", include,
                    "Add path = find_in_parent_folders() or a specific path");
            }
        } else if (block instanceof DependencyBlock dependency) {
            checkDependency(dependency, checker);
        } else if (block instanceof GenerateBlock generate) {
            checkGenerate(generate, checker);
        } else if (block instanceof IamRoleBlock iamRole) {
            if (checker.check(ValidationRules.IAM_ROLE_SESSION_DURATION) && iamRole.sessionDuration() == null) {
                checker.add(ValidationRules.IAM_ROLE_SESSION_DURATION,
                    "IAM role should specify session duration for clarity", iamRole,
                    "Add iam_assume_role_duration = 3600 or an appropriate value in seconds");
            }
        } else if (block instanceof LocalsBlock locals && checker.check(ValidationRules.LOCALS_SHADOWING)) {
            for (String name : locals.variables().keySet()) {
                if (RESERVED_LOCAL_NAMES.contains(name)) {
                    checker.add(ValidationRules.LOCALS_SHADOWING,
                        "Local variable \"" + name + "\" shadows a reserved name", locals,
                        "Rename the local to avoid confusion with the built-in \"" + name + "\"");
                }
            }
        }
    }

    private void checkTerraform(TerraformBlock block, Checker checker) {
        if (checker.check(ValidationRules.TERRAFORM_SOURCE) && HclValues.isNull(block.source())) {
            checker.add(ValidationRules.TERRAFORM_SOURCE, "Terraform block should specify a source", block,
                "Add source = \"<module-source>\" to the terraform block");
        }
    }

    private void checkRemoteState(RemoteStateBlock block, Checker checker) {
        if (checker.check(ValidationRules.REMOTE_STATE_BACKEND) && !block.hasBackend()) {
            checker.add(ValidationRules.REMOTE_STATE_BACKEND, "Remote state must specify a backend", block,
                "Add backend = \"s3\" (or gcs, azurerm) to the remote_state block");
        }
        if (checker.check(ValidationRules.REMOTE_STATE_ENCRYPTION) && "s3".equals(block.backend())) {
            HclExpression encrypt = block.config().get("encrypt");
            // Non-literal values such as local references are trusted
            boolean disabled = encrypt == null
                || (encrypt instanceof HclExpression.Literal && !HclValues.bool(encrypt).orElse(false));
            if (disabled) {
                checker.add(ValidationRules.REMOTE_STATE_ENCRYPTION, "S3 remote state should enable encryption",
                    block, "Add encrypt = true to the config block");
            }
        }
    }

    private void checkDependency(DependencyBlock block, Checker checker) {
        if (checker.check(ValidationRules.DEPENDENCY_CONFIG_PATH) && !block.hasConfigPath()) {
            checker.add(ValidationRules.DEPENDENCY_CONFIG_PATH,
                "Dependency \"" + block.name() + "\" must specify a config_path", block,
                "Add config_path = \"../module-name\" to the dependency block");
        }
        if (checker.check(ValidationRules.DEPENDENCY_MOCK_OUTPUTS) && !block.hasMockOutputs() && !block.skipOutputs()) {
            checker.add(ValidationRules.DEPENDENCY_MOCK_OUTPUTS,
                "Dependency \"" + block.name() + "\" should have mock_outputs for plan commands", block,
                "Add mock_outputs = { ... } to allow terraform plan before apply");
        }
    }

    private void checkGenerate(GenerateBlock block, Checker checker) {
        if (checker.check(ValidationRules.GENERATE_PATH_AND_CONTENTS)) {
            if (HclValues.isNull(block.path())) {
                checker.add(ValidationRules.GENERATE_PATH_AND_CONTENTS,
                    "Generate block \"" + block.label() + "\" must specify a path", block,
                    "Add path = \"filename.tf\" to the generate block");
            }
            if (HclValues.isNull(block.contents())) {
                checker.add(ValidationRules.GENERATE_PATH_AND_CONTENTS,
                    "Generate block \"" + block.label() + "\" must specify contents", block,
                    "Add contents = <<EOF ... EOF to the generate block");
            }
        }
        if (checker.check(ValidationRules.GENERATE_IF_EXISTS) && block.ifExists() == null) {
            checker.add(ValidationRules.GENERATE_IF_EXISTS,
                "Generate block \"" + block.label() + "\" should specify if_exists", block,
                "Add if_exists = \"overwrite\" or \"skip\" to be explicit");
        }
    }

    // ==================== File rules ====================

    private void checkDuplicates(TerragruntFile file, Checker checker) {
        boolean includes = checker.check(ValidationRules.DUPLICATE_INCLUDE);
        boolean dependencies = checker.check(ValidationRules.DUPLICATE_DEPENDENCY);
        boolean generates = checker.check(ValidationRules.DUPLICATE_GENERATE);
        boolean remoteStates = checker.check(ValidationRules.MULTIPLE_REMOTE_STATE);
        boolean terraforms = checker.check(ValidationRules.MULTIPLE_TERRAFORM);

        Set<String> includeLabels = new HashSet<>();
        Set<String> dependencyNames = new HashSet<>();
        Set<String> generateLabels = new HashSet<>();
        int remoteStateCount = 0;
        int terraformCount = 0;

        for (TerragruntBlock block : file.blocks()) {
            if (block instanceof IncludeBlock include && includes) {
                String label = include.label().isEmpty() ? "default" : include.label();
                if (!includeLabels.add(label)) {
                    checker.add(ValidationRules.DUPLICATE_INCLUDE, "Duplicate include with label \"" + label + "\"",
                        block, "Use unique labels for each include block");
                }
            } else if (block instanceof DependencyBlock dependency && dependencies) {
                if (!dependencyNames.add(dependency.name())) {
                    checker.add(ValidationRules.DUPLICATE_DEPENDENCY,
                        "Duplicate dependency with name \"" + dependency.name() + "\"",
                        block, "Use unique names for each dependency block");
                }
            } else if (block instanceof GenerateBlock generate && generates) {
                if (!generateLabels.add(generate.label())) {
                    checker.add(ValidationRules.DUPLICATE_GENERATE,
                        "Duplicate generate with label \"" + generate.label() + "\"",
                        block, "Use unique labels for each generate block");
                }
            } else if (block instanceof RemoteStateBlock && remoteStates && ++remoteStateCount > 1) {
                checker.add(ValidationRules.MULTIPLE_REMOTE_STATE, "Multiple remote_state blocks found", block,
                    "Keep a single remote_state block per file");
            } else if (block instanceof TerraformBlock && terraforms && ++terraformCount > 1) {
                checker.add(ValidationRules.MULTIPLE_TERRAFORM, "Multiple terraform blocks found", block,
                    "Keep a single terraform block per file");
            }
        }
    }

    private void checkCrossReferences(TerragruntFile file, Checker checker) {
        if (checker.check(ValidationRules.INCLUDE_NOT_FOUND)) {
            for (ResolvedInclude include : file.includes()) {
                if (!include.isResolved()) {
                    checker.add(ValidationRules.INCLUDE_NOT_FOUND,
                        "Include path not resolved: " + describe(include.pathExpression(), include.failureReason()),
                        null, BlockKind.INCLUDE, "Verify the include path exists and is accessible");
                }
            }
        }
        if (checker.check(ValidationRules.DEPENDENCY_NOT_FOUND)) {
            for (ResolvedDependency dependency : file.dependencies()) {
                if (!dependency.isResolved()) {
                    checker.add(ValidationRules.DEPENDENCY_NOT_FOUND,
                        "Dependency path not resolved: "
                            + describe(dependency.configPathExpression(), dependency.failureReason()),
                        null, BlockKind.DEPENDENCY, "Verify the path exists and contains a terragrunt.hcl");
                }
            }
        }
        boolean includeCycles = checker.check(ValidationRules.CIRCULAR_INCLUDE);
        boolean dependencyCycles = checker.check(ValidationRules.CIRCULAR_DEPENDENCY);
        for (ParseError error : file.errors()) {
            if (includeCycles && error.code() == ErrorCode.CIRCULAR_INCLUDE) {
                checker.add(ValidationRules.CIRCULAR_INCLUDE, error.message(), error.location(), BlockKind.INCLUDE,
                    "Remove the circular include to fix the hierarchy");
            } else if (dependencyCycles && error.code() == ErrorCode.CIRCULAR_DEPENDENCY) {
                checker.add(ValidationRules.CIRCULAR_DEPENDENCY, error.message(), error.location(),
                    BlockKind.DEPENDENCY, "Restructure dependencies to break the cycle");
            }
        }
    }

    private static String describe(HclExpression expression, String failureReason) {
        String text = Optional.ofNullable(expression).map(HclExpression::raw).filter(raw -> !raw.isBlank())
            .orElse("<unknown>");
        return failureReason == null ? text : text + " (" + failureReason + ")";
    }

    /**
     * Collects issues and the ids of the rules that ran.
     */
    private final class Checker {
        private final List<ValidationIssue> issues = new ArrayList<>();
        private final Set<String> rulesChecked = new LinkedHashSet<>();

        boolean check(ValidationRule rule) {
            if (!options.isEnabled(rule)) {
                return false;
            }
            rulesChecked.add(rule.id());
            return true;
        }

        void add(ValidationRule rule, String message, TerragruntBlock block, String suggestion) {
            add(rule, message, block.location(), block.kind(), suggestion);
        }

        void add(ValidationRule rule, String message, SourceLocation location,
                 BlockKind kind, String suggestion) {
            issues.add(ValidationIssue.of(rule, message, location, kind, suggestion));
        }
    }
}
