package com.tgarchitect.core.validation;

import com.tgarchitect.core.model.block.BlockKind;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in validation rules.
 *
 * <p>Identifiers are grouped by tens: structure (TG00x), duplicates (TG01x),
 * cross references (TG02x) and best practices (TG03x).
 *
 * @since 1.0.0
 */
public final class ValidationRules {

    // ==================== Structure ====================

    public static final ValidationRule REMOTE_STATE_BACKEND = rule("TG001",
        "Remote state must specify a backend", ValidationSeverity.ERROR, BlockKind.REMOTE_STATE);
    public static final ValidationRule INCLUDE_PATH = rule("TG002",
        "Include must specify a path", ValidationSeverity.ERROR, BlockKind.INCLUDE);
    public static final ValidationRule DEPENDENCY_CONFIG_PATH = rule("TG003",
        "Dependency must specify a config_path", ValidationSeverity.ERROR, BlockKind.DEPENDENCY);
    public static final ValidationRule GENERATE_PATH_AND_CONTENTS = rule("TG004",
        "Generate must specify path and contents", ValidationSeverity.ERROR, BlockKind.GENERATE);
    public static final ValidationRule TERRAFORM_SOURCE = rule("TG005",
        "Terraform source should be specified", ValidationSeverity.WARNING, BlockKind.TERRAFORM);

    // ==================== Duplicates ====================

    public static final ValidationRule DUPLICATE_INCLUDE = rule("TG010",
        "Duplicate include with same label", ValidationSeverity.ERROR, BlockKind.INCLUDE);
    public static final ValidationRule DUPLICATE_DEPENDENCY = rule("TG011",
        "Duplicate dependency with same name", ValidationSeverity.ERROR, BlockKind.DEPENDENCY);
    public static final ValidationRule DUPLICATE_GENERATE = rule("TG012",
        "Duplicate generate with same label", ValidationSeverity.ERROR, BlockKind.GENERATE);
    public static final ValidationRule MULTIPLE_REMOTE_STATE = rule("TG013",
        "Multiple remote_state blocks", ValidationSeverity.ERROR, BlockKind.REMOTE_STATE);
    public static final ValidationRule MULTIPLE_TERRAFORM = rule("TG014",
        "Multiple terraform blocks", ValidationSeverity.ERROR, BlockKind.TERRAFORM);

    // ==================== Cross references ====================

    public static final ValidationRule INCLUDE_NOT_FOUND = rule("TG020",
        "Include path not found", ValidationSeverity.ERROR, BlockKind.INCLUDE);
    public static final ValidationRule DEPENDENCY_NOT_FOUND = rule("TG021",
        "Dependency path not found", ValidationSeverity.WARNING, BlockKind.DEPENDENCY);
    public static final ValidationRule CIRCULAR_INCLUDE = rule("TG022",
        "Circular include detected", ValidationSeverity.ERROR, BlockKind.INCLUDE);
    public static final ValidationRule CIRCULAR_DEPENDENCY = rule("TG023",
        "Circular dependency detected", ValidationSeverity.ERROR, BlockKind.DEPENDENCY);

    // ==================== Best practices ====================

    public static final ValidationRule DEPENDENCY_MOCK_OUTPUTS = bestPractice("TG030",
        "Dependency should have mock_outputs for plan", ValidationSeverity.INFO, BlockKind.DEPENDENCY);
    public static final ValidationRule REMOTE_STATE_ENCRYPTION = bestPractice("TG031",
        "Remote state should use encryption", ValidationSeverity.WARNING, BlockKind.REMOTE_STATE);
    public static final ValidationRule GENERATE_IF_EXISTS = bestPractice("TG032",
        "Generate should specify if_exists", ValidationSeverity.INFO, BlockKind.GENERATE);
    public static final ValidationRule IAM_ROLE_SESSION_DURATION = bestPractice("TG033",
        "IAM role should specify session duration", ValidationSeverity.INFO, BlockKind.IAM_ROLE);
    public static final ValidationRule LOCALS_SHADOWING = bestPractice("TG034",
        "Locals should not shadow reserved names", ValidationSeverity.WARNING, BlockKind.LOCALS);

    public static final List<ValidationRule> BUILTIN = List.of(
        REMOTE_STATE_BACKEND, INCLUDE_PATH, DEPENDENCY_CONFIG_PATH, GENERATE_PATH_AND_CONTENTS, TERRAFORM_SOURCE,
        DUPLICATE_INCLUDE, DUPLICATE_DEPENDENCY, DUPLICATE_GENERATE, MULTIPLE_REMOTE_STATE, MULTIPLE_TERRAFORM,
        INCLUDE_NOT_FOUND, DEPENDENCY_NOT_FOUND, CIRCULAR_INCLUDE, CIRCULAR_DEPENDENCY,
        DEPENDENCY_MOCK_OUTPUTS, REMOTE_STATE_ENCRYPTION, GENERATE_IF_EXISTS, IAM_ROLE_SESSION_DURATION,
        LOCALS_SHADOWING);

    private ValidationRules() {
        // Utility class
    }

    public static Optional<ValidationRule> find(String id) {
        return BUILTIN.stream().filter(rule -> rule.id().equals(id)).findFirst();
    }

    private static ValidationRule rule(String id, String description, ValidationSeverity severity, BlockKind kind) {
        return new ValidationRule(id, description, severity, Set.of(kind), false);
    }

    private static ValidationRule bestPractice(String id, String description, ValidationSeverity severity,
                                               BlockKind kind) {
        return new ValidationRule(id, description, severity, Set.of(kind), true);
    }
}
