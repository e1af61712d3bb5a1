package com.tgarchitect.core.expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.tgarchitect.core.expression.FunctionCategory.AWS;
import static com.tgarchitect.core.expression.FunctionCategory.DEPENDENCY;
import static com.tgarchitect.core.expression.FunctionCategory.INCLUDE;
import static com.tgarchitect.core.expression.FunctionCategory.PATH;
import static com.tgarchitect.core.expression.FunctionCategory.READ;
import static com.tgarchitect.core.expression.FunctionCategory.RUNTIME;
import static com.tgarchitect.core.expression.FunctionCategory.UTILITY;
import static com.tgarchitect.core.expression.FunctionReturnType.LIST;
import static com.tgarchitect.core.expression.FunctionReturnType.OBJECT;
import static com.tgarchitect.core.expression.FunctionReturnType.PASSTHROUGH;
import static com.tgarchitect.core.expression.FunctionReturnType.STRING;
import static com.tgarchitect.core.expression.TerragruntFunction.UNBOUNDED;

/**
 * Catalog of the 27 Terragrunt builtin functions.
 */
public final class TerragruntFunctions {

    /**
     * Every builtin, in catalog order.
     */
    public static final List<TerragruntFunction> ALL = List.of(
        // Path
        fn("find_in_parent_folders", PATH, "Find file in parent directories", 0, 1, STRING),
        fn("path_relative_to_include", PATH, "Relative path from include", 0, 0, STRING),
        fn("path_relative_from_include", PATH, "Relative path to include", 0, 0, STRING),
        fn("get_path_from_repo_root", PATH, "Path from repository root", 0, 0, STRING),
        fn("get_path_to_repo_root", PATH, "Path to repository root", 0, 0, STRING),
        fn("get_terragrunt_dir", PATH, "Directory of terragrunt.hcl", 0, 0, STRING),

        // Include
        fn("read_terragrunt_config", INCLUDE, "Read another terragrunt config", 1, 2, OBJECT),
        fn("get_original_terragrunt_dir", INCLUDE, "Original terragrunt directory", 0, 0, STRING),

        // Dependency
        fn("get_terraform_commands_that_need_vars", DEPENDENCY, "Commands requiring vars", 0, 0, LIST),
        fn("get_terraform_commands_that_need_locking", DEPENDENCY, "Commands requiring locks", 0, 0, LIST),

        // Read
        fn("sops_decrypt_file", READ, "Decrypt SOPS encrypted file", 1, 1, STRING),
        fn("local_exec", READ, "Execute local command", 1, 1, STRING),
        fn("read_tfvars_file", READ, "Read terraform.tfvars file", 1, 1, OBJECT),
        fn("run_cmd", READ, "Run command and capture output", 1, UNBOUNDED, STRING),

        // AWS
        fn("get_aws_account_id", AWS, "Get AWS account ID", 0, 0, STRING),
        fn("get_aws_caller_identity_arn", AWS, "Get AWS caller identity ARN", 0, 0, STRING),
        fn("get_aws_caller_identity_user_id", AWS, "Get AWS caller user ID", 0, 0, STRING),
        fn("get_aws_region", AWS, "Get current AWS region", 0, 0, STRING),
        fn("get_aws_account_alias", AWS, "Get AWS account alias", 0, 0, STRING),
        fn("get_default_retryable_errors", AWS, "Default retryable error patterns", 0, 0, LIST),
        fn("get_terraform_command", AWS, "Current terraform command", 0, 0, STRING),
        fn("get_terraform_cli_args", AWS, "Terraform CLI arguments", 0, 0, LIST),

        // Runtime
        fn("get_env", RUNTIME, "Get environment variable", 1, 2, STRING),
        fn("get_platform", RUNTIME, "Get current platform", 0, 0, STRING),

        // Utility
        fn("mark_as_read", UTILITY, "Mark file as read", 1, 1, PASSTHROUGH),
        fn("render_aws_provider_settings", UTILITY, "Render AWS provider settings", 0, 1, STRING),
        fn("parse_aws_arn", UTILITY, "Parse AWS ARN into components", 1, 1, OBJECT)
    );

    private static final Map<String, TerragruntFunction> BY_NAME;

    static {
        Map<String, TerragruntFunction> byName = new LinkedHashMap<>();
        for (TerragruntFunction function : ALL) {
            byName.put(function.name(), function);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private TerragruntFunctions() {
        // Utility class
    }

    public static boolean isTerragruntFunction(String name) {
        return name != null && BY_NAME.containsKey(name);
    }

    public static Optional<TerragruntFunction> find(String name) {
        return Optional.ofNullable(name == null ? null : BY_NAME.get(name));
    }

    /**
     * Returns all function names in catalog order.
     *
     * @return names
     */
    public static List<String> names() {
        return List.copyOf(BY_NAME.keySet());
    }

    public static List<TerragruntFunction> byCategory(FunctionCategory category) {
        return ALL.stream().filter(f -> f.category() == category).toList();
    }

    private static TerragruntFunction fn(
            String name, FunctionCategory category, String description,
            int minArgs, int maxArgs, FunctionReturnType returnType) {
        return new TerragruntFunction(name, category, description, minArgs, maxArgs, returnType);
    }
}
