package com.tgarchitect.core.expression;

/**
 * Grouping of the Terragrunt builtin functions.
 */
public enum FunctionCategory {
    /** Directory and path helpers such as {@code find_in_parent_folders}. */
    PATH,
    /** Reading other Terragrunt configurations. */
    INCLUDE,
    /** Terraform command introspection used by dependency handling. */
    DEPENDENCY,
    /** Reading files and running commands. */
    READ,
    /** AWS identity and Terraform invocation helpers. */
    AWS,
    /** Process environment. */
    RUNTIME,
    /** Miscellaneous helpers. */
    UTILITY
}
