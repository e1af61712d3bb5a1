package com.tgarchitect.core.expression;

/**
 * Value type produced by a Terragrunt builtin function.
 */
public enum FunctionReturnType {
    STRING,
    LIST,
    OBJECT,
    /** Returns its argument unchanged. */
    PASSTHROUGH
}
