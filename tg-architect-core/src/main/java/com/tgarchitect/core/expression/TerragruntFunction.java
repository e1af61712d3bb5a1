package com.tgarchitect.core.expression;

import java.util.Objects;

/**
 * Definition of one Terragrunt builtin function.
 *
 * @param name function name
 * @param category category
 * @param description short description
 * @param minArgs minimum number of arguments
 * @param maxArgs maximum number of arguments, {@link #UNBOUNDED} for variadic functions
 * @param returnType return type
 */
public record TerragruntFunction(
    String name,
    FunctionCategory category,
    String description,
    int minArgs,
    int maxArgs,
    FunctionReturnType returnType
) {
    /**
     * Marker for functions without an upper argument bound.
     */
    public static final int UNBOUNDED = -1;

    public TerragruntFunction {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(returnType, "returnType must not be null");
        if (minArgs < 0) {
            throw new IllegalArgumentException("minArgs must not be negative");
        }
        if (maxArgs != UNBOUNDED && maxArgs < minArgs) {
            throw new IllegalArgumentException("maxArgs must be -1 or at least minArgs");
        }
    }

    public boolean isVariadic() {
        return maxArgs == UNBOUNDED;
    }

    /**
     * Checks an argument count against the arity bounds.
     *
     * @param count number of arguments
     * @return true if accepted
     */
    public boolean accepts(int count) {
        return count >= minArgs && (isVariadic() || count <= maxArgs);
    }
}
