package com.tgarchitect.core.resolver;

import com.tgarchitect.core.error.ResolutionException;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.ResolvedDependency;
import com.tgarchitect.core.model.ResolvedInclude;

import java.util.List;

/**
 * Includes and dependencies of one file after path resolution.
 *
 * @param includes one entry per include block, in source order
 * @param dependencies one entry per dependency block, then one per {@code dependencies} path
 * @param errors resolution findings
 */
public record ResolutionResult(
    List<ResolvedInclude> includes,
    List<ResolvedDependency> dependencies,
    List<ParseError> errors
) {
    public ResolutionResult {
        includes = includes == null ? List.of() : List.copyOf(includes);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return errors.stream().anyMatch(ParseError::isError);
    }

    /**
     * Returns this result, or fails on the first error-level finding.
     *
     * @return this result
     * @throws ResolutionException if any finding has error severity
     */
    public ResolutionResult requireResolved() {
        for (ParseError error : errors) {
            if (error.isError()) {
                throw new ResolutionException(error.code(), error.message(), error.location());
            }
        }
        return this;
    }
}
