package com.tgarchitect.core.model;

import com.tgarchitect.core.model.block.DependencyBlock;
import com.tgarchitect.core.model.block.IncludeBlock;
import com.tgarchitect.core.model.block.RemoteStateBlock;
import com.tgarchitect.core.model.block.TerraformBlock;
import com.tgarchitect.core.model.block.TerragruntBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed Terragrunt configuration file.
 *
 * <p>Immutable; later stages derive new instances with {@link #withResolution}.
 *
 * @param path file path as given to the parser
 * @param blocks top-level blocks in source order
 * @param includes resolved includes
 * @param dependencies resolved dependencies
 * @param errors errors and warnings from every stage that touched the file
 * @param encoding character encoding used to read the file
 * @param size content size in characters
 */
public record TerragruntFile(
    String path,
    List<TerragruntBlock> blocks,
    List<ResolvedInclude> includes,
    List<ResolvedDependency> dependencies,
    List<ParseError> errors,
    String encoding,
    long size
) {
    public TerragruntFile {
        Objects.requireNonNull(path, "path must not be null");
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        includes = includes == null ? List.of() : List.copyOf(includes);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        errors = errors == null ? List.of() : List.copyOf(errors);
        encoding = encoding == null ? "UTF-8" : encoding;
    }

    /**
     * Returns the blocks of one type in source order.
     *
     * @param type block record type
     * @param <T> block type
     * @return matching blocks
     */
    public <T extends TerragruntBlock> List<T> blocksOf(Class<T> type) {
        return blocks.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public List<IncludeBlock> includeBlocks() {
        return blocksOf(IncludeBlock.class);
    }

    public List<DependencyBlock> dependencyBlocks() {
        return blocksOf(DependencyBlock.class);
    }

    public Optional<TerraformBlock> terraformBlock() {
        return blocksOf(TerraformBlock.class).stream().findFirst();
    }

    public Optional<RemoteStateBlock> remoteStateBlock() {
        return blocksOf(RemoteStateBlock.class).stream().findFirst();
    }

    public boolean hasErrors() {
        return errors.stream().anyMatch(ParseError::isError);
    }

    /**
     * Returns a copy carrying resolution results and their findings.
     *
     * @param resolvedIncludes resolved includes
     * @param resolvedDependencies resolved dependencies
     * @param resolutionErrors findings to append
     * @return new file
     */
    public TerragruntFile withResolution(
            List<ResolvedInclude> resolvedIncludes,
            List<ResolvedDependency> resolvedDependencies,
            List<ParseError> resolutionErrors) {
        List<ParseError> allErrors = new ArrayList<>(errors);
        allErrors.addAll(resolutionErrors);
        return new TerragruntFile(path, blocks, resolvedIncludes, resolvedDependencies, allErrors, encoding, size);
    }
}
