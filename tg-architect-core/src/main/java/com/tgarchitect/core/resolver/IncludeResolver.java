package com.tgarchitect.core.resolver;

import com.tgarchitect.core.config.ParserConfig;
import com.tgarchitect.core.error.ErrorCode;
import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.expression.ReferenceExtractor;
import com.tgarchitect.core.expression.ReferenceType;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.ResolvedDependency;
import com.tgarchitect.core.model.ResolvedInclude;
import com.tgarchitect.core.model.SourceLocation;
import com.tgarchitect.core.model.TerragruntFile;
import com.tgarchitect.core.model.block.BlockExpressions;
import com.tgarchitect.core.model.block.DependenciesBlock;
import com.tgarchitect.core.model.block.DependencyBlock;
import com.tgarchitect.core.model.block.IncludeBlock;
import com.tgarchitect.core.model.block.LocalsBlock;
import com.tgarchitect.core.model.block.TerragruntBlock;
import com.tgarchitect.core.parser.TerragruntFileDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the include and dependency paths of a parsed file.
 *
 * <p>Each {@code include}, {@code dependency} and {@code dependencies} entry is evaluated with
 * {@link PathEvaluator}. Failures are per entry and never abort the file: the entry is kept as
 * a failed {@link ResolvedInclude} / {@link ResolvedDependency} and a {@link ParseError} is
 * added to the result.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * IncludeResolver resolver = new IncludeResolver(ParserConfig.defaults());
 * TerragruntFile resolved = resolver.resolve(parser.parseFile(path));
 * resolved.includes().forEach(include -> System.out.println(include.resolvedPath()));
 * }</pre>
 *
 * @since 1.0.0
 */
public class IncludeResolver {

    private static final Logger log = LoggerFactory.getLogger(IncludeResolver.class);

    private static final String GIT_DIR = ".git";

    private final FileSystemAccessor fileSystem;
    private final PathEvaluator pathEvaluator;
    private final boolean resolveFileSystem;

    public IncludeResolver(ParserConfig config) {
        this(config, new LocalFileSystemAccessor());
    }

    public IncludeResolver(ParserConfig config, FileSystemAccessor fileSystem) {
        Objects.requireNonNull(config, "config must not be null");
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem must not be null");
        this.resolveFileSystem = config.resolveFileSystem();
        this.pathEvaluator = new PathEvaluator(fileSystem, config.maxIncludeDepth(), resolveFileSystem);
    }

    /**
     * Resolves a file against its own directory and returns it with the results attached.
     *
     * @param file parsed file
     * @return copy of the file carrying includes, dependencies and resolution findings
     */
    public TerragruntFile resolve(TerragruntFile file) {
        ResolutionResult result = resolveReferences(file, createContext(file));
        return file.withResolution(result.includes(), result.dependencies(), result.errors());
    }

    /**
     * Resolves every include and dependency of one file.
     *
     * @param file parsed file
     * @param context evaluation context
     * @return resolution results
     */
    public ResolutionResult resolveReferences(TerragruntFile file, PathEvaluationContext context) {
        List<ParseError> errors = new ArrayList<>();
        Path self = Path.of(file.path()).toAbsolutePath().normalize();

        List<ResolvedInclude> includes = new ArrayList<>();
        for (IncludeBlock block : file.includeBlocks()) {
            includes.add(resolveInclude(block, context, self, errors));
        }

        List<ResolvedDependency> dependencies = new ArrayList<>();
        for (DependencyBlock block : file.dependencyBlocks()) {
            List<String> outputs = outputsUsed(file, block.name());
            dependencies.add(resolveDependency(block.name(), block.configPath(), outputs,
                block.location(), context, self, errors));
        }
        for (DependenciesBlock block : file.blocksOf(DependenciesBlock.class)) {
            for (HclExpression pathExpr : block.pathExpressions()) {
                dependencies.add(resolveDependency("", pathExpr, List.of(),
                    block.location(), context, self, errors));
            }
        }

        log.debug("Resolved {}: {} includes, {} dependencies, {} findings",
            file.path(), includes.size(), dependencies.size(), errors.size());
        return new ResolutionResult(includes, dependencies, errors);
    }

    /**
     * Builds the evaluation context of a file: its directory, the repository root found by
     * walking up to a {@code .git} entry, and its locals.
     *
     * @param file parsed file
     * @return context
     */
    public PathEvaluationContext createContext(TerragruntFile file) {
        Path dir = directoryOf(file);
        return PathEvaluationContext.of(dir, findRepoRoot(dir).orElse(null), locals(file));
    }

    /**
     * Walks up from a directory looking for a {@code .git} entry.
     *
     * @param startDir starting directory
     * @return repository root, or empty
     */
    public Optional<Path> findRepoRoot(Path startDir) {
        Path current = startDir.toAbsolutePath().normalize();
        while (current != null) {
            if (fileSystem.exists(current.resolve(GIT_DIR))) {
                return Optional.of(current);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    public PathEvaluator getPathEvaluator() {
        return pathEvaluator;
    }

    /**
     * Collects the {@code locals} of a file; later blocks override earlier ones.
     *
     * @param file parsed file
     * @return locals by name
     */
    public static Map<String, HclExpression> locals(TerragruntFile file) {
        Map<String, HclExpression> locals = new LinkedHashMap<>();
        file.blocksOf(LocalsBlock.class).forEach(block -> locals.putAll(block.variables()));
        return locals;
    }

    /**
     * Lists the output keys read through {@code dependency.<name>.outputs.<key>} anywhere in a file.
     *
     * @param file parsed file
     * @param dependencyName dependency name
     * @return distinct output keys in order of appearance
     */
    public static List<String> outputsUsed(TerragruntFile file, String dependencyName) {
        Set<String> outputs = new LinkedHashSet<>();
        for (TerragruntBlock block : file.blocks()) {
            for (HclExpression expr : BlockExpressions.of(block)) {
                ReferenceExtractor.extractReferences(expr, ReferenceType.DEPENDENCY).stream()
                    .filter(ref -> ref.name().filter(dependencyName::equals).isPresent())
                    .forEach(ref -> ref.dependencyOutput().ifPresent(outputs::add));
            }
        }
        return List.copyOf(outputs);
    }

    // ==================== Per-entry resolution ====================

    private ResolvedInclude resolveInclude(
            IncludeBlock block, PathEvaluationContext context, Path self, List<ParseError> errors) {
        PathEvaluation evaluation = pathEvaluator.evaluate(block.path(), context);
        if (!evaluation.isResolved()) {
            ErrorCode code = failureCode(evaluation.failure(), ErrorCode.INCLUDE_NOT_FOUND);
            errors.add(finding(code, "Cannot resolve include '" + block.label() + "': " + evaluation.reason(),
                block.location()));
            log.warn("Include '{}' in {} unresolved: {}", block.label(), self, evaluation.reason());
            return ResolvedInclude.failed(block, evaluation.reason());
        }

        Path target = Path.of(evaluation.path());
        if (target.equals(self)) {
            String reason = "File includes itself";
            errors.add(finding(ErrorCode.CIRCULAR_INCLUDE, "Circular include detected: " + target, block.location()));
            return ResolvedInclude.failed(block, reason);
        }
        if (resolveFileSystem && !fileSystem.isRegularFile(target)) {
            String reason = "Include file not found: " + target;
            errors.add(finding(ErrorCode.INCLUDE_NOT_FOUND, reason, block.location()));
            log.warn("{} (from {})", reason, self);
            return ResolvedInclude.failed(block, reason);
        }
        return ResolvedInclude.of(block, target.toString());
    }

    private ResolvedDependency resolveDependency(
            String name,
            HclExpression configPath,
            List<String> outputs,
            SourceLocation location,
            PathEvaluationContext context,
            Path self,
            List<ParseError> errors) {
        String label = name.isEmpty() ? "dependencies entry" : "dependency '" + name + "'";
        PathEvaluation evaluation = pathEvaluator.evaluate(configPath, context);
        if (!evaluation.isResolved()) {
            ErrorCode code = failureCode(evaluation.failure(), ErrorCode.DEPENDENCY_NOT_FOUND);
            errors.add(finding(code, "Cannot resolve " + label + ": " + evaluation.reason(), location));
            log.warn("{} in {} unresolved: {}", label, self, evaluation.reason());
            return ResolvedDependency.failed(name, configPath, outputs, evaluation.reason());
        }

        Path target = configFileOf(Path.of(evaluation.path()));
        if (target.equals(self)) {
            errors.add(finding(ErrorCode.CIRCULAR_DEPENDENCY, "Circular dependency detected: " + target, location));
            return ResolvedDependency.failed(name, configPath, outputs, "File depends on itself");
        }
        if (resolveFileSystem && !fileSystem.isRegularFile(target)) {
            String reason = "Dependency not found: " + target;
            errors.add(finding(ErrorCode.DEPENDENCY_NOT_FOUND, reason, location));
            log.warn("{} (from {})", reason, self);
            return ResolvedDependency.failed(name, configPath, outputs, reason);
        }
        return ResolvedDependency.of(name, configPath, target.toString(), outputs);
    }

    /**
     * Maps a dependency target to its config file: directories mean {@code <dir>/terragrunt.hcl}.
     */
    private Path configFileOf(Path target) {
        if (resolveFileSystem) {
            return fileSystem.isDirectory(target) ? target.resolve(TerragruntFileDetector.TERRAGRUNT_FILE_NAME) : target;
        }
        Path fileName = target.getFileName();
        boolean looksLikeFile = fileName != null && fileName.toString().endsWith(".hcl");
        return looksLikeFile ? target : target.resolve(TerragruntFileDetector.TERRAGRUNT_FILE_NAME);
    }

    private static ErrorCode failureCode(PathEvaluation.Failure failure, ErrorCode notFound) {
        return switch (failure) {
            case NOT_FOUND -> notFound;
            case DEPTH_EXCEEDED -> ErrorCode.MAX_DEPTH_EXCEEDED;
            case UNRESOLVABLE -> ErrorCode.UNRESOLVED_PATH;
        };
    }

    private static ParseError finding(ErrorCode code, String message, SourceLocation location) {
        return new ParseError(message, location, code.defaultSeverity(), code);
    }

    private static Path directoryOf(TerragruntFile file) {
        Path parent = Path.of(file.path()).toAbsolutePath().normalize().getParent();
        return parent == null ? Path.of("").toAbsolutePath() : parent;
    }
}
