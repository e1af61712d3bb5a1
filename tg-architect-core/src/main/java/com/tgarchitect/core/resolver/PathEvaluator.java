package com.tgarchitect.core.resolver;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.expression.HclExpression.FunctionCall;
import com.tgarchitect.core.expression.HclExpression.Literal;
import com.tgarchitect.core.expression.HclExpression.Reference;
import com.tgarchitect.core.expression.HclExpression.Template;
import com.tgarchitect.core.expression.HclValues;
import com.tgarchitect.core.resolver.PathEvaluation.Failure;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Statically evaluates the path expressions found in {@code include}, {@code dependency}
 * and {@code dependencies} blocks.
 *
 * <p>Supported forms are string literals, templates, {@code local.<name>} references and the
 * path functions {@code find_in_parent_folders}, {@code get_terragrunt_dir},
 * {@code get_original_terragrunt_dir}, {@code get_parent_terragrunt_dir},
 * {@code get_repo_root}, {@code get_path_to_repo_root} and {@code get_path_from_repo_root}.
 * Anything else is reported as {@link Failure#UNRESOLVABLE}.
 *
 * <p>Results are absolute and normalized; relative values are resolved against the
 * context's {@code terragruntDir}.
 *
 * @since 1.0.0
 */
public class PathEvaluator {

    static final String DEFAULT_PARENT_FILE = "terragrunt.hcl";

    private final FileSystemAccessor fileSystem;
    private final int maxDepth;
    private final boolean resolveFileSystem;

    /**
     * @param fileSystem filesystem used by {@code find_in_parent_folders}
     * @param maxDepth maximum parent hops and nested local lookups
     * @param resolveFileSystem when false, {@code find_in_parent_folders} returns the first candidate unchecked
     */
    public PathEvaluator(FileSystemAccessor fileSystem, int maxDepth, boolean resolveFileSystem) {
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem must not be null");
        this.maxDepth = maxDepth;
        this.resolveFileSystem = resolveFileSystem;
    }

    /**
     * Evaluates a path expression to an absolute path.
     *
     * @param expr path expression, may be null
     * @param context evaluation context
     * @return evaluation outcome
     */
    public PathEvaluation evaluate(HclExpression expr, PathEvaluationContext context) {
        PathEvaluation text = evaluateText(expr, context, 0);
        if (!text.isResolved()) {
            return text;
        }
        return absolute(text.path(), context.terragruntDir());
    }

    private PathEvaluation evaluateText(HclExpression expr, PathEvaluationContext context, int depth) {
        if (HclValues.isNull(expr)) {
            return PathEvaluation.failed(Failure.UNRESOLVABLE, "Path is not set");
        }
        if (depth > maxDepth) {
            return PathEvaluation.failed(Failure.DEPTH_EXCEEDED,
                "Path expression nests deeper than " + maxDepth + " levels");
        }

        if (expr instanceof Literal literal) {
            if (literal.value() instanceof String s && !literal.opaque()) {
                return PathEvaluation.resolved(s);
            }
            return PathEvaluation.failed(Failure.UNRESOLVABLE, "Not a path: " + literal.raw());
        }
        if (expr instanceof Template template) {
            return evaluateTemplate(template, context, depth);
        }
        if (expr instanceof Reference reference) {
            return evaluateReference(reference, context, depth);
        }
        if (expr instanceof FunctionCall call) {
            return evaluateFunction(call, context, depth);
        }
        return PathEvaluation.failed(Failure.UNRESOLVABLE,
            "Cannot evaluate " + expr.kind().wireName() + " expression statically");
    }

    private PathEvaluation evaluateTemplate(Template template, PathEvaluationContext context, int depth) {
        StringBuilder sb = new StringBuilder();
        for (HclExpression part : template.parts()) {
            if (part instanceof Literal literal && !literal.opaque() && literal.value() != null) {
                sb.append(literal.value());
                continue;
            }
            PathEvaluation evaluated = evaluateText(part, context, depth + 1);
            if (!evaluated.isResolved()) {
                return evaluated;
            }
            sb.append(evaluated.path());
        }
        return PathEvaluation.resolved(sb.toString());
    }

    private PathEvaluation evaluateReference(Reference reference, PathEvaluationContext context, int depth) {
        if (!"local".equals(reference.root()) || reference.parts().size() != 2) {
            return PathEvaluation.failed(Failure.UNRESOLVABLE, "Cannot evaluate reference " + reference.path());
        }
        String name = reference.parts().get(1);
        HclExpression value = context.locals().get(name);
        if (value == null) {
            return PathEvaluation.failed(Failure.UNRESOLVABLE, "Unknown local '" + name + "'");
        }
        return evaluateText(value, context, depth + 1);
    }

    private PathEvaluation evaluateFunction(FunctionCall call, PathEvaluationContext context, int depth) {
        switch (call.name()) {
            case "find_in_parent_folders": {
                String fileName = DEFAULT_PARENT_FILE;
                if (!call.args().isEmpty()) {
                    PathEvaluation arg = evaluateText(call.args().get(0), context, depth + 1);
                    if (!arg.isResolved()) {
                        return arg;
                    }
                    fileName = arg.path();
                }
                return findInParentFolders(fileName, context.terragruntDir());
            }
            case "get_terragrunt_dir":
                return PathEvaluation.resolved(context.terragruntDir().toString());
            case "get_original_terragrunt_dir":
                return PathEvaluation.resolved(context.originalTerragruntDir().toString());
            case "get_parent_terragrunt_dir":
                return context.getParentTerragruntDir()
                    .map(dir -> PathEvaluation.resolved(dir.toString()))
                    .orElseGet(() -> PathEvaluation.failed(Failure.UNRESOLVABLE,
                        "get_parent_terragrunt_dir() used outside an include chain"));
            case "get_repo_root":
                return context.getRepoRoot()
                    .map(root -> PathEvaluation.resolved(root.toString()))
                    .orElseGet(PathEvaluator::noRepoRoot);
            case "get_path_to_repo_root":
                return context.getRepoRoot()
                    .map(root -> PathEvaluation.resolved(relative(context.terragruntDir(), root)))
                    .orElseGet(PathEvaluator::noRepoRoot);
            case "get_path_from_repo_root":
                return context.getRepoRoot()
                    .map(root -> PathEvaluation.resolved(relative(root, context.terragruntDir())))
                    .orElseGet(PathEvaluator::noRepoRoot);
            default:
                return PathEvaluation.failed(Failure.UNRESOLVABLE,
                    "Function '" + call.name() + "' cannot be evaluated statically");
        }
    }

    /**
     * Searches the parent directories of {@code startDir} for a file.
     *
     * @param fileName file name or relative path to look for
     * @param startDir directory whose parents are searched; the directory itself is skipped
     * @return absolute path of the first match
     */
    public PathEvaluation findInParentFolders(String fileName, Path startDir) {
        Path current = startDir.toAbsolutePath().normalize().getParent();
        int hops = 0;
        while (current != null) {
            if (hops >= maxDepth) {
                return PathEvaluation.failed(Failure.DEPTH_EXCEEDED,
                    "find_in_parent_folders(\"" + fileName + "\") exceeded " + maxDepth + " parent directories");
            }
            Path candidate;
            try {
                candidate = current.resolve(fileName).normalize();
            } catch (InvalidPathException e) {
                return PathEvaluation.failed(Failure.UNRESOLVABLE, "Invalid file name: " + fileName);
            }
            if (!resolveFileSystem || fileSystem.exists(candidate)) {
                return PathEvaluation.resolved(candidate.toString());
            }
            current = current.getParent();
            hops++;
        }
        return PathEvaluation.failed(Failure.NOT_FOUND,
            "find_in_parent_folders(\"" + fileName + "\") found no match above " + startDir);
    }

    private static PathEvaluation absolute(String text, Path baseDir) {
        try {
            Path path = Path.of(text);
            Path resolved = path.isAbsolute() ? path : baseDir.resolve(path);
            return PathEvaluation.resolved(resolved.normalize().toString());
        } catch (InvalidPathException e) {
            return PathEvaluation.failed(Failure.UNRESOLVABLE, "Invalid path: " + text);
        }
    }

    private static String relative(Path from, Path to) {
        String relative = from.relativize(to).toString();
        return relative.isEmpty() ? "." : relative;
    }

    private static PathEvaluation noRepoRoot() {
        return PathEvaluation.failed(Failure.UNRESOLVABLE, "Repository root is unknown");
    }
}
