package com.tgarchitect.core.resolver;

import com.tgarchitect.core.expression.HclExpression;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Values available when evaluating include and dependency paths.
 *
 * @param terragruntDir directory of the file being resolved
 * @param originalTerragruntDir directory of the file that started an include chain
 * @param repoRoot repository root, or null when unknown
 * @param parentTerragruntDir directory of the including parent, or null outside an include chain
 * @param locals {@code locals} of the file, unevaluated
 */
public record PathEvaluationContext(
    Path terragruntDir,
    Path originalTerragruntDir,
    Path repoRoot,
    Path parentTerragruntDir,
    Map<String, HclExpression> locals
) {
    public PathEvaluationContext {
        Objects.requireNonNull(terragruntDir, "terragruntDir must not be null");
        terragruntDir = terragruntDir.toAbsolutePath().normalize();
        originalTerragruntDir = originalTerragruntDir == null
            ? terragruntDir
            : originalTerragruntDir.toAbsolutePath().normalize();
        repoRoot = repoRoot == null ? null : repoRoot.toAbsolutePath().normalize();
        parentTerragruntDir = parentTerragruntDir == null ? null : parentTerragruntDir.toAbsolutePath().normalize();
        locals = locals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(locals));
    }

    /**
     * Creates a context for a file outside any include chain.
     *
     * @param terragruntDir directory of the file
     * @param repoRoot repository root, may be null
     * @param locals locals of the file
     * @return context
     */
    public static PathEvaluationContext of(Path terragruntDir, Path repoRoot, Map<String, HclExpression> locals) {
        return new PathEvaluationContext(terragruntDir, terragruntDir, repoRoot, null, locals);
    }

    public Optional<Path> getRepoRoot() {
        return Optional.ofNullable(repoRoot);
    }

    public Optional<Path> getParentTerragruntDir() {
        return Optional.ofNullable(parentTerragruntDir);
    }

    public PathEvaluationContext withLocals(Map<String, HclExpression> newLocals) {
        return new PathEvaluationContext(terragruntDir, originalTerragruntDir, repoRoot, parentTerragruntDir, newLocals);
    }
}
