package com.tgarchitect.core.resolver;

import com.tgarchitect.core.expression.ExpressionParser;
import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.resolver.PathEvaluation.Failure;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PathEvaluator} with an in-memory filesystem.
 */
class PathEvaluatorTest {

    private static final Path UNIT_DIR = Path.of("/repo/live/prod/app").toAbsolutePath();
    private static final Path REPO_ROOT = Path.of("/repo").toAbsolutePath();

    private final InMemoryFileSystem fileSystem = new InMemoryFileSystem();
    private final ExpressionParser expressions = new ExpressionParser();
    private final PathEvaluator evaluator = new PathEvaluator(fileSystem, 10, true);
    private final PathEvaluationContext context = PathEvaluationContext.of(UNIT_DIR, REPO_ROOT, Map.of());

    @Test
    void evaluate_relativeLiteral_isResolvedAgainstUnitDir() {
        PathEvaluation result = evaluator.evaluate(expr("\"../vpc\""), context);

        assertThat(result.isResolved()).isTrue();
        assertThat(result.path()).isEqualTo(REPO_ROOT.resolve("live/prod/vpc").toString());
    }

    @Test
    void evaluate_findInParentFolders_skipsOwnDirectory() {
        // Given
        fileSystem.add(UNIT_DIR.resolve("root.hcl"));
        fileSystem.add(REPO_ROOT.resolve("live/root.hcl"));

        // When
        PathEvaluation result = evaluator.evaluate(expr("find_in_parent_folders(\"root.hcl\")"), context);

        // Then
        assertThat(result.path()).isEqualTo(REPO_ROOT.resolve("live/root.hcl").toString());
    }

    @Test
    void evaluate_findInParentFoldersWithoutArgs_looksForTerragruntHcl() {
        fileSystem.add(REPO_ROOT.resolve("live/prod/terragrunt.hcl"));

        PathEvaluation result = evaluator.evaluate(expr("find_in_parent_folders()"), context);

        assertThat(result.path()).isEqualTo(REPO_ROOT.resolve("live/prod/terragrunt.hcl").toString());
    }

    @Test
    void findInParentFolders_noMatch_returnsNotFound() {
        PathEvaluation result = evaluator.findInParentFolders("absent.hcl", UNIT_DIR);

        assertThat(result.isResolved()).isFalse();
        assertThat(result.failure()).isEqualTo(Failure.NOT_FOUND);
    }

    @Test
    void findInParentFolders_beyondMaxDepth_returnsDepthExceeded() {
        PathEvaluator shallow = new PathEvaluator(fileSystem, 1, true);
        fileSystem.add(REPO_ROOT.resolve("root.hcl"));

        PathEvaluation result = shallow.findInParentFolders("root.hcl", UNIT_DIR);

        assertThat(result.failure()).isEqualTo(Failure.DEPTH_EXCEEDED);
    }

    @Test
    void evaluate_templateWithTerragruntDir_isConcatenated() {
        PathEvaluation result = evaluator.evaluate(expr("\"${get_terragrunt_dir()}/../db\""), context);

        assertThat(result.path()).isEqualTo(REPO_ROOT.resolve("live/prod/db").toString());
    }

    @Test
    void evaluate_repoRootFunctions_useContextRoot() {
        assertThat(evaluator.evaluate(expr("\"${get_repo_root()}/modules\""), context).path())
            .isEqualTo(REPO_ROOT.resolve("modules").toString());
        assertThat(evaluator.evaluate(expr("\"${get_path_to_repo_root()}/modules\""), context).path())
            .isEqualTo(REPO_ROOT.resolve("modules").toString());
    }

    @Test
    void evaluate_parentDirOutsideIncludeChain_isUnresolvable() {
        PathEvaluation result = evaluator.evaluate(expr("get_parent_terragrunt_dir()"), context);

        assertThat(result.failure()).isEqualTo(Failure.UNRESOLVABLE);
        assertThat(result.reason()).contains("include chain");
    }

    @Test
    void evaluate_parentDirInsideIncludeChain_usesParent() {
        PathEvaluationContext included = new PathEvaluationContext(
            UNIT_DIR, UNIT_DIR, REPO_ROOT, REPO_ROOT.resolve("live"), Map.of());

        PathEvaluation result = evaluator.evaluate(expr("get_parent_terragrunt_dir()"), included);

        assertThat(result.path()).isEqualTo(REPO_ROOT.resolve("live").toString());
    }

    @Test
    void evaluate_localChain_followsReferences() {
        Map<String, HclExpression> locals = Map.of(
            "base", expr("\"../shared\""),
            "target", expr("local.base"));

        PathEvaluation result = evaluator.evaluate(expr("local.target"), context.withLocals(locals));

        assertThat(result.path()).isEqualTo(REPO_ROOT.resolve("live/prod/shared").toString());
    }

    @Test
    void evaluate_selfReferencingLocal_stopsAtDepthLimit() {
        Map<String, HclExpression> locals = Map.of("loop", expr("local.loop"));

        PathEvaluation result = evaluator.evaluate(expr("local.loop"), context.withLocals(locals));

        assertThat(result.failure()).isEqualTo(Failure.DEPTH_EXCEEDED);
    }

    @Test
    void evaluate_unknownLocalOrNull_isUnresolvable() {
        assertThat(evaluator.evaluate(expr("local.nope"), context).failure()).isEqualTo(Failure.UNRESOLVABLE);
        assertThat(evaluator.evaluate(null, context).failure()).isEqualTo(Failure.UNRESOLVABLE);
    }

    private HclExpression expr(String text) {
        return expressions.parse(text);
    }

    private static final class InMemoryFileSystem implements FileSystemAccessor {
        private final Set<Path> files = new HashSet<>();

        void add(Path path) {
            files.add(path.toAbsolutePath().normalize());
        }

        @Override
        public boolean exists(Path path) {
            return files.contains(path.toAbsolutePath().normalize());
        }

        @Override
        public boolean isDirectory(Path path) {
            return false;
        }
    }
}
