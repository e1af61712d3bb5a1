package com.tgarchitect.core.model.block;

import com.tgarchitect.core.expression.HclExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lists the expressions held by a block, for reference and function scans.
 */
public final class BlockExpressions {

    private BlockExpressions() {
        // Utility class
    }

    /**
     * Returns the top-level expressions of a block. Nested expressions are reachable
     * through {@link HclExpression#children()}.
     *
     * @param block block
     * @return expressions in declaration order, without nulls
     */
    public static List<HclExpression> of(TerragruntBlock block) {
        List<HclExpression> result = new ArrayList<>();
        if (block instanceof TerraformBlock terraform) {
            result.add(terraform.source());
            terraform.extraArguments().forEach(args -> result.addAll(args.envVars().values()));
        } else if (block instanceof RemoteStateBlock remoteState) {
            result.addAll(remoteState.config().values());
        } else if (block instanceof IncludeBlock include) {
            result.add(include.path());
        } else if (block instanceof LocalsBlock locals) {
            result.addAll(locals.variables().values());
        } else if (block instanceof DependencyBlock dependency) {
            result.add(dependency.configPath());
            result.addAll(dependency.mockOutputs().values());
        } else if (block instanceof DependenciesBlock dependencies) {
            result.add(dependencies.paths());
        } else if (block instanceof GenerateBlock generate) {
            result.add(generate.path());
            result.add(generate.contents());
        } else if (block instanceof InputsBlock inputs) {
            result.addAll(inputs.values().values());
        } else if (block instanceof IamRoleBlock iamRole) {
            result.add(iamRole.roleArn());
            result.add(iamRole.webIdentityToken());
        } else if (block instanceof GenericBlock generic) {
            result.addAll(generic.attributes().values());
        }
        result.removeIf(Objects::isNull);
        return result;
    }
}
