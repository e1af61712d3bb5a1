package com.tgarchitect.core.hierarchy;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.expression.HclExpression.ObjectExpr;
import com.tgarchitect.core.model.MergeStrategy;
import com.tgarchitect.core.model.ResolvedDependency;
import com.tgarchitect.core.model.TerragruntFile;
import com.tgarchitect.core.model.block.InputsBlock;
import com.tgarchitect.core.model.block.LocalsBlock;
import com.tgarchitect.core.model.block.RemoteStateBlock;
import com.tgarchitect.core.model.block.TerraformBlock;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Overlays ancestor configuration onto a file following each include's merge strategy.
 *
 * <ul>
 *   <li>{@code no_merge}: the ancestor contributes nothing</li>
 *   <li>{@code shallow}: ancestor keys fill in top-level keys the child does not define</li>
 *   <li>{@code deep}: nested objects are merged recursively; the child wins conflicts</li>
 * </ul>
 */
final class ConfigMerger {

    private ConfigMerger() {
        // Utility class
    }

    static MergedConfiguration merge(HierarchyNode node) {
        Layer layer = mergeLayer(node);
        return new MergedConfiguration(
            node.path(),
            layer.locals,
            layer.inputs,
            layer.remoteState,
            layer.terraform,
            layer.dependencies,
            new MergeTrace(layer.trace));
    }

    private static Layer mergeLayer(HierarchyNode node) {
        Layer result = Layer.of(node.path(), node.file());
        for (HierarchyNode parent : node.parents()) {
            MergeStrategy strategy = parent.mergeStrategy() == null ? MergeStrategy.NO_MERGE : parent.mergeStrategy();
            if (strategy == MergeStrategy.NO_MERGE) {
                continue;
            }
            result = overlay(mergeLayer(parent), result, strategy == MergeStrategy.DEEP);
        }
        return result;
    }

    private static Layer overlay(Layer parent, Layer child, boolean deep) {
        Layer merged = new Layer();

        mergeMap("locals.", parent.locals, child.locals, parent.trace, child.trace, deep, merged.locals, merged.trace);
        mergeMap("inputs.", parent.inputs, child.inputs, parent.trace, child.trace, deep, merged.inputs, merged.trace);

        if (child.remoteState != null) {
            merged.remoteState = deep && parent.remoteState != null
                ? mergeRemoteState(parent.remoteState, child.remoteState)
                : child.remoteState;
            merged.trace.put(MergeTrace.REMOTE_STATE, child.trace.get(MergeTrace.REMOTE_STATE));
        } else if (parent.remoteState != null) {
            merged.remoteState = parent.remoteState;
            merged.trace.put(MergeTrace.REMOTE_STATE, parent.trace.get(MergeTrace.REMOTE_STATE));
        }

        if (child.terraform != null) {
            merged.terraform = deep && parent.terraform != null
                ? mergeTerraform(parent.terraform, child.terraform)
                : child.terraform;
            merged.trace.put(MergeTrace.TERRAFORM, child.trace.get(MergeTrace.TERRAFORM));
        } else if (parent.terraform != null) {
            merged.terraform = parent.terraform;
            merged.trace.put(MergeTrace.TERRAFORM, parent.trace.get(MergeTrace.TERRAFORM));
        }

        merged.dependencies.addAll(child.dependencies);
        Set<String> known = new LinkedHashSet<>();
        child.dependencies.forEach(dep -> known.add(dependencyKey(dep)));
        parent.dependencies.stream()
            .filter(dep -> known.add(dependencyKey(dep)))
            .forEach(merged.dependencies::add);
        return merged;
    }

    private static void mergeMap(
            String prefix,
            Map<String, HclExpression> parent,
            Map<String, HclExpression> child,
            Map<String, String> parentTrace,
            Map<String, String> childTrace,
            boolean deep,
            Map<String, HclExpression> target,
            Map<String, String> targetTrace) {
        parent.forEach((key, value) -> {
            target.put(key, value);
            targetTrace.put(prefix + key, parentTrace.get(prefix + key));
        });
        child.forEach((key, value) -> {
            HclExpression existing = target.get(key);
            target.put(key, deep ? deepMerge(existing, value) : value);
            targetTrace.put(prefix + key, childTrace.get(prefix + key));
        });
    }

    static HclExpression deepMerge(HclExpression parent, HclExpression child) {
        if (parent instanceof ObjectExpr parentObject && child instanceof ObjectExpr childObject) {
            return new ObjectExpr(deepMerge(parentObject.attributes(), childObject.attributes()), "");
        }
        return child;
    }

    private static Map<String, HclExpression> deepMerge(
            Map<String, HclExpression> parent, Map<String, HclExpression> child) {
        Map<String, HclExpression> result = new LinkedHashMap<>(parent);
        child.forEach((key, value) -> result.put(key, deepMerge(result.get(key), value)));
        return result;
    }

    private static RemoteStateBlock mergeRemoteState(RemoteStateBlock parent, RemoteStateBlock child) {
        return new RemoteStateBlock(
            child.hasBackend() ? child.backend() : parent.backend(),
            child.generate() != null ? child.generate() : parent.generate(),
            deepMerge(parent.config(), child.config()),
            child.disableInit(),
            child.disableDependencyOptimization(),
            child.location(),
            child.raw());
    }

    private static TerraformBlock mergeTerraform(TerraformBlock parent, TerraformBlock child) {
        return new TerraformBlock(
            child.source() != null ? child.source() : parent.source(),
            concat(parent.extraArguments(), child.extraArguments()),
            concat(parent.beforeHooks(), child.beforeHooks()),
            concat(parent.afterHooks(), child.afterHooks()),
            concat(parent.errorHooks(), child.errorHooks()),
            List.copyOf(new LinkedHashSet<>(concat(parent.includeInCopy(), child.includeInCopy()))),
            child.location(),
            child.raw());
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        List<T> result = new ArrayList<>(first);
        result.addAll(second);
        return result;
    }

    private static String dependencyKey(ResolvedDependency dependency) {
        return dependency.name().isEmpty()
            ? "path:" + dependency.resolvedPath()
            : "name:" + dependency.name();
    }

    /**
     * Mutable accumulator for one level of the merge.
     */
    private static final class Layer {
        private final Map<String, HclExpression> locals = new LinkedHashMap<>();
        private final Map<String, HclExpression> inputs = new LinkedHashMap<>();
        private final List<ResolvedDependency> dependencies = new ArrayList<>();
        private final Map<String, String> trace = new LinkedHashMap<>();
        private RemoteStateBlock remoteState;
        private TerraformBlock terraform;

        static Layer of(String path, TerragruntFile file) {
            Layer layer = new Layer();
            for (LocalsBlock block : file.blocksOf(LocalsBlock.class)) {
                block.variables().forEach((key, value) -> {
                    layer.locals.put(key, value);
                    layer.trace.put("locals." + key, path);
                });
            }
            for (InputsBlock block : file.blocksOf(InputsBlock.class)) {
                block.values().forEach((key, value) -> {
                    layer.inputs.put(key, value);
                    layer.trace.put("inputs." + key, path);
                });
            }
            file.remoteStateBlock().ifPresent(block -> {
                layer.remoteState = block;
                layer.trace.put(MergeTrace.REMOTE_STATE, path);
            });
            file.terraformBlock().ifPresent(block -> {
                layer.terraform = block;
                layer.trace.put(MergeTrace.TERRAFORM, path);
            });
            layer.dependencies.addAll(file.dependencies());
            return layer;
        }
    }
}
