package com.tgarchitect.core.hierarchy;

import com.tgarchitect.core.model.MergeStrategy;
import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.TerragruntFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One file in an include chain.
 *
 * @param path absolute file path
 * @param file parsed and resolved file
 * @param parents files this one includes
 * @param depth distance from the starting file (0 for the start)
 * @param includeLabels labels of this file's include blocks
 * @param mergeStrategy strategy the child uses to include this file, null for the starting file
 * @param errors cycle and depth findings for this node's includes
 */
public record HierarchyNode(
    String path,
    TerragruntFile file,
    List<HierarchyNode> parents,
    int depth,
    List<String> includeLabels,
    MergeStrategy mergeStrategy,
    List<ParseError> errors
) {
    public HierarchyNode {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(file, "file must not be null");
        parents = parents == null ? List.of() : List.copyOf(parents);
        includeLabels = includeLabels == null ? List.of() : List.copyOf(includeLabels);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Returns the hierarchy and file findings of this node and all of its ancestors.
     *
     * @return findings, nearest first
     */
    public List<ParseError> allErrors() {
        List<ParseError> all = new ArrayList<>(errors);
        all.addAll(file.errors());
        parents.forEach(parent -> all.addAll(parent.allErrors()));
        return all;
    }

    /**
     * Ancestors ordered oldest first, each listed once.
     *
     * @return ancestor nodes
     */
    public List<HierarchyNode> ancestors() {
        List<HierarchyNode> result = new ArrayList<>();
        collectAncestors(this, result);
        return result;
    }

    private static void collectAncestors(HierarchyNode node, List<HierarchyNode> result) {
        for (HierarchyNode parent : node.parents()) {
            if (result.stream().noneMatch(n -> n.path().equals(parent.path()))) {
                collectAncestors(parent, result);
                result.add(parent);
            }
        }
    }
}
