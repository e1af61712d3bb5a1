package com.tgarchitect.core.hierarchy;

import com.tgarchitect.core.error.CycleException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Cycle found in a dependency graph.
 *
 * @param cycle node path around the cycle; the first node is repeated at the end
 */
public record CycleError(List<String> cycle) {

    public CycleError {
        if (cycle == null || cycle.isEmpty()) {
            throw new IllegalArgumentException("cycle must not be empty");
        }
        cycle = List.copyOf(cycle);
    }

    /**
     * Distinct nodes on the cycle.
     *
     * @return members in cycle order
     */
    public Set<String> members() {
        return new LinkedHashSet<>(cycle);
    }

    public String message() {
        return "Circular dependency: " + String.join(" -> ", cycle);
    }

    public CycleException toException() {
        return new CycleException(cycle);
    }
}
