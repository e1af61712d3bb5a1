package com.tgarchitect.core.error;

import java.util.List;

/**
 * Dependency or include cycle.
 *
 * <p>The hierarchy service reports cycles as data inside the dependency graph; this
 * exception is only thrown by callers that require a fully ordered graph.
 */
public class CycleException extends TerragruntException {

    private final List<String> cycle;

    public CycleException(List<String> cycle) {
        super(ErrorCode.GRAPH_CYCLE, "Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
