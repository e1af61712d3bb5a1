package com.tgarchitect.core.graph.edge;

/**
 * Edge types written to graph storage.
 */
public enum EdgeType {
    INCLUDES("tg_includes", "includes"),
    DEPENDS_ON("tg_depends_on", "depends_on"),
    PASSES_INPUT("tg_passes_input", "passes"),
    SOURCES("tg_sources", "sources");

    private final String wireName;
    private final String labelPrefix;

    EdgeType(String wireName, String labelPrefix) {
        this.wireName = wireName;
        this.labelPrefix = labelPrefix;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Builds the edge label, e.g. {@code includes:root}.
     *
     * @param name include label, dependency name, input name or source type
     * @return label
     */
    public String label(String name) {
        return labelPrefix + ":" + name;
    }
}
