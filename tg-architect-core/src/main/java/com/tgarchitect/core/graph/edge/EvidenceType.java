package com.tgarchitect.core.graph.edge;

import java.util.Locale;
import java.util.Optional;

/**
 * How an edge was established.
 */
public enum EvidenceType {
    /** Declared directly in configuration, e.g. an {@code include} block. */
    EXPLICIT,
    /** Derived from resolved references, e.g. an input wired to dependency outputs. */
    INFERRED,
    /** Guessed from naming or layout. */
    HEURISTIC;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<EvidenceType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (EvidenceType type : values()) {
            if (type.wireName().equals(value.strip().toLowerCase(Locale.ROOT))) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
