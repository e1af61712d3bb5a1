package com.tgarchitect.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * How an included configuration is combined with the including one.
 */
public enum MergeStrategy {
    /** Child configuration is used unchanged. */
    NO_MERGE,
    /** Top-level keys of the child replace those of the parent. */
    SHALLOW,
    /** Nested objects are merged recursively; child keys win. */
    DEEP;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the HCL spelling ({@code no_merge}, {@code shallow}, {@code deep}).
     *
     * @param value attribute value, may be null
     * @return strategy, or empty for unknown values
     */
    public static Optional<MergeStrategy> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MergeStrategy strategy : values()) {
            if (strategy.wireName().equals(value.strip().toLowerCase(Locale.ROOT))) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }
}
