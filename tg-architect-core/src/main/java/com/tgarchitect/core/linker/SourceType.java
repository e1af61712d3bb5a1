package com.tgarchitect.core.linker;

import java.util.Locale;

/**
 * Classification of a {@code terraform.source} string.
 */
public enum SourceType {
    LOCAL,
    REGISTRY,
    GIT,
    S3,
    GCS,
    HTTP,
    UNKNOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether the module lives outside the repository.
     *
     * @return true for every type except {@link #LOCAL}
     */
    public boolean isExternal() {
        return this != LOCAL;
    }
}
