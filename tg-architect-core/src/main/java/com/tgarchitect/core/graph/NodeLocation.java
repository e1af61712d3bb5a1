package com.tgarchitect.core.graph;

import java.util.Objects;

/**
 * Where a node is declared.
 *
 * @param file repository-relative file path, or the absolute path when configured so
 * @param lineStart first line
 * @param lineEnd last line
 */
public record NodeLocation(
    String file,
    int lineStart,
    int lineEnd
) {
    public NodeLocation {
        Objects.requireNonNull(file, "file must not be null");
        if (lineStart < 1) {
            lineStart = 1;
        }
        if (lineEnd < lineStart) {
            lineEnd = lineStart;
        }
    }
}
