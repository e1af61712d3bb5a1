package com.tgarchitect.core.model;

/**
 * Position range inside a source file.
 *
 * <p>Lines and columns are 1-based. {@code file} may be {@code null} for text that was
 * parsed without a path (for example in-memory snippets).
 *
 * @param file file path, or null
 * @param line start line
 * @param column start column
 * @param endLine end line (inclusive)
 * @param endColumn end column (exclusive)
 */
public record SourceLocation(
    String file,
    int line,
    int column,
    int endLine,
    int endColumn
) {
    public SourceLocation {
        if (line < 1) {
            line = 1;
        }
        if (column < 1) {
            column = 1;
        }
        if (endLine < line) {
            endLine = line;
        }
        if (endLine == line && endColumn < column) {
            endColumn = column;
        }
    }

    /**
     * Creates a single-point location.
     *
     * @param file file path
     * @param line line
     * @param column column
     * @return location spanning one position
     */
    public static SourceLocation at(String file, int line, int column) {
        return new SourceLocation(file, line, column, line, column);
    }

    /**
     * Returns a copy of this location attributed to another file.
     *
     * @param newFile file path
     * @return relocated copy
     */
    public SourceLocation withFile(String newFile) {
        return new SourceLocation(newFile, line, column, endLine, endColumn);
    }

    @Override
    public String toString() {
        return (file != null ? file : "<input>") + ":" + line + ":" + column;
    }
}
