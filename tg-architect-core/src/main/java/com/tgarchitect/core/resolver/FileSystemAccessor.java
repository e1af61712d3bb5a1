package com.tgarchitect.core.resolver;

import java.nio.file.Path;

/**
 * Filesystem queries used during path resolution.
 *
 * <p>Separated from {@link java.nio.file.Files} so resolution can run against an
 * in-memory tree.
 */
public interface FileSystemAccessor {

    boolean exists(Path path);

    boolean isDirectory(Path path);

    default boolean isRegularFile(Path path) {
        return exists(path) && !isDirectory(path);
    }
}
