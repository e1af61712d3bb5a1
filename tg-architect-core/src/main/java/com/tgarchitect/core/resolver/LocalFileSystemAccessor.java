package com.tgarchitect.core.resolver;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link FileSystemAccessor} backed by the default filesystem.
 */
public class LocalFileSystemAccessor implements FileSystemAccessor {

    @Override
    public boolean exists(Path path) {
        return Files.exists(path);
    }

    @Override
    public boolean isDirectory(Path path) {
        return Files.isDirectory(path);
    }

    @Override
    public boolean isRegularFile(Path path) {
        return Files.isRegularFile(path);
    }
}
