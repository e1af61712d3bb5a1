package com.tgarchitect.core.util;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files whose name matches one of the glob patterns.
     *
     * <p>Directories whose name matches an exclude pattern are not entered.
     *
     * @param rootPath root directory to search from
     * @param filePatterns file name globs, e.g. {@code terragrunt.hcl} or {@code *.hcl}
     * @param excludePatterns directory or file name globs to skip, e.g. {@code .terragrunt-cache}
     * @param followSymlinks whether symbolic links are followed
     * @param maxDepth maximum directory depth below the root, 0 for unbounded
     * @return matching files in walk order
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(
            Path rootPath,
            List<String> filePatterns,
            List<String> excludePatterns,
            boolean followSymlinks,
            int maxDepth) throws IOException {
        List<PathMatcher> includes = matchers(filePatterns);
        List<PathMatcher> excludes = matchers(excludePatterns);
        Set<FileVisitOption> options = followSymlinks
            ? EnumSet.of(FileVisitOption.FOLLOW_LINKS)
            : EnumSet.noneOf(FileVisitOption.class);
        int depth = maxDepth <= 0 ? Integer.MAX_VALUE : maxDepth;

        List<Path> found = new ArrayList<>();
        Files.walkFileTree(rootPath, options, depth, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(rootPath) && matchesAny(dir, excludes)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && matchesAny(file, includes) && !matchesAny(file, excludes)) {
                    found.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                // Unreadable entries and symlink loops are skipped.
                return FileVisitResult.CONTINUE;
            }
        });
        return found;
    }

    /**
     * Reads a file as a string.
     *
     * @param path path to file
     * @param charset file encoding
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readString(Path path, Charset charset) throws IOException {
        return Files.readString(path, charset);
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot + 1) : "";
    }

    private static List<PathMatcher> matchers(List<String> patterns) {
        List<PathMatcher> result = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern != null && !pattern.isBlank()) {
                result.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern.strip()));
            }
        }
        return result;
    }

    private static boolean matchesAny(Path path, List<PathMatcher> matchers) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }
}
