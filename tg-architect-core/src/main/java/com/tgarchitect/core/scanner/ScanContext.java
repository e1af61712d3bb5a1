package com.tgarchitect.core.scanner;

import com.tgarchitect.core.config.ParserConfig;
import com.tgarchitect.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Inputs of one scan run.
 *
 * @param rootPath directory to scan; node locations are relative to it
 * @param scanId scan identifier, a random UUID when null
 * @param maxConcurrency parser threads, the processor count when below 1
 * @param cancelled checked between files; returning true stops the scan
 */
public record ScanContext(
    Path rootPath,
    String scanId,
    int maxConcurrency,
    BooleanSupplier cancelled
) {
    public ScanContext {
        Objects.requireNonNull(rootPath, "rootPath must not be null");
        rootPath = rootPath.toAbsolutePath().normalize();
        if (scanId == null || scanId.isBlank()) {
            scanId = UUID.randomUUID().toString();
        }
        if (maxConcurrency < 1) {
            maxConcurrency = Runtime.getRuntime().availableProcessors();
        }
        if (cancelled == null) {
            cancelled = () -> false;
        }
    }

    public static ScanContext of(Path rootPath) {
        return new ScanContext(rootPath, null, 0, null);
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }

    /**
     * Finds candidate files under the root using the parser's file and exclude patterns.
     *
     * @param config parser settings
     * @return candidate files
     * @throws IOException if directory traversal fails
     */
    public List<Path> findFiles(ParserConfig config) throws IOException {
        return FileUtils.findFiles(rootPath, config.filePatterns(), config.excludePatterns(),
            config.followSymlinks(), config.maxScanDepth());
    }
}
