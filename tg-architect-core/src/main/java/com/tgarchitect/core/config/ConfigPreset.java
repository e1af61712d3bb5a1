package com.tgarchitect.core.config;

import java.util.function.Supplier;

/**
 * Ready-made configurations for common situations.
 */
public enum ConfigPreset {
    /** Defaults. */
    DEFAULT(TerragruntConfig::defaults),

    /** Stops at the first error, no caching, shallow include chains. */
    STRICT(() -> TerragruntConfig.defaults().withParser(ParserConfig.builder()
        .errorRecovery(false)
        .enableCache(false)
        .maxIncludeDepth(5)
        .strictFunctions(true)
        .build())),

    /** Large cache with a long lifetime for big repositories. */
    PERFORMANCE(() -> TerragruntConfig.defaults().withParser(ParserConfig.builder()
        .enableCache(true)
        .maxCacheSize(5000)
        .cacheTtlMs(30 * 60 * 1000L)
        .maxIncludeDepth(20)
        .build())),

    /** Parses files in isolation without filesystem resolution or hints. */
    MINIMAL(() -> TerragruntConfig.defaults().withParser(ParserConfig.builder()
        .resolveFileSystem(false)
        .parseGenerateBlocks(false)
        .extractDependencyHints(false)
        .includeRaw(false)
        .enableCache(false)
        .build())),

    /** Tight resource bounds for untrusted input. */
    SAFE(() -> TerragruntConfig.defaults().withParser(ParserConfig.builder()
        .maxIncludeDepth(3)
        .maxFileSize(1024L * 1024)
        .maxScanDepth(10)
        .followSymlinks(false)
        .maxCacheSize(100)
        .build()));

    private final Supplier<TerragruntConfig> factory;

    ConfigPreset(Supplier<TerragruntConfig> factory) {
        this.factory = factory;
    }

    public TerragruntConfig config() {
        return factory.get();
    }
}
