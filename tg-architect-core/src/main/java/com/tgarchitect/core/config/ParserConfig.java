package com.tgarchitect.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parsing, file scanning, node creation and caching settings.
 *
 * <p>Every field is optional in YAML; missing values take the documented default.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * parser:
 *   maxIncludeDepth: 5
 *   errorRecovery: false
 *   excludePatterns:
 *     - .terragrunt-cache
 *     - archived
 * }</pre>
 *
 * @param maxIncludeDepth maximum include chain length, 1 to 50 (default 10)
 * @param resolveFileSystem whether includes and dependencies are resolved against the filesystem
 * @param parseGenerateBlocks whether generate blocks are kept
 * @param extractDependencyHints whether dependency and include hints are produced for edges
 * @param errorRecovery whether the parser continues after a malformed block
 * @param maxFileSize maximum file size in bytes (default 10MB)
 * @param encoding file encoding (default UTF-8)
 * @param includeRaw whether blocks and expressions keep their source text
 * @param filePatterns glob patterns of files to scan
 * @param excludePatterns directory or file names skipped while scanning
 * @param followSymlinks whether symbolic links are followed
 * @param maxScanDepth maximum directory depth, 0 for unbounded
 * @param generateRandomIds random node ids instead of deterministic hashes
 * @param nodeIdPrefix node id prefix
 * @param includeAbsolutePaths whether node metadata carries absolute paths
 * @param enableCache whether parsed files are cached
 * @param maxCacheSize maximum number of cached files
 * @param cacheTtlMs cache entry lifetime in milliseconds, 0 for no expiry
 * @param strictFunctions whether unknown Terragrunt-style functions are reported
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParserConfig(
    @JsonProperty("maxIncludeDepth") Integer maxIncludeDepth,
    @JsonProperty("resolveFileSystem") Boolean resolveFileSystem,
    @JsonProperty("parseGenerateBlocks") Boolean parseGenerateBlocks,
    @JsonProperty("extractDependencyHints") Boolean extractDependencyHints,
    @JsonProperty("errorRecovery") Boolean errorRecovery,
    @JsonProperty("maxFileSize") Long maxFileSize,
    @JsonProperty("encoding") String encoding,
    @JsonProperty("includeRaw") Boolean includeRaw,
    @JsonProperty("filePatterns") List<String> filePatterns,
    @JsonProperty("excludePatterns") List<String> excludePatterns,
    @JsonProperty("followSymlinks") Boolean followSymlinks,
    @JsonProperty("maxScanDepth") Integer maxScanDepth,
    @JsonProperty("generateRandomIds") Boolean generateRandomIds,
    @JsonProperty("nodeIdPrefix") String nodeIdPrefix,
    @JsonProperty("includeAbsolutePaths") Boolean includeAbsolutePaths,
    @JsonProperty("enableCache") Boolean enableCache,
    @JsonProperty("maxCacheSize") Integer maxCacheSize,
    @JsonProperty("cacheTtlMs") Long cacheTtlMs,
    @JsonProperty("strictFunctions") Boolean strictFunctions
) {
    public static final int DEFAULT_MAX_INCLUDE_DEPTH = 10;
    public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024;
    public static final String DEFAULT_ENCODING = "UTF-8";
    public static final List<String> DEFAULT_FILE_PATTERNS = List.of("terragrunt.hcl", "*.hcl");
    public static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of(
        ".terragrunt-cache", ".terraform", "node_modules", ".git", "vendor");
    public static final String DEFAULT_NODE_ID_PREFIX = "tg-";
    public static final int DEFAULT_MAX_CACHE_SIZE = 1000;
    public static final long DEFAULT_CACHE_TTL_MS = 5 * 60 * 1000L;

    public ParserConfig {
        maxIncludeDepth = maxIncludeDepth == null ? DEFAULT_MAX_INCLUDE_DEPTH : maxIncludeDepth;
        resolveFileSystem = resolveFileSystem == null ? Boolean.TRUE : resolveFileSystem;
        parseGenerateBlocks = parseGenerateBlocks == null ? Boolean.TRUE : parseGenerateBlocks;
        extractDependencyHints = extractDependencyHints == null ? Boolean.TRUE : extractDependencyHints;
        errorRecovery = errorRecovery == null ? Boolean.TRUE : errorRecovery;
        maxFileSize = maxFileSize == null ? DEFAULT_MAX_FILE_SIZE : maxFileSize;
        encoding = encoding == null ? DEFAULT_ENCODING : encoding;
        includeRaw = includeRaw == null ? Boolean.TRUE : includeRaw;
        filePatterns = filePatterns == null ? DEFAULT_FILE_PATTERNS : List.copyOf(filePatterns);
        excludePatterns = excludePatterns == null ? DEFAULT_EXCLUDE_PATTERNS : List.copyOf(excludePatterns);
        followSymlinks = followSymlinks == null ? Boolean.FALSE : followSymlinks;
        maxScanDepth = maxScanDepth == null ? 0 : maxScanDepth;
        generateRandomIds = generateRandomIds == null ? Boolean.FALSE : generateRandomIds;
        nodeIdPrefix = nodeIdPrefix == null ? DEFAULT_NODE_ID_PREFIX : nodeIdPrefix;
        includeAbsolutePaths = includeAbsolutePaths == null ? Boolean.FALSE : includeAbsolutePaths;
        enableCache = enableCache == null ? Boolean.TRUE : enableCache;
        maxCacheSize = maxCacheSize == null ? DEFAULT_MAX_CACHE_SIZE : maxCacheSize;
        cacheTtlMs = cacheTtlMs == null ? DEFAULT_CACHE_TTL_MS : cacheTtlMs;
        strictFunctions = strictFunctions == null ? Boolean.FALSE : strictFunctions;
    }

    /**
     * Creates the default parser configuration.
     *
     * @return defaults
     */
    public static ParserConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxIncludeDepth(maxIncludeDepth)
            .resolveFileSystem(resolveFileSystem)
            .parseGenerateBlocks(parseGenerateBlocks)
            .extractDependencyHints(extractDependencyHints)
            .errorRecovery(errorRecovery)
            .maxFileSize(maxFileSize)
            .encoding(encoding)
            .includeRaw(includeRaw)
            .filePatterns(filePatterns)
            .excludePatterns(excludePatterns)
            .followSymlinks(followSymlinks)
            .maxScanDepth(maxScanDepth)
            .generateRandomIds(generateRandomIds)
            .nodeIdPrefix(nodeIdPrefix)
            .includeAbsolutePaths(includeAbsolutePaths)
            .enableCache(enableCache)
            .maxCacheSize(maxCacheSize)
            .cacheTtlMs(cacheTtlMs)
            .strictFunctions(strictFunctions);
    }

    /**
     * Fluent builder; unset fields take their defaults.
     */
    public static final class Builder {
        private Integer maxIncludeDepth;
        private Boolean resolveFileSystem;
        private Boolean parseGenerateBlocks;
        private Boolean extractDependencyHints;
        private Boolean errorRecovery;
        private Long maxFileSize;
        private String encoding;
        private Boolean includeRaw;
        private List<String> filePatterns;
        private List<String> excludePatterns;
        private Boolean followSymlinks;
        private Integer maxScanDepth;
        private Boolean generateRandomIds;
        private String nodeIdPrefix;
        private Boolean includeAbsolutePaths;
        private Boolean enableCache;
        private Integer maxCacheSize;
        private Long cacheTtlMs;
        private Boolean strictFunctions;

        private Builder() {
        }

        public Builder maxIncludeDepth(Integer value) {
            this.maxIncludeDepth = value;
            return this;
        }

        public Builder resolveFileSystem(Boolean value) {
            this.resolveFileSystem = value;
            return this;
        }

        public Builder parseGenerateBlocks(Boolean value) {
            this.parseGenerateBlocks = value;
            return this;
        }

        public Builder extractDependencyHints(Boolean value) {
            this.extractDependencyHints = value;
            return this;
        }

        public Builder errorRecovery(Boolean value) {
            this.errorRecovery = value;
            return this;
        }

        public Builder maxFileSize(Long value) {
            this.maxFileSize = value;
            return this;
        }

        public Builder encoding(String value) {
            this.encoding = value;
            return this;
        }

        public Builder includeRaw(Boolean value) {
            this.includeRaw = value;
            return this;
        }

        public Builder filePatterns(List<String> value) {
            this.filePatterns = value;
            return this;
        }

        public Builder excludePatterns(List<String> value) {
            this.excludePatterns = value;
            return this;
        }

        public Builder followSymlinks(Boolean value) {
            this.followSymlinks = value;
            return this;
        }

        public Builder maxScanDepth(Integer value) {
            this.maxScanDepth = value;
            return this;
        }

        public Builder generateRandomIds(Boolean value) {
            this.generateRandomIds = value;
            return this;
        }

        public Builder nodeIdPrefix(String value) {
            this.nodeIdPrefix = value;
            return this;
        }

        public Builder includeAbsolutePaths(Boolean value) {
            this.includeAbsolutePaths = value;
            return this;
        }

        public Builder enableCache(Boolean value) {
            this.enableCache = value;
            return this;
        }

        public Builder maxCacheSize(Integer value) {
            this.maxCacheSize = value;
            return this;
        }

        public Builder cacheTtlMs(Long value) {
            this.cacheTtlMs = value;
            return this;
        }

        public Builder strictFunctions(Boolean value) {
            this.strictFunctions = value;
            return this;
        }

        public ParserConfig build() {
            return new ParserConfig(maxIncludeDepth, resolveFileSystem, parseGenerateBlocks,
                extractDependencyHints, errorRecovery, maxFileSize, encoding, includeRaw,
                filePatterns, excludePatterns, followSymlinks, maxScanDepth, generateRandomIds,
                nodeIdPrefix, includeAbsolutePaths, enableCache, maxCacheSize, cacheTtlMs,
                strictFunctions);
        }
    }
}
