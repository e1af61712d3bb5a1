package com.tgarchitect.core.config;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Range and consistency checks for {@link TerragruntConfig}.
 *
 * <p>Returns every issue found. Errors make the configuration unusable; warnings are
 * logged by callers and otherwise ignored.
 */
public final class ConfigValidator {

    static final int MAX_DEPTH_LIMIT = 50;
    static final long MIN_FILE_SIZE = 1024;
    static final long RECOMMENDED_MAX_FILE_SIZE = 100L * 1024 * 1024;
    static final int MAX_EVIDENCE_WARNING_THRESHOLD = 100;

    private static final Pattern NODE_ID_PREFIX = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_-]*$");

    private ConfigValidator() {
        // Utility class
    }

    public static List<ConfigValidationIssue> validate(TerragruntConfig config) {
        List<ConfigValidationIssue> issues = new ArrayList<>();
        validateParser(config.parser(), issues);
        validateEdge(config.edge(), issues);
        validateLinker(config.linker(), issues);
        return issues;
    }

    // ==================== Parser ====================

    static void validateParser(ParserConfig parser, List<ConfigValidationIssue> issues) {
        int depth = parser.maxIncludeDepth();
        if (depth < 1) {
            issues.add(ConfigValidationIssue.error("parser.maxIncludeDepth",
                "maxIncludeDepth must be at least 1", depth));
        } else if (depth > MAX_DEPTH_LIMIT) {
            issues.add(ConfigValidationIssue.error("parser.maxIncludeDepth",
                "maxIncludeDepth exceeds safe limit of " + MAX_DEPTH_LIMIT, depth));
        }

        if (parser.filePatterns().isEmpty()) {
            issues.add(ConfigValidationIssue.error("parser.filePatterns",
                "filePatterns must contain at least one pattern", parser.filePatterns()));
        }
        for (String pattern : parser.filePatterns()) {
            if (pattern == null || pattern.isBlank()) {
                issues.add(ConfigValidationIssue.error("parser.filePatterns",
                    "filePatterns contains an empty or whitespace-only pattern", pattern));
            }
        }
        for (String pattern : parser.excludePatterns()) {
            if (pattern == null || pattern.isBlank()) {
                issues.add(ConfigValidationIssue.warning("parser.excludePatterns",
                    "excludePatterns contains an empty or whitespace-only pattern", pattern));
            }
        }

        long fileSize = parser.maxFileSize();
        if (fileSize < MIN_FILE_SIZE) {
            issues.add(ConfigValidationIssue.error("parser.maxFileSize",
                "maxFileSize must be at least 1KB (1024 bytes)", fileSize));
        } else if (fileSize > RECOMMENDED_MAX_FILE_SIZE) {
            issues.add(ConfigValidationIssue.warning("parser.maxFileSize",
                "maxFileSize exceeds recommended limit of 100MB", fileSize));
        }

        if (parser.maxScanDepth() < 0) {
            issues.add(ConfigValidationIssue.error("parser.maxScanDepth",
                "maxScanDepth must be non-negative (0 = unlimited)", parser.maxScanDepth()));
        }
        if (parser.enableCache() && parser.maxCacheSize() < 1) {
            issues.add(ConfigValidationIssue.error("parser.maxCacheSize",
                "maxCacheSize must be at least 1 when caching is enabled", parser.maxCacheSize()));
        }
        if (parser.cacheTtlMs() < 0) {
            issues.add(ConfigValidationIssue.error("parser.cacheTtlMs",
                "cacheTtlMs must be non-negative (0 = no expiration)", parser.cacheTtlMs()));
        }
        if (!isSupportedEncoding(parser.encoding())) {
            issues.add(ConfigValidationIssue.error("parser.encoding",
                "Invalid encoding: " + parser.encoding(), parser.encoding()));
        }
        if (!parser.nodeIdPrefix().isEmpty() && !NODE_ID_PREFIX.matcher(parser.nodeIdPrefix()).matches()) {
            issues.add(ConfigValidationIssue.warning("parser.nodeIdPrefix",
                "nodeIdPrefix must start with a letter and contain only alphanumeric characters, "
                    + "underscores, and hyphens", parser.nodeIdPrefix()));
        }
    }

    private static boolean isSupportedEncoding(String encoding) {
        try {
            return Charset.isSupported(encoding);
        } catch (IllegalCharsetNameException e) {
            return false;
        }
    }

    // ==================== Edge ====================

    static void validateEdge(EdgeConfig edge, List<ConfigValidationIssue> issues) {
        checkConfidence("edge.explicitConfidence", edge.explicitConfidence(), issues);
        checkConfidence("edge.inferredConfidence", edge.inferredConfidence(), issues);
        checkConfidence("edge.heuristicConfidence", edge.heuristicConfidence(), issues);

        int maxEvidence = edge.maxEvidencePerEdge();
        if (maxEvidence < 1) {
            issues.add(ConfigValidationIssue.error("edge.maxEvidencePerEdge",
                "maxEvidencePerEdge must be at least 1", maxEvidence));
        } else if (maxEvidence > MAX_EVIDENCE_WARNING_THRESHOLD) {
            issues.add(ConfigValidationIssue.warning("edge.maxEvidencePerEdge",
                "maxEvidencePerEdge above " + MAX_EVIDENCE_WARNING_THRESHOLD + " may impact performance",
                maxEvidence));
        }
    }

    // ==================== Linker ====================

    static void validateLinker(LinkerConfig linker, List<ConfigValidationIssue> issues) {
        checkConfidence("linker.localSourceConfidence", linker.localSourceConfidence(), issues);
        checkConfidence("linker.externalSourceConfidence", linker.externalSourceConfidence(), issues);

        int depth = linker.maxRecursionDepth();
        if (depth < 1) {
            issues.add(ConfigValidationIssue.error("linker.maxRecursionDepth",
                "maxRecursionDepth must be at least 1", depth));
        } else if (depth > MAX_DEPTH_LIMIT) {
            issues.add(ConfigValidationIssue.error("linker.maxRecursionDepth",
                "maxRecursionDepth exceeds safe limit of " + MAX_DEPTH_LIMIT, depth));
        }
    }

    private static void checkConfidence(String field, int value, List<ConfigValidationIssue> issues) {
        if (value < 0 || value > 100) {
            issues.add(ConfigValidationIssue.error(field, field.substring(field.indexOf('.') + 1)
                + " must be between 0 and 100", value));
        }
    }
}
