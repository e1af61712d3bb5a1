package com.tgarchitect.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Terraform source linker settings.
 *
 * @param createSyntheticNodes whether unresolved or external sources become synthetic module nodes
 * @param localSourceConfidence confidence of local source links (default 100)
 * @param externalSourceConfidence confidence of external source links (default 90)
 * @param maxRecursionDepth bound on chained module references (default 10)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LinkerConfig(
    @JsonProperty("createSyntheticNodes") Boolean createSyntheticNodes,
    @JsonProperty("localSourceConfidence") Integer localSourceConfidence,
    @JsonProperty("externalSourceConfidence") Integer externalSourceConfidence,
    @JsonProperty("maxRecursionDepth") Integer maxRecursionDepth
) {
    public static final int DEFAULT_LOCAL_SOURCE_CONFIDENCE = 100;
    public static final int DEFAULT_EXTERNAL_SOURCE_CONFIDENCE = 90;
    public static final int DEFAULT_MAX_RECURSION_DEPTH = 10;

    public LinkerConfig {
        createSyntheticNodes = createSyntheticNodes == null ? Boolean.TRUE : createSyntheticNodes;
        localSourceConfidence = localSourceConfidence == null ? DEFAULT_LOCAL_SOURCE_CONFIDENCE : localSourceConfidence;
        externalSourceConfidence = externalSourceConfidence == null
            ? DEFAULT_EXTERNAL_SOURCE_CONFIDENCE
            : externalSourceConfidence;
        maxRecursionDepth = maxRecursionDepth == null ? DEFAULT_MAX_RECURSION_DEPTH : maxRecursionDepth;
    }

    public static LinkerConfig defaults() {
        return new LinkerConfig(null, null, null, null);
    }
}
