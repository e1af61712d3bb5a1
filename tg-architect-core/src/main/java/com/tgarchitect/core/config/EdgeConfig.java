package com.tgarchitect.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Edge factory settings.
 *
 * @param explicitConfidence confidence of explicit evidence (default 100)
 * @param inferredConfidence confidence of inferred evidence (default 85)
 * @param heuristicConfidence confidence of heuristic evidence (default 70)
 * @param maxEvidencePerEdge evidence items kept per edge (default 10)
 * @param createContainmentEdges whether directory containment edges are created
 * @param validateOnCreate whether edges are validated when created
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EdgeConfig(
    @JsonProperty("explicitConfidence") Integer explicitConfidence,
    @JsonProperty("inferredConfidence") Integer inferredConfidence,
    @JsonProperty("heuristicConfidence") Integer heuristicConfidence,
    @JsonProperty("maxEvidencePerEdge") Integer maxEvidencePerEdge,
    @JsonProperty("createContainmentEdges") Boolean createContainmentEdges,
    @JsonProperty("validateOnCreate") Boolean validateOnCreate
) {
    public static final int DEFAULT_EXPLICIT_CONFIDENCE = 100;
    public static final int DEFAULT_INFERRED_CONFIDENCE = 85;
    public static final int DEFAULT_HEURISTIC_CONFIDENCE = 70;
    public static final int DEFAULT_MAX_EVIDENCE_PER_EDGE = 10;

    public EdgeConfig {
        explicitConfidence = explicitConfidence == null ? DEFAULT_EXPLICIT_CONFIDENCE : explicitConfidence;
        inferredConfidence = inferredConfidence == null ? DEFAULT_INFERRED_CONFIDENCE : inferredConfidence;
        heuristicConfidence = heuristicConfidence == null ? DEFAULT_HEURISTIC_CONFIDENCE : heuristicConfidence;
        maxEvidencePerEdge = maxEvidencePerEdge == null ? DEFAULT_MAX_EVIDENCE_PER_EDGE : maxEvidencePerEdge;
        createContainmentEdges = createContainmentEdges == null ? Boolean.FALSE : createContainmentEdges;
        validateOnCreate = validateOnCreate == null ? Boolean.TRUE : validateOnCreate;
    }

    public static EdgeConfig defaults() {
        return new EdgeConfig(null, null, null, null, null, null);
    }

    public EdgeConfig withConfidences(Integer explicit, Integer inferred, Integer heuristic) {
        return new EdgeConfig(explicit, inferred, heuristic,
            maxEvidencePerEdge, createContainmentEdges, validateOnCreate);
    }

    public EdgeConfig withMaxEvidencePerEdge(Integer value) {
        return new EdgeConfig(explicitConfidence, inferredConfidence, heuristicConfidence,
            value, createContainmentEdges, validateOnCreate);
    }

    public EdgeConfig withCreateContainmentEdges(Boolean value) {
        return new EdgeConfig(explicitConfidence, inferredConfidence, heuristicConfidence,
            maxEvidencePerEdge, value, validateOnCreate);
    }

    public EdgeConfig withValidateOnCreate(Boolean value) {
        return new EdgeConfig(explicitConfidence, inferredConfidence, heuristicConfidence,
            maxEvidencePerEdge, createContainmentEdges, value);
    }
}
