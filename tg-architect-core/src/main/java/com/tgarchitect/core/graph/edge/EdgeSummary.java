package com.tgarchitect.core.graph.edge;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts over one batch of edges.
 *
 * @param total edges created
 * @param byType edges per type, every type present
 * @param averageConfidence mean aggregated confidence, 0 when no edges were created
 * @param errorCount rejected requests
 */
public record EdgeSummary(
    int total,
    Map<EdgeType, Integer> byType,
    double averageConfidence,
    int errorCount
) {
    public EdgeSummary {
        byType = Collections.unmodifiableMap(new EnumMap<>(byType));
    }

    public static EdgeSummary of(Collection<TgEdge> edges, int errorCount) {
        Map<EdgeType, Integer> byType = new EnumMap<>(EdgeType.class);
        for (EdgeType type : EdgeType.values()) {
            byType.put(type, 0);
        }
        edges.forEach(edge -> byType.merge(edge.type(), 1, Integer::sum));
        double average = edges.stream().mapToInt(TgEdge::aggregatedConfidence).average().orElse(0);
        return new EdgeSummary(edges.size(), byType, average, errorCount);
    }
}
