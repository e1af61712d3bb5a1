package com.tgarchitect.core.graph.edge;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Combines evidence confidences with harmonic rank decay.
 *
 * <p>Evidence is sorted by confidence, strongest first, and the item at rank {@code r}
 * (zero based) gets weight {@code 1/(r+1)}. The result is
 * {@code round(sum(confidence * weight) / sum(weight))}, capped at 100. No evidence yields 0.
 * The formula is persisted alongside graph data and must not change.
 *
 * @since 1.0.0
 */
public final class ConfidenceAggregator {

    /** Highest confidence value. */
    public static final int MAX_CONFIDENCE = 100;

    private ConfidenceAggregator() {
        // Utility class
    }

    public static int aggregate(Collection<TgEdgeEvidence> evidence) {
        if (evidence == null || evidence.isEmpty()) {
            return 0;
        }
        List<Integer> confidences = evidence.stream()
            .map(TgEdgeEvidence::confidence)
            .sorted(Comparator.reverseOrder())
            .toList();

        double weightedSum = 0;
        double totalWeight = 0;
        for (int rank = 0; rank < confidences.size(); rank++) {
            double weight = 1.0 / (rank + 1);
            weightedSum += confidences.get(rank) * weight;
            totalWeight += weight;
        }
        return (int) Math.min(MAX_CONFIDENCE, Math.round(weightedSum / totalWeight));
    }
}
