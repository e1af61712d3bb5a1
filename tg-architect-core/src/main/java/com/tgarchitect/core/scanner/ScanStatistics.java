package com.tgarchitect.core.scanner;

import java.util.Map;

/**
 * Counters of one scan run.
 *
 * @param filesDiscovered files matching the file patterns
 * @param filesScanned files recognised as Terragrunt configuration and parsed
 * @param filesParsedSuccessfully parsed files without error-level findings
 * @param filesWithErrors parsed files with at least one error-level finding
 * @param filesSkipped discovered files that were not Terragrunt configuration, or skipped on cancellation
 * @param nodesCreated graph nodes, synthetic module nodes included
 * @param edgesCreated graph edges
 * @param cyclesDetected dependency cycles
 * @param durationMillis wall clock time
 * @param errorCounts findings per error code
 */
public record ScanStatistics(
    int filesDiscovered,
    int filesScanned,
    int filesParsedSuccessfully,
    int filesWithErrors,
    int filesSkipped,
    int nodesCreated,
    int edgesCreated,
    int cyclesDetected,
    long durationMillis,
    Map<String, Integer> errorCounts
) {
    public ScanStatistics {
        errorCounts = errorCounts == null ? Map.of() : Map.copyOf(errorCounts);
    }

    public static ScanStatistics empty() {
        return new Builder().build();
    }

    public double getSuccessRate() {
        if (filesScanned == 0) {
            return 0.0;
        }
        return (filesParsedSuccessfully * 100.0) / filesScanned;
    }

    public String getSummary() {
        return String.format(
            "Discovered: %d, Scanned: %d, Clean: %d (%.1f%%), With errors: %d, Nodes: %d, Edges: %d, Cycles: %d",
            filesDiscovered,
            filesScanned,
            filesParsedSuccessfully,
            getSuccessRate(),
            filesWithErrors,
            nodesCreated,
            edgesCreated,
            cyclesDetected
        );
    }

    public static class Builder {
        private int filesDiscovered;
        private int filesScanned;
        private int filesParsedSuccessfully;
        private int filesWithErrors;
        private int filesSkipped;
        private int nodesCreated;
        private int edgesCreated;
        private int cyclesDetected;
        private long durationMillis;
        private Map<String, Integer> errorCounts = Map.of();

        public Builder filesDiscovered(int value) {
            this.filesDiscovered = value;
            return this;
        }

        public Builder filesScanned(int value) {
            this.filesScanned = value;
            return this;
        }

        public Builder filesParsedSuccessfully(int value) {
            this.filesParsedSuccessfully = value;
            return this;
        }

        public Builder filesWithErrors(int value) {
            this.filesWithErrors = value;
            return this;
        }

        public Builder filesSkipped(int value) {
            this.filesSkipped = value;
            return this;
        }

        public Builder nodesCreated(int value) {
            this.nodesCreated = value;
            return this;
        }

        public Builder edgesCreated(int value) {
            this.edgesCreated = value;
            return this;
        }

        public Builder cyclesDetected(int value) {
            this.cyclesDetected = value;
            return this;
        }

        public Builder durationMillis(long value) {
            this.durationMillis = value;
            return this;
        }

        public Builder errorCounts(Map<String, Integer> value) {
            this.errorCounts = value;
            return this;
        }

        public ScanStatistics build() {
            return new ScanStatistics(filesDiscovered, filesScanned, filesParsedSuccessfully, filesWithErrors,
                filesSkipped, nodesCreated, edgesCreated, cyclesDetected, durationMillis, errorCounts);
        }
    }
}
