package com.delta.jobprep.mining.model;

import java.util.Set;

public record CompressionResult(
    String text,
    int originalCount,
    int acceptedCount,
    int estimatedTokens,
    double effectiveThreshold,
    Set<String> sourcesUsed
) {
    public CompressionResult {
        text = text == null ? "" : text;
        sourcesUsed = sourcesUsed == null ? Set.of() : sourcesUsed;
    }

    public static CompressionResult empty(int originalCount, double minRelevance) {
        return new CompressionResult("", originalCount, 0, 0, minRelevance, Set.of());
    }

    public boolean isEmpty() {
        return acceptedCount == 0;
    }
}
