package com.delta.jobprep.mining.compress;

import com.delta.jobprep.mining.model.CompressionResult;
import com.delta.jobprep.mining.model.ScoredItem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CompressionStats(
    double compressionRatio,
    int highRelevance,
    int mediumRelevance,
    int lowRelevance,
    Map<String, Integer> sourceDistribution,
    int originalChars,
    int compressedChars,
    int originalPieces,
    int compressedPieces
) {
    static final double HIGH_THRESHOLD = 0.7;
    static final double MEDIUM_THRESHOLD = 0.4;

    public static CompressionStats of(List<ScoredItem> items, CompressionResult result) {
        if (items == null || items.isEmpty()) {
            return new CompressionStats(0.0, 0, 0, 0, Map.of(), 0, 0, 0, 0);
        }
        int originalChars = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        Map<String, Integer> sources = new LinkedHashMap<>();
        for (ScoredItem item : items) {
            if (item == null) {
                continue;
            }
            originalChars += ContextCompressor.extractText(item).length();
            double score = item.relevanceScore();
            if (score >= HIGH_THRESHOLD) {
                high++;
            } else if (score >= MEDIUM_THRESHOLD) {
                medium++;
            } else {
                low++;
            }
            sources.merge(item.sourceOrUnknown(), 1, Integer::sum);
        }
        int compressedChars = result == null ? 0 : result.text().length();
        double ratio = originalChars > 0 ? compressedChars / (double) originalChars : 0.0;
        return new CompressionStats(
            ratio,
            high,
            medium,
            low,
            Collections.unmodifiableMap(sources),
            originalChars,
            compressedChars,
            items.size(),
            result == null ? 0 : result.acceptedCount()
        );
    }

    public double sizeReductionPercent() {
        return (1.0 - compressionRatio) * 100.0;
    }
}
