package com.delta.jobprep.mining.model;

/**
 * Input to context compression. {@code snippet} is a curated short text and is preferred over {@code body} when present.
 */
public record ScoredItem(
    String snippet,
    String body,
    String source,
    double relevanceScore
) {
    public static ScoredItem of(ContentItem item) {
        return new ScoredItem(null, item.body(), item.source(), item.relevanceScore());
    }

    public String sourceOrUnknown() {
        return source == null || source.isBlank() ? "Unknown" : source;
    }
}
