package com.delta.jobprep.mining.model;

import com.delta.jobprep.mining.scoring.Scorable;

import java.time.Instant;

/**
 * A fetched and normalized page. {@code relevanceScore} stays 0 until the item is scored.
 */
public record ContentItem(
    String url,
    String title,
    String body,
    String source,
    double relevanceScore,
    Instant fetchedAt
) implements Scorable {
    public ContentItem {
        title = title == null ? "" : title;
        body = body == null ? "" : body;
        source = source == null ? "" : source;
    }

    public ContentItem withRelevanceScore(double score) {
        return new ContentItem(url, title, body, source, score, fetchedAt);
    }
}
