package com.delta.jobprep.mining.model;

public record CacheStats(
    long totalEntries,
    long validEntries,
    long expiredEntries
) {
}
