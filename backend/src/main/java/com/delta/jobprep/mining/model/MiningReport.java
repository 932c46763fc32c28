package com.delta.jobprep.mining.model;

import java.util.List;

public record MiningReport(
    JobProfile profile,
    int seedCount,
    int fetchedCount,
    List<ContentItem> retained,
    List<String> failedUrls,
    CompressionResult context
) {
    public MiningReport {
        retained = retained == null ? List.of() : List.copyOf(retained);
        failedUrls = failedUrls == null ? List.of() : List.copyOf(failedUrls);
    }
}
