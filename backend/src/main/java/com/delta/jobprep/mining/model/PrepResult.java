package com.delta.jobprep.mining.model;

import java.util.List;

public record PrepResult(
    MiningReport report,
    List<CandidateItem> questions
) {
    public PrepResult {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
