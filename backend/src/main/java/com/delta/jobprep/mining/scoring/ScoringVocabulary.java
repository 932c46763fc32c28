package com.delta.jobprep.mining.scoring;

import java.util.List;

final class ScoringVocabulary {
    static final List<String> INTERVIEW_KEYWORDS = List.of(
        "interview",
        "question",
        "technical",
        "coding",
        "problem",
        "solution",
        "assessment",
        "test",
        "challenge",
        "exercise",
        "practice",
        "mock",
        "preparation",
        "guide",
        "tutorial"
    );

    static final List<String> CREDIBLE_SOURCES = List.of(
        "github",
        "leetcode",
        "hackerrank",
        "geeksforgeeks",
        "medium",
        "stackoverflow",
        "reddit",
        "kaggle",
        "datacamp",
        "coursera",
        "edx",
        "udemy",
        "freecodecamp",
        "w3schools",
        "tutorialspoint"
    );

    private ScoringVocabulary() {
    }
}
