package com.delta.jobprep.mining.model;

import com.delta.jobprep.mining.scoring.Scorable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A generated interview question awaiting deduplication and scoring.
 */
public record CandidateItem(
    String text,
    String answer,
    String category,
    Difficulty difficulty,
    Set<String> skills,
    double relevanceScore
) implements Scorable {
    public static final String DEFAULT_CATEGORY = "Technical";
    public static final String GENERATED_SOURCE = "Generated";

    public CandidateItem {
        text = text == null ? "" : text;
        answer = answer == null ? "" : answer;
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
        difficulty = difficulty == null ? Difficulty.MEDIUM : difficulty;
        skills = tags(skills);
    }

    public CandidateItem(String text, String answer, String category, Difficulty difficulty, Set<String> skills) {
        this(text, answer, category, difficulty, skills, 0.0);
    }

    public CandidateItem withRelevanceScore(double score) {
        return new CandidateItem(text, answer, category, difficulty, skills, score);
    }

    public CandidateItem withAnswer(String enhancedAnswer) {
        return new CandidateItem(text, enhancedAnswer, category, difficulty, skills, relevanceScore);
    }

    private static Set<String> tags(Set<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Set.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String tag : raw) {
            if (tag != null && !tag.isBlank()) {
                out.add(tag.trim());
            }
        }
        return Collections.unmodifiableSet(out);
    }

    @Override
    public String title() {
        return text;
    }

    @Override
    public String body() {
        StringBuilder out = new StringBuilder(text);
        if (!answer.isBlank()) {
            out.append(' ').append(answer);
        }
        if (!skills.isEmpty()) {
            out.append(' ').append(String.join(" ", skills));
        }
        return out.toString();
    }

    @Override
    public String source() {
        return GENERATED_SOURCE;
    }
}
