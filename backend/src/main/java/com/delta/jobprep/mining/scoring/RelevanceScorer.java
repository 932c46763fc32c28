package com.delta.jobprep.mining.scoring;

import com.delta.jobprep.mining.model.JobProfile;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Weighted relevance of an item to a job profile. Stateless; the result is clamped to [0, 1]
 * only after every factor has been applied.
 */
@Component
public class RelevanceScorer {
    static final double ROLE_WEIGHT = 0.4;
    static final double TITLE_SHARE = 0.6;
    static final double BODY_SHARE = 0.4;
    static final double SKILL_WEIGHT = 0.2;
    static final double KEYWORD_BONUS = 0.1;
    static final double CREDIBILITY_BONUS = 0.1;
    static final double LONG_PAGE_PENALTY = 0.2;
    static final int LONG_PAGE_WORDS = 3000;
    static final double LONG_PAGE_SCORE_CEILING = 0.5;

    public double score(Scorable item, JobProfile profile) {
        if (item == null || profile == null) {
            return 0.0;
        }
        String title = nullToEmpty(item.title());
        String body = nullToEmpty(item.body());

        double score = ROLE_WEIGHT * roleMatch(profile.role(), title, body);

        for (String skill : profile.skills()) {
            score += SKILL_WEIGHT * FuzzyMatcher.similarity(skill, body);
        }

        String lowerBody = body.toLowerCase(Locale.ROOT);
        for (String keyword : ScoringVocabulary.INTERVIEW_KEYWORDS) {
            if (lowerBody.contains(keyword)) {
                score += KEYWORD_BONUS;
            }
        }

        if (isCredible(item.source())) {
            score += CREDIBILITY_BONUS;
        }

        if (wordCount(body) > LONG_PAGE_WORDS && score < LONG_PAGE_SCORE_CEILING) {
            score -= LONG_PAGE_PENALTY;
        }
        return clamp(score);
    }

    /**
     * Unweighted role similarity in [0, 1]: 60% against the title, 40% against the body.
     */
    public double roleMatch(String role, String title, String body) {
        return TITLE_SHARE * FuzzyMatcher.similarity(role, title)
            + BODY_SHARE * FuzzyMatcher.similarity(role, body);
    }

    static boolean isCredible(String source) {
        if (source == null || source.isBlank()) {
            return false;
        }
        String lower = source.toLowerCase(Locale.ROOT);
        for (String credible : ScoringVocabulary.CREDIBLE_SOURCES) {
            if (lower.contains(credible)) {
                return true;
            }
        }
        return false;
    }

    static int wordCount(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return trimmed.split("\\s+").length;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
