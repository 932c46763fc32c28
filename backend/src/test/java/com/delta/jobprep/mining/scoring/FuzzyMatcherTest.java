package com.delta.jobprep.mining.scoring;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FuzzyMatcherTest {

    @Test
    void emptyInputHasNoSimilarity() {
        assertThat(FuzzyMatcher.tokenSetRatio("", "python")).isZero();
        assertThat(FuzzyMatcher.tokenSetRatio("python", "   ")).isZero();
        assertThat(FuzzyMatcher.tokenSetRatio(null, null)).isZero();
        assertThat(FuzzyMatcher.tokenSetRatio("???", "!!!")).isZero();
    }

    @Test
    void identicalTextIsFullMatchRegardlessOfCase() {
        assertThat(FuzzyMatcher.tokenSetRatio("Data Engineer", "data engineer")).isEqualTo(100);
        assertThat(FuzzyMatcher.similarity("Data Engineer", "Data Engineer")).isEqualTo(1.0);
    }

    @Test
    void tokenOrderAndSubsetsDoNotMatter() {
        assertThat(FuzzyMatcher.tokenSetRatio("python data engineer", "engineer data python")).isEqualTo(100);
        assertThat(FuzzyMatcher.tokenSetRatio("data engineer", "senior data engineer role")).isEqualTo(100);
    }

    @Test
    void unrelatedTextScoresLow() {
        assertThat(FuzzyMatcher.tokenSetRatio("kubernetes", "watercolor painting")).isLessThan(60);
    }
}
