package com.delta.jobprep.mining.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourceLabelsTest {

    @Test
    void knownDomainsMapToLabels() {
        assertThat(SourceLabels.labelFor("https://github.com/org/repo")).isEqualTo("GitHub");
        assertThat(SourceLabels.labelFor("https://www.reddit.com/r/cscareerquestions")).isEqualTo("Reddit");
        assertThat(SourceLabels.labelFor("https://stackoverflow.com/questions/1")).isEqualTo("StackOverflow");
    }

    @Test
    void unknownDomainFallsBackToAuthority() {
        assertThat(SourceLabels.labelFor("https://docs.example.net:8443/guide")).isEqualTo("docs.example.net:8443");
        assertThat(SourceLabels.labelFor("not a url")).isEqualTo("not a url");
    }
}
