package com.delta.jobprep.mining.service;

import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.model.JobProfile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SeedUrlPlannerTest {

    @Test
    void directUrlsComeFirstThenRolePatterns() {
        MinerProperties properties = new MinerProperties();
        properties.getSources().setDirectUrls(List.of(
            "https://github.com/DopplerHQ/awesome-interview-questions",
            " https://www.geeksforgeeks.org/data-engineer-interview-questions/ "
        ));
        SeedUrlPlanner planner = new SeedUrlPlanner(properties);

        List<String> urls = planner.plan(new JobProfile("  Data   Engineer ", "Acme", List.of(), 2));

        assertThat(urls).containsExactly(
            "https://github.com/DopplerHQ/awesome-interview-questions",
            "https://www.geeksforgeeks.org/data-engineer-interview-questions/",
            "https://www.interviewbit.com/data-engineer-interview-questions/",
            "https://www.tutorialspoint.com/data-engineer-interview-questions/"
        );
    }

    @Test
    void discoveredUrlsSitBetweenDirectAndPatternUrls() {
        MinerProperties properties = new MinerProperties();
        properties.getSources().setDirectUrls(List.of("https://www.w3schools.com/sql/"));
        properties.getSources().setPatternUrls(List.of("https://www.interviewbit.com/{slug}-interview-questions/"));
        SeedUrlPlanner planner = new SeedUrlPlanner(properties);

        List<String> urls = planner.plan(
            new JobProfile("SQL Developer", "Acme", List.of(), 1),
            List.of("https://github.com/acme/sql-prep", "https://www.w3schools.com/sql/", " ")
        );

        assertThat(urls).containsExactly(
            "https://www.w3schools.com/sql/",
            "https://github.com/acme/sql-prep",
            "https://www.interviewbit.com/sql-developer-interview-questions/"
        );
    }

    @Test
    void defaultDirectSourcesAreSeeded() {
        MinerProperties properties = new MinerProperties();

        assertThat(properties.getSources().getDirectUrls())
            .contains("https://github.com/topics/sql-interview", "https://www.w3schools.com/python/");
    }

    @Test
    void blankRoleSkipsPatternUrls() {
        MinerProperties properties = new MinerProperties();
        properties.getSources().setDirectUrls(List.of());
        SeedUrlPlanner planner = new SeedUrlPlanner(properties);

        assertThat(planner.plan(new JobProfile(" ", "Acme", List.of(), 0))).isEmpty();
        assertThat(SeedUrlPlanner.roleSlug("Site Reliability Engineer")).isEqualTo("site-reliability-engineer");
    }
}
