package com.delta.jobprep.mining.discovery;

import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.http.PoliteHttpClient;
import com.delta.jobprep.mining.model.HttpFetchResult;
import com.delta.jobprep.mining.model.JobProfile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a job profile into search queries and resolves them to candidate content URLs through
 * the GitHub repository search and Reddit subreddit search JSON endpoints. A failed query is
 * logged and skipped.
 */
@Service
public class SearchDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(SearchDiscoveryService.class);
    private static final String GITHUB_ACCEPT = "application/vnd.github+json";
    private static final String JSON_ACCEPT = "application/json";

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MinerProperties.Discovery properties;

    public SearchDiscoveryService(PoliteHttpClient httpClient, ObjectMapper objectMapper, MinerProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties.getSources().getDiscovery();
    }

    public List<String> discover(JobProfile profile) {
        if (!properties.isEnabled() || profile == null) {
            return List.of();
        }
        Set<String> urls = new LinkedHashSet<>();
        for (String query : githubQueries(profile)) {
            urls.addAll(searchGithub(query));
        }
        if (!profile.role().isEmpty()) {
            for (String subreddit : properties.getSubreddits()) {
                if (subreddit != null && !subreddit.isBlank()) {
                    urls.addAll(searchReddit(subreddit.trim(), profile.role() + " interview"));
                }
            }
        }
        log.info("Search discovery found {} urls for role='{}'", urls.size(), profile.role());
        return new ArrayList<>(urls);
    }

    List<String> githubQueries(JobProfile profile) {
        Set<String> queries = new LinkedHashSet<>();
        if (!profile.role().isEmpty()) {
            queries.add(profile.role() + " interview questions");
            queries.add(profile.role() + " technical interview");
        }
        profile.skills().stream()
            .limit(properties.getMaxSkillQueries())
            .forEach(skill -> queries.add(skill + " interview questions"));
        return new ArrayList<>(queries);
    }

    List<String> searchGithub(String query) {
        String url = properties.getGithubSearchUrl()
            + "?q=" + encode(query)
            + "&sort=stars&order=desc&per_page=" + properties.getResultsPerQuery();
        JsonNode root = fetchJson(url, GITHUB_ACCEPT);
        List<String> urls = new ArrayList<>();
        if (root == null) {
            return urls;
        }
        JsonNode items = root.path("items");
        if (items.isArray()) {
            for (JsonNode repo : items) {
                String htmlUrl = repo.path("html_url").asText(null);
                if (htmlUrl != null && !htmlUrl.isBlank()) {
                    urls.add(htmlUrl);
                }
                if (urls.size() >= properties.getResultsPerQuery()) {
                    break;
                }
            }
        }
        return urls;
    }

    List<String> searchReddit(String subreddit, String query) {
        String base = properties.getRedditBaseUrl();
        String url = base + "/r/" + encode(subreddit) + "/search.json"
            + "?q=" + encode(query)
            + "&restrict_sr=on&sort=relevance&t=year&limit=" + properties.getResultsPerQuery();
        JsonNode root = fetchJson(url, JSON_ACCEPT);
        List<String> urls = new ArrayList<>();
        if (root == null) {
            return urls;
        }
        JsonNode children = root.path("data").path("children");
        if (children.isArray()) {
            for (JsonNode post : children) {
                String permalink = post.path("data").path("permalink").asText(null);
                if (permalink != null && permalink.startsWith("/")) {
                    urls.add(base + permalink);
                }
                if (urls.size() >= properties.getResultsPerQuery()) {
                    break;
                }
            }
        }
        return urls;
    }

    private JsonNode fetchJson(String url, String accept) {
        HttpFetchResult fetch = httpClient.get(url, accept);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.warn("Search query failed: url={} reason={}", url, fetch.failureReason());
            return null;
        }
        try {
            return objectMapper.readTree(fetch.body());
        } catch (Exception e) {
            log.warn("Failed to parse search response from {}: {}", url, e.getMessage());
            return null;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
