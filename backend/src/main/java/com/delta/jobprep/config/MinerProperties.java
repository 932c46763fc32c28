package com.delta.jobprep.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "miner")
public class MinerProperties {
    private static final String DEFAULT_USER_AGENT = "job-prep-miner/0.1 (+contact)";

    private Fetch fetch = new Fetch();
    private Cache cache = new Cache();
    private Scoring scoring = new Scoring();
    private Dedupe dedupe = new Dedupe();
    private Compression compression = new Compression();
    private Enhancement enhancement = new Enhancement();
    private Sources sources = new Sources();

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public Dedupe getDedupe() {
        return dedupe;
    }

    public void setDedupe(Dedupe dedupe) {
        this.dedupe = dedupe;
    }

    public Compression getCompression() {
        return compression;
    }

    public void setCompression(Compression compression) {
        this.compression = compression;
    }

    public Enhancement getEnhancement() {
        return enhancement;
    }

    public void setEnhancement(Enhancement enhancement) {
        this.enhancement = enhancement;
    }

    public Sources getSources() {
        return sources;
    }

    public void setSources(Sources sources) {
        this.sources = sources;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static class Fetch {
        private String userAgent;
        private int requestTimeoutSeconds = 10;
        private int maxConnections = 10;
        private int maxConnectionsPerHost = 5;
        private int requestsPerSecond = 2;
        private int rateLimitWaitSeconds = 300;
        private int maxBodyChars = 5000;
        private boolean renderedFallback = true;
        private Rendered rendered = new Rendered();

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxConnections() {
            return Math.max(1, maxConnections);
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = Math.max(1, maxConnections);
        }

        public int getMaxConnectionsPerHost() {
            return Math.max(1, Math.min(maxConnectionsPerHost, getMaxConnections()));
        }

        public void setMaxConnectionsPerHost(int maxConnectionsPerHost) {
            this.maxConnectionsPerHost = Math.max(1, maxConnectionsPerHost);
        }

        public int getRequestsPerSecond() {
            return Math.max(1, requestsPerSecond);
        }

        public void setRequestsPerSecond(int requestsPerSecond) {
            this.requestsPerSecond = Math.max(1, requestsPerSecond);
        }

        public int getRateLimitWaitSeconds() {
            return Math.max(0, rateLimitWaitSeconds);
        }

        public void setRateLimitWaitSeconds(int rateLimitWaitSeconds) {
            this.rateLimitWaitSeconds = Math.max(0, rateLimitWaitSeconds);
        }

        public int getMaxBodyChars() {
            return Math.max(1, maxBodyChars);
        }

        public void setMaxBodyChars(int maxBodyChars) {
            this.maxBodyChars = Math.max(1, maxBodyChars);
        }

        public boolean isRenderedFallback() {
            return renderedFallback;
        }

        public void setRenderedFallback(boolean renderedFallback) {
            this.renderedFallback = renderedFallback;
        }

        public Rendered getRendered() {
            return rendered;
        }

        public void setRendered(Rendered rendered) {
            this.rendered = rendered;
        }
    }

    public static class Rendered {
        private int navigationTimeoutSeconds = 30;
        private int settleDelayMs = 2000;
        private List<Integer> retryDelaysMs = new ArrayList<>(List.of(1000, 3000, 7000));
        private boolean headless = true;

        public int getNavigationTimeoutSeconds() {
            return Math.max(1, navigationTimeoutSeconds);
        }

        public void setNavigationTimeoutSeconds(int navigationTimeoutSeconds) {
            this.navigationTimeoutSeconds = Math.max(1, navigationTimeoutSeconds);
        }

        public int getSettleDelayMs() {
            return Math.max(0, settleDelayMs);
        }

        public void setSettleDelayMs(int settleDelayMs) {
            this.settleDelayMs = Math.max(0, settleDelayMs);
        }

        public List<Integer> getRetryDelaysMs() {
            if (retryDelaysMs == null || retryDelaysMs.isEmpty()) {
                return List.of(0);
            }
            return retryDelaysMs.stream().map(delay -> delay == null ? 0 : Math.max(0, delay)).toList();
        }

        public void setRetryDelaysMs(List<Integer> retryDelaysMs) {
            this.retryDelaysMs = retryDelaysMs == null ? new ArrayList<>() : new ArrayList<>(retryDelaysMs);
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }
    }

    public static class Cache {
        private int ttlDays = 7;

        public int getTtlDays() {
            return Math.max(0, ttlDays);
        }

        public void setTtlDays(int ttlDays) {
            this.ttlDays = Math.max(0, ttlDays);
        }
    }

    public static class Scoring {
        private double minRelevance = 0.3;
        private int maxResults = 20;

        public double getMinRelevance() {
            return clampUnit(minRelevance);
        }

        public void setMinRelevance(double minRelevance) {
            this.minRelevance = clampUnit(minRelevance);
        }

        public int getMaxResults() {
            return Math.max(1, maxResults);
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = Math.max(1, maxResults);
        }
    }

    public static class Dedupe {
        private int similarityThreshold = 85;

        public int getSimilarityThreshold() {
            return Math.max(0, Math.min(100, similarityThreshold));
        }

        public void setSimilarityThreshold(int similarityThreshold) {
            this.similarityThreshold = Math.max(0, Math.min(100, similarityThreshold));
        }
    }

    public static class Compression {
        private int maxTokens = 3000;
        private int charsPerPiece = 350;
        private double minRelevance = 0.3;
        private int charsPerToken = 4;

        public int getMaxTokens() {
            return Math.max(1, maxTokens);
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = Math.max(1, maxTokens);
        }

        public int getCharsPerPiece() {
            return Math.max(10, charsPerPiece);
        }

        public void setCharsPerPiece(int charsPerPiece) {
            this.charsPerPiece = Math.max(10, charsPerPiece);
        }

        public double getMinRelevance() {
            return clampUnit(minRelevance);
        }

        public void setMinRelevance(double minRelevance) {
            this.minRelevance = clampUnit(minRelevance);
        }

        public int getCharsPerToken() {
            return Math.max(1, charsPerToken);
        }

        public void setCharsPerToken(int charsPerToken) {
            this.charsPerToken = Math.max(1, charsPerToken);
        }
    }

    public static class Enhancement {
        private int poolSize = 5;
        private int timeoutSeconds = 60;

        public int getPoolSize() {
            return Math.max(1, poolSize);
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = Math.max(1, poolSize);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Sources {
        private List<String> directUrls = new ArrayList<>(List.of(
            "https://github.com/topics/data-science-interview",
            "https://github.com/topics/machine-learning-interview",
            "https://github.com/topics/python-interview",
            "https://github.com/topics/sql-interview",
            "https://leetcode.com/problemset/all/",
            "https://www.hackerrank.com/domains",
            "https://www.geeksforgeeks.org/data-science-interview-questions/",
            "https://www.geeksforgeeks.org/machine-learning-interview-questions/",
            "https://www.geeksforgeeks.org/python-interview-questions/",
            "https://www.w3schools.com/python/",
            "https://www.w3schools.com/sql/"
        ));
        private List<String> patternUrls = new ArrayList<>(List.of(
            "https://www.geeksforgeeks.org/{slug}-interview-questions/",
            "https://www.interviewbit.com/{slug}-interview-questions/",
            "https://www.tutorialspoint.com/{slug}-interview-questions/"
        ));
        private Discovery discovery = new Discovery();

        public List<String> getDirectUrls() {
            return directUrls == null ? List.of() : List.copyOf(directUrls);
        }

        public void setDirectUrls(List<String> directUrls) {
            this.directUrls = directUrls == null ? new ArrayList<>() : new ArrayList<>(directUrls);
        }

        public List<String> getPatternUrls() {
            return patternUrls == null ? List.of() : List.copyOf(patternUrls);
        }

        public void setPatternUrls(List<String> patternUrls) {
            this.patternUrls = patternUrls == null ? new ArrayList<>() : new ArrayList<>(patternUrls);
        }

        public Discovery getDiscovery() {
            return discovery;
        }

        public void setDiscovery(Discovery discovery) {
            this.discovery = discovery;
        }
    }

    public static class Discovery {
        private boolean enabled = true;
        private String githubSearchUrl = "https://api.github.com/search/repositories";
        private String redditBaseUrl = "https://www.reddit.com";
        private List<String> subreddits = new ArrayList<>(List.of(
            "datascience",
            "learnmachinelearning",
            "MachineLearning",
            "cscareerquestions",
            "AskProgramming"
        ));
        private int resultsPerQuery = 3;
        private int maxSkillQueries = 3;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getGithubSearchUrl() {
            return trimTrailingSlash(githubSearchUrl);
        }

        public void setGithubSearchUrl(String githubSearchUrl) {
            this.githubSearchUrl = githubSearchUrl;
        }

        public String getRedditBaseUrl() {
            return trimTrailingSlash(redditBaseUrl);
        }

        public void setRedditBaseUrl(String redditBaseUrl) {
            this.redditBaseUrl = redditBaseUrl;
        }

        public List<String> getSubreddits() {
            return subreddits == null ? List.of() : List.copyOf(subreddits);
        }

        public void setSubreddits(List<String> subreddits) {
            this.subreddits = subreddits == null ? new ArrayList<>() : new ArrayList<>(subreddits);
        }

        public int getResultsPerQuery() {
            return Math.max(1, resultsPerQuery);
        }

        public void setResultsPerQuery(int resultsPerQuery) {
            this.resultsPerQuery = Math.max(1, resultsPerQuery);
        }

        public int getMaxSkillQueries() {
            return Math.max(0, maxSkillQueries);
        }

        public void setMaxSkillQueries(int maxSkillQueries) {
            this.maxSkillQueries = Math.max(0, maxSkillQueries);
        }

        private static String trimTrailingSlash(String url) {
            if (url == null || url.isBlank()) {
                return "";
            }
            String value = url.trim();
            return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
        }
    }
}
