package com.delta.jobprep.mining.extract;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class SourceLabels {
    private static final Map<String, String> DOMAIN_LABELS = new LinkedHashMap<>();

    static {
        DOMAIN_LABELS.put("github.com", "GitHub");
        DOMAIN_LABELS.put("medium.com", "Medium");
        DOMAIN_LABELS.put("reddit.com", "Reddit");
        DOMAIN_LABELS.put("leetcode.com", "LeetCode");
        DOMAIN_LABELS.put("hackerrank.com", "HackerRank");
        DOMAIN_LABELS.put("stratascratch.com", "StrataScratch");
        DOMAIN_LABELS.put("geeksforgeeks.org", "GeeksforGeeks");
        DOMAIN_LABELS.put("w3schools.com", "W3Schools");
        DOMAIN_LABELS.put("kaggle.com", "Kaggle");
        DOMAIN_LABELS.put("stackoverflow.com", "StackOverflow");
        DOMAIN_LABELS.put("interviewbit.com", "InterviewBit");
        DOMAIN_LABELS.put("tutorialspoint.com", "TutorialsPoint");
    }

    private SourceLabels() {
    }

    public static String labelFor(String url) {
        String domain = domainOf(url);
        if (domain == null || domain.isBlank()) {
            return url == null ? "" : url;
        }
        String lower = domain.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : DOMAIN_LABELS.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return domain;
    }

    // Host plus port, mirroring what a browser shows as the site.
    static String domainOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            return uri.getRawAuthority();
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
