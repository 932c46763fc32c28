package com.delta.jobprep.mining.service;

import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.model.JobProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Seed URLs for a mining run: configured direct URLs, then URLs found by search discovery, then
 * role-pattern URLs. Duplicates keep their first position.
 */
@Component
public class SeedUrlPlanner {
    static final String SLUG_TOKEN = "{slug}";

    private final MinerProperties.Sources sources;

    public SeedUrlPlanner(MinerProperties properties) {
        this.sources = properties.getSources();
    }

    public List<String> plan(JobProfile profile) {
        return plan(profile, List.of());
    }

    public List<String> plan(JobProfile profile, List<String> discovered) {
        Set<String> urls = new LinkedHashSet<>();
        addAll(urls, sources.getDirectUrls());
        addAll(urls, discovered == null ? List.of() : discovered);
        String slug = roleSlug(profile == null ? null : profile.role());
        if (!slug.isEmpty()) {
            for (String template : sources.getPatternUrls()) {
                if (template != null && template.contains(SLUG_TOKEN)) {
                    urls.add(template.trim().replace(SLUG_TOKEN, slug));
                }
            }
        }
        return new ArrayList<>(urls);
    }

    private static void addAll(Set<String> urls, List<String> candidates) {
        for (String url : candidates) {
            if (url != null && !url.isBlank()) {
                urls.add(url.trim());
            }
        }
    }

    static String roleSlug(String role) {
        if (role == null || role.isBlank()) {
            return "";
        }
        return role.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
    }
}
