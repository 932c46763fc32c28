package com.delta.jobprep.mining.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record JobProfile(
    String role,
    String company,
    List<String> skills,
    int experienceYears
) {
    public JobProfile {
        role = role == null ? "" : role.trim();
        company = company == null ? "" : company.trim();
        skills = distinctSkills(skills);
        experienceYears = Math.max(0, experienceYears);
    }

    private static List<String> distinctSkills(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        for (String skill : raw) {
            if (skill == null || skill.isBlank()) {
                continue;
            }
            String trimmed = skill.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                out.add(trimmed);
            }
        }
        return List.copyOf(out);
    }
}
