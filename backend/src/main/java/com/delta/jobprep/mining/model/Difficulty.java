package com.delta.jobprep.mining.model;

import java.util.Locale;

public enum Difficulty {
    EASY,
    MEDIUM,
    HARD;

    public static Difficulty fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MEDIUM;
        }
        try {
            return Difficulty.valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
