package com.delta.jobprep.mining.scoring;

import me.xdrop.fuzzywuzzy.FuzzySearch;

/**
 * Order-independent token-set similarity on a 0-100 scale.
 */
public final class FuzzyMatcher {
    public static final int MAX_RATIO = 100;

    private FuzzyMatcher() {
    }

    public static int tokenSetRatio(String left, String right) {
        if (left == null || right == null || left.isBlank() || right.isBlank()) {
            return 0;
        }
        String a = left.trim();
        String b = right.trim();
        if (a.equalsIgnoreCase(b)) {
            return MAX_RATIO;
        }
        // the default processor strips punctuation; text made of symbols only ends up empty
        if (!hasWordCharacter(a) || !hasWordCharacter(b)) {
            return 0;
        }
        return Math.max(0, Math.min(MAX_RATIO, FuzzySearch.tokenSetRatio(a, b)));
    }

    public static double similarity(String left, String right) {
        return tokenSetRatio(left, right) / (double) MAX_RATIO;
    }

    private static boolean hasWordCharacter(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isLetterOrDigit(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
