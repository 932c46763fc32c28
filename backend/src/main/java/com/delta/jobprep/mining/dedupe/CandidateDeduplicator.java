package com.delta.jobprep.mining.dedupe;

import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.model.CandidateItem;
import com.delta.jobprep.mining.model.Difficulty;
import com.delta.jobprep.mining.scoring.FuzzyMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Removes exact and near-duplicate candidates. Items are only ever compared with others of the
 * same difficulty and category; survivors keep their original relative order.
 */
@Component
public class CandidateDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(CandidateDeduplicator.class);
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int similarityThreshold;

    @Autowired
    public CandidateDeduplicator(MinerProperties properties) {
        this(properties.getDedupe().getSimilarityThreshold());
    }

    public CandidateDeduplicator(int similarityThreshold) {
        this.similarityThreshold = Math.max(0, Math.min(FuzzyMatcher.MAX_RATIO, similarityThreshold));
    }

    public List<CandidateItem> deduplicate(List<CandidateItem> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        Map<GroupKey, Set<String>> seenTexts = new HashMap<>();
        Map<GroupKey, List<String>> acceptedTexts = new HashMap<>();
        List<CandidateItem> survivors = new ArrayList<>();
        int exactDropped = 0;
        int fuzzyDropped = 0;

        for (CandidateItem item : items) {
            if (item == null) {
                continue;
            }
            GroupKey key = new GroupKey(item.difficulty(), item.category());
            if (!seenTexts.computeIfAbsent(key, ignored -> new HashSet<>()).add(normalize(item.text()))) {
                exactDropped++;
                continue;
            }
            List<String> accepted = acceptedTexts.computeIfAbsent(key, ignored -> new ArrayList<>());
            if (maxSimilarity(item.text(), accepted) >= similarityThreshold && !accepted.isEmpty()) {
                fuzzyDropped++;
                continue;
            }
            accepted.add(item.text());
            survivors.add(item);
        }

        if (exactDropped > 0 || fuzzyDropped > 0) {
            log.info(
                "Deduplicated {} candidates to {} ({} exact, {} near-duplicate)",
                items.size(),
                survivors.size(),
                exactDropped,
                fuzzyDropped
            );
        }
        return survivors;
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    private static int maxSimilarity(String text, List<String> accepted) {
        int max = 0;
        for (String other : accepted) {
            max = Math.max(max, FuzzyMatcher.tokenSetRatio(text, other));
            if (max == FuzzyMatcher.MAX_RATIO) {
                break;
            }
        }
        return max;
    }

    private record GroupKey(Difficulty difficulty, String category) {
    }
}
