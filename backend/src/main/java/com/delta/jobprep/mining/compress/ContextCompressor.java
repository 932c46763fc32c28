package com.delta.jobprep.mining.compress;

import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.model.CompressionResult;
import com.delta.jobprep.mining.model.ScoredItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Packs the most relevant items into a numbered text block that fits a token budget. The budget
 * is measured in characters ({@code maxTokens * charsPerToken}) and covers the source labels and
 * separators as well as the pieces themselves.
 */
@Component
public class ContextCompressor {
    private static final Logger log = LoggerFactory.getLogger(ContextCompressor.class);

    static final String SEPARATOR = "\n\n";
    static final String ELLIPSIS = "...";
    static final int MIN_OVERFLOW_ROOM = 100;
    static final int OVERFLOW_MARGIN = 50;

    private static final Pattern TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern DISALLOWED = Pattern.compile(
        "[^\\w\\s.,!?;:()'\"\\-]",
        Pattern.UNICODE_CHARACTER_CLASS
    );
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

    private final MinerProperties.Compression defaults;

    public ContextCompressor(MinerProperties properties) {
        this.defaults = properties.getCompression();
    }

    public CompressionResult compress(List<ScoredItem> items) {
        return compress(items, defaults.getMaxTokens(), defaults.getCharsPerPiece(), defaults.getMinRelevance());
    }

    public CompressionResult compress(List<ScoredItem> items, int maxTokens, int perItemCharLimit, double minRelevance) {
        List<ScoredItem> input = items == null ? List.of() : items.stream().filter(Objects::nonNull).toList();
        List<ScoredItem> eligible = input.stream()
            .filter(item -> item.relevanceScore() >= minRelevance)
            .sorted(Comparator.comparingDouble(ScoredItem::relevanceScore).reversed())
            .toList();
        if (eligible.isEmpty()) {
            if (!input.isEmpty()) {
                log.info("No content meets relevance threshold {} ({} items)", minRelevance, input.size());
            }
            return CompressionResult.empty(input.size(), minRelevance);
        }

        int charsPerToken = defaults.getCharsPerToken();
        int budget = budgetChars(maxTokens, charsPerToken);
        int pieceLimit = Math.max(ELLIPSIS.length() + 1, perItemCharLimit);

        StringBuilder text = new StringBuilder();
        Set<String> sources = new LinkedHashSet<>();
        int accepted = 0;
        double weakestAccepted = minRelevance;

        for (ScoredItem item : eligible) {
            if (text.length() >= budget) {
                break;
            }
            String cleaned = extractText(item);
            if (cleaned.isEmpty()) {
                continue;
            }
            String piece = trimToLimit(cleaned, pieceLimit);
            String label = (accepted == 0 ? "" : SEPARATOR) + "Source " + (accepted + 1) + ": ";
            int room = budget - text.length() - label.length();
            if (piece.length() > room) {
                if (room <= MIN_OVERFLOW_ROOM) {
                    break;
                }
                piece = piece.substring(0, room - OVERFLOW_MARGIN).stripTrailing() + ELLIPSIS;
            }
            text.append(label).append(piece);
            accepted++;
            weakestAccepted = item.relevanceScore();
            sources.add(item.sourceOrUnknown());
        }

        String assembled = text.toString();
        CompressionResult result = new CompressionResult(
            assembled,
            input.size(),
            accepted,
            assembled.length() / charsPerToken,
            accepted == 0 ? minRelevance : weakestAccepted,
            Collections.unmodifiableSet(sources)
        );
        log.info(
            "Compressed {} items to {} pieces, ~{} tokens from {} sources",
            result.originalCount(),
            result.acceptedCount(),
            result.estimatedTokens(),
            result.sourcesUsed().size()
        );
        return result;
    }

    static int budgetChars(int maxTokens, int charsPerToken) {
        long chars = (long) Math.max(0, maxTokens) * Math.max(1, charsPerToken);
        return (int) Math.min(Integer.MAX_VALUE, chars);
    }

    /**
     * Snippet when present, otherwise the body; markup stripped and punctuation normalized.
     */
    static String extractText(ScoredItem item) {
        String raw = firstNonBlank(item.snippet(), item.body());
        return raw == null ? "" : clean(raw);
    }

    static String clean(String text) {
        String value = TAGS.matcher(text).replaceAll(" ");
        value = value
            .replace('\u201C', '"')
            .replace('\u201D', '"')
            .replace('\u2018', '\'')
            .replace('\u2019', '\'')
            .replace('\u2013', '-')
            .replace('\u2014', '-');
        value = DISALLOWED.matcher(value).replaceAll("");
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    /**
     * Keeps whole sentences while they fit; falls back to a hard cut with an ellipsis.
     */
    static String trimToLimit(String content, int limit) {
        if (content.length() <= limit) {
            return content;
        }
        StringBuilder trimmed = new StringBuilder();
        for (String sentence : SENTENCE_END.split(content)) {
            String part = sentence.trim();
            if (part.isEmpty()) {
                continue;
            }
            if (trimmed.length() + part.length() + 1 > limit) {
                break;
            }
            trimmed.append(part).append(". ");
        }
        if (trimmed.length() == 0) {
            return content.substring(0, limit - ELLIPSIS.length()) + ELLIPSIS;
        }
        return trimmed.toString().trim();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
