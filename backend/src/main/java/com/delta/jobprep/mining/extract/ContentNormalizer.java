package com.delta.jobprep.mining.extract;

import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.model.ContentItem;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Turns raw page HTML into a {@link ContentItem}: non-content elements removed, whitespace
 * collapsed, body capped at the configured length.
 */
@Component
public class ContentNormalizer {
    public static final String NO_TITLE = "No Title";
    private static final String NON_CONTENT = "script, style, noscript, nav, footer, header";

    private final int maxBodyChars;

    public ContentNormalizer(MinerProperties properties) {
        this.maxBodyChars = properties.getFetch().getMaxBodyChars();
    }

    public ContentItem normalize(String url, String html) {
        return normalize(url, html, null);
    }

    /**
     * @param titleHint title reported by the browser, used before the document's own title
     */
    public ContentItem normalize(String url, String html, String titleHint) {
        Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
        String title = firstNonBlank(titleHint, document.title());
        document.select(NON_CONTENT).remove();
        Element body = document.body();
        String text = collapseWhitespace(body == null ? document.text() : body.text());
        return new ContentItem(
            url,
            title == null ? NO_TITLE : collapseWhitespace(title),
            truncate(text, maxBodyChars),
            SourceLabels.labelFor(url),
            0.0,
            Instant.now()
        );
    }

    static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
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
