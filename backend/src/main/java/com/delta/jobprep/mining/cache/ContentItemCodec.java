package com.delta.jobprep.mining.cache;

import com.delta.jobprep.mining.model.ContentItem;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

/**
 * Versioned JSON form of a {@link ContentItem} for the content cache. Anything that does not
 * decode cleanly to the current schema version is reported as absent.
 */
@Component
public class ContentItemCodec {
    public static final int SCHEMA_VERSION = 1;
    private static final Logger log = LoggerFactory.getLogger(ContentItemCodec.class);

    private final ObjectMapper objectMapper;

    public ContentItemCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(ContentItem item) {
        CachedContent snapshot = new CachedContent(
            SCHEMA_VERSION,
            item.url(),
            item.title(),
            item.body(),
            item.source(),
            item.relevanceScore(),
            item.fetchedAt()
        );
        try {
            return objectMapper.writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize content for " + item.url(), e);
        }
    }

    public Optional<ContentItem> decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }
        try {
            CachedContent snapshot = objectMapper.readValue(payload, CachedContent.class);
            if (snapshot == null || snapshot.schemaVersion() != SCHEMA_VERSION || snapshot.url() == null) {
                log.debug("Ignoring cache payload with unsupported shape");
                return Optional.empty();
            }
            return Optional.of(new ContentItem(
                snapshot.url(),
                snapshot.title(),
                snapshot.body(),
                snapshot.source(),
                snapshot.relevanceScore(),
                snapshot.fetchedAt()
            ));
        } catch (IOException e) {
            log.debug("Undecodable cache payload: {}", e.getMessage());
            return Optional.empty();
        }
    }

    record CachedContent(
        @JsonProperty("schemaVersion") int schemaVersion,
        @JsonProperty("url") String url,
        @JsonProperty("title") String title,
        @JsonProperty("body") String body,
        @JsonProperty("source") String source,
        @JsonProperty("relevanceScore") double relevanceScore,
        @JsonProperty("fetchedAt") Instant fetchedAt
    ) {
    }
}
