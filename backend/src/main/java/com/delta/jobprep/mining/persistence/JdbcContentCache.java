package com.delta.jobprep.mining.persistence;

import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.cache.ContentCache;
import com.delta.jobprep.mining.model.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Content cache in the {@code content_cache} table. Entries older than the configured TTL are
 * treated as misses and removed when read.
 */
@Repository
public class JdbcContentCache implements ContentCache {
    private static final Logger log = LoggerFactory.getLogger(JdbcContentCache.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final MinerProperties.Cache properties;

    public JdbcContentCache(NamedParameterJdbcTemplate jdbc, MinerProperties properties) {
        this.jdbc = jdbc;
        this.properties = properties.getCache();
    }

    @Override
    public Optional<byte[]> get(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        List<CachedRow> rows = jdbc.query(
            """
                SELECT payload, cached_at
                FROM content_cache
                WHERE url = :url
                """,
            new MapSqlParameterSource("url", url),
            (rs, rowNum) -> new CachedRow(rs.getBytes("payload"), toInstant(rs.getTimestamp("cached_at")))
        );
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        CachedRow row = rows.get(0);
        if (isExpired(row.cachedAt(), Instant.now())) {
            jdbc.update("DELETE FROM content_cache WHERE url = :url", new MapSqlParameterSource("url", url));
            log.debug("Evicted expired cache entry for {}", url);
            return Optional.empty();
        }
        return Optional.ofNullable(row.payload());
    }

    @Override
    public void put(String url, byte[] payload) {
        if (url == null || url.isBlank() || payload == null) {
            return;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", url)
            .addValue("payload", payload)
            .addValue("cachedAt", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                MERGE INTO content_cache (url, payload, cached_at)
                KEY (url)
                VALUES (:url, :payload, :cachedAt)
                """,
            params
        );
    }

    public int purgeExpired() {
        Optional<Instant> cutoff = cutoff(Instant.now());
        if (cutoff.isEmpty()) {
            return 0;
        }
        int removed = jdbc.update(
            "DELETE FROM content_cache WHERE cached_at < :cutoff",
            new MapSqlParameterSource("cutoff", Timestamp.from(cutoff.get()))
        );
        if (removed > 0) {
            log.info("Purged {} expired cache entries", removed);
        }
        return removed;
    }

    public CacheStats stats() {
        Long total = jdbc.queryForObject(
            "SELECT COUNT(*) FROM content_cache",
            new MapSqlParameterSource(),
            Long.class
        );
        long totalEntries = total == null ? 0L : total;
        Optional<Instant> cutoff = cutoff(Instant.now());
        long expiredEntries = 0L;
        if (cutoff.isPresent()) {
            Long expired = jdbc.queryForObject(
                "SELECT COUNT(*) FROM content_cache WHERE cached_at < :cutoff",
                new MapSqlParameterSource("cutoff", Timestamp.from(cutoff.get())),
                Long.class
            );
            expiredEntries = expired == null ? 0L : expired;
        }
        return new CacheStats(totalEntries, totalEntries - expiredEntries, expiredEntries);
    }

    private boolean isExpired(Instant cachedAt, Instant now) {
        Optional<Instant> cutoff = cutoff(now);
        return cutoff.isPresent() && cachedAt != null && cachedAt.isBefore(cutoff.get());
    }

    private Optional<Instant> cutoff(Instant now) {
        int ttlDays = properties.getTtlDays();
        if (ttlDays <= 0) {
            return Optional.empty();
        }
        return Optional.of(now.minus(Duration.ofDays(ttlDays)));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private record CachedRow(byte[] payload, Instant cachedAt) {
    }
}
