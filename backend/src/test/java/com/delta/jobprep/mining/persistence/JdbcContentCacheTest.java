package com.delta.jobprep.mining.persistence;

import com.delta.jobprep.mining.model.CacheStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcContentCacheTest {

    @Autowired
    private JdbcContentCache cache;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void storedPayloadIsReturnedAndLastWriteWins() {
        String url = uniqueUrl();
        cache.put(url, bytes("first"));
        cache.put(url, bytes("second"));

        assertThat(cache.get(url)).hasValueSatisfying(payload ->
            assertThat(new String(payload, StandardCharsets.UTF_8)).isEqualTo("second"));
        assertThat(cache.get(uniqueUrl())).isEmpty();
    }

    @Test
    void expiredEntryIsAMissAndIsRemoved() {
        String url = uniqueUrl();
        cache.put(url, bytes("stale"));
        age(url, Duration.ofDays(8));

        assertThat(cache.get(url)).isEmpty();
        assertThat(rowCount(url)).isZero();
    }

    @Test
    void purgeRemovesOnlyExpiredEntries() {
        CacheStats before = cache.stats();
        String fresh = uniqueUrl();
        String stale = uniqueUrl();
        cache.put(fresh, bytes("fresh"));
        cache.put(stale, bytes("stale"));
        age(stale, Duration.ofDays(30));

        CacheStats during = cache.stats();
        assertThat(during.totalEntries()).isEqualTo(before.totalEntries() + 2);
        assertThat(during.expiredEntries()).isEqualTo(before.expiredEntries() + 1);

        assertThat(cache.purgeExpired()).isGreaterThanOrEqualTo(1);
        assertThat(rowCount(stale)).isZero();
        assertThat(rowCount(fresh)).isEqualTo(1);
        assertThat(cache.stats().expiredEntries()).isZero();
    }

    private void age(String url, Duration age) {
        jdbc.update(
            "UPDATE content_cache SET cached_at = :cachedAt WHERE url = :url",
            new MapSqlParameterSource()
                .addValue("cachedAt", Timestamp.from(Instant.now().minus(age)))
                .addValue("url", url)
        );
    }

    private long rowCount(String url) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM content_cache WHERE url = :url",
            new MapSqlParameterSource("url", url),
            Long.class
        );
        return count == null ? 0L : count;
    }

    private static String uniqueUrl() {
        return "https://cache.example.com/" + UUID.randomUUID();
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
