package com.delta.jobprep.mining.persistence;

import com.delta.jobprep.mining.model.ContentItem;
import com.delta.jobprep.mining.model.JobProfile;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Append-only sink for retained content items.
 */
@Repository
public class SearchResultRepository {
    private static final RowMapper<ContentItem> CONTENT_ROW = (rs, rowNum) -> {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new ContentItem(
            rs.getString("url"),
            rs.getString("title"),
            rs.getString("body"),
            rs.getString("source"),
            rs.getDouble("relevance_score"),
            createdAt == null ? null : createdAt.toInstant()
        );
    };

    private final NamedParameterJdbcTemplate jdbc;

    public SearchResultRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insertSearchResult(JobProfile profile, ContentItem item) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("company", profile.company())
            .addValue("role", profile.role())
            .addValue("url", item.url())
            .addValue("title", item.title())
            .addValue("body", item.body())
            .addValue("source", item.source())
            .addValue("relevanceScore", item.relevanceScore())
            .addValue("createdAt", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                INSERT INTO search_results (company, role, url, title, body, source, relevance_score, created_at)
                VALUES (:company, :role, :url, :title, :body, :source, :relevanceScore, :createdAt)
                """,
            params
        );
    }

    /**
     * Stored results ordered by score, newest first on ties. Blank filters match everything.
     */
    public List<ContentItem> findSearchResults(String company, String role, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("company", likePattern(company))
            .addValue("role", likePattern(role))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT url, title, body, source, relevance_score, created_at
                FROM search_results
                WHERE LOWER(company) LIKE :company
                  AND LOWER(role) LIKE :role
                ORDER BY relevance_score DESC, created_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            CONTENT_ROW
        );
    }

    public long countSearchResults() {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM search_results",
            new MapSqlParameterSource(),
            Long.class
        );
        return count == null ? 0L : count;
    }

    static String likePattern(String filter) {
        if (filter == null || filter.isBlank()) {
            return "%";
        }
        return "%" + filter.trim().toLowerCase(Locale.ROOT) + "%";
    }
}
