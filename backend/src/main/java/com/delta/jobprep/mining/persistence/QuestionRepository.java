package com.delta.jobprep.mining.persistence;

import com.delta.jobprep.mining.model.CandidateItem;
import com.delta.jobprep.mining.model.Difficulty;
import com.delta.jobprep.mining.model.JobProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only question store. Skill tags are kept as a JSON array so tags containing commas survive.
 */
@Repository
public class QuestionRepository {
    private static final Logger log = LoggerFactory.getLogger(QuestionRepository.class);
    private static final TypeReference<List<String>> SKILL_LIST = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<CandidateItem> questionRow;

    public QuestionRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.questionRow = (rs, rowNum) -> new CandidateItem(
            rs.getString("question_text"),
            rs.getString("answer"),
            rs.getString("category"),
            Difficulty.fromLabel(rs.getString("difficulty")),
            readSkills(rs.getString("skills")),
            rs.getDouble("relevance_score")
        );
    }

    public void insertQuestion(JobProfile profile, CandidateItem question) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("company", profile.company())
            .addValue("role", profile.role())
            .addValue("questionText", question.text())
            .addValue("answer", question.answer())
            .addValue("difficulty", question.difficulty().label())
            .addValue("category", question.category())
            .addValue("skills", writeSkills(question.skills()))
            .addValue("relevanceScore", question.relevanceScore())
            .addValue("createdAt", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                INSERT INTO questions (
                    company, role, question_text, answer, difficulty, category, skills, relevance_score, created_at
                )
                VALUES (
                    :company, :role, :questionText, :answer, :difficulty, :category, :skills, :relevanceScore, :createdAt
                )
                """,
            params
        );
    }

    public List<CandidateItem> findQuestions(String company, String role, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("company", SearchResultRepository.likePattern(company))
            .addValue("role", SearchResultRepository.likePattern(role))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT question_text, answer, difficulty, category, skills, relevance_score
                FROM questions
                WHERE LOWER(company) LIKE :company
                  AND LOWER(role) LIKE :role
                ORDER BY relevance_score DESC, id
                LIMIT :limit
                """,
            params,
            questionRow
        );
    }

    String writeSkills(Set<String> skills) {
        try {
            return objectMapper.writeValueAsString(skills == null ? List.of() : List.copyOf(skills));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize skill tags", e);
        }
    }

    Set<String> readSkills(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        try {
            List<String> skills = objectMapper.readValue(raw, SKILL_LIST);
            return skills == null ? Set.of() : new LinkedHashSet<>(skills);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable skill tags: {}", e.getMessage());
            return Set.of();
        }
    }
}
