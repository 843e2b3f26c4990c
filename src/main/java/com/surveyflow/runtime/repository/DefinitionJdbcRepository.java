package com.surveyflow.runtime.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class DefinitionJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public DefinitionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public record StoredDefinition(String surveyId, String version, String title, String content, String importedAt) {}

    public void save(String surveyId, String version, String title, String content) {
        jdbcTemplate.update(
                "MERGE INTO survey_definitions(survey_id, version, title, content, imported_at) KEY(survey_id) VALUES (?,?,?,?,?)",
                surveyId, version, title, content, Instant.now().toString());
    }

    public Optional<StoredDefinition> find(String surveyId) {
        return jdbcTemplate.query(
                "SELECT survey_id, version, title, content, imported_at FROM survey_definitions WHERE survey_id=?",
                (rs, rowNum) -> new StoredDefinition(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5)),
                surveyId).stream().findFirst();
    }

    public List<String> surveyIds() {
        return jdbcTemplate.queryForList("SELECT survey_id FROM survey_definitions ORDER BY survey_id", String.class);
    }
}
