package com.surveyflow.runtime.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.surveyflow.runtime.session.SessionModels.SessionState;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Session rows keyed by session id. Writes are compare-and-swap on the {@code version} column, so
 * two requests that read the same version cannot both commit.
 */
@Repository
public class SessionJdbcRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public SessionJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public SessionState insert(SessionState state) {
        SessionState stored = state.withVersion(0);
        jdbcTemplate.update(
                "INSERT INTO survey_sessions(session_id, survey_id, version, status, current_page_id, state_json, updated_at) VALUES (?,?,?,?,?,?,?)",
                stored.sessionId(), stored.surveyId(), 0L, stored.status().name(), stored.currentPageId(),
                write(stored), Instant.now().toString());
        return stored;
    }

    public Optional<SessionState> find(String sessionId) {
        List<SessionState> rows = jdbcTemplate.query(
                "SELECT version, state_json FROM survey_sessions WHERE session_id=?",
                (rs, rowNum) -> read(rs.getString(2)).withVersion(rs.getLong(1)),
                sessionId);
        return rows.stream().findFirst();
    }

    /**
     * @return false when the stored version is no longer {@code expectedVersion}
     */
    public boolean compareAndSwap(SessionState updated, long expectedVersion) {
        SessionState next = updated.withVersion(expectedVersion + 1);
        int rows = jdbcTemplate.update(
                "UPDATE survey_sessions SET version=?, status=?, current_page_id=?, state_json=?, updated_at=? WHERE session_id=? AND version=?",
                next.version(), next.status().name(), next.currentPageId(), write(next), Instant.now().toString(),
                next.sessionId(), expectedVersion);
        return rows == 1;
    }

    private String write(SessionState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize session " + state.sessionId(), e);
        }
    }

    private SessionState read(String json) {
        try {
            return objectMapper.readValue(json, SessionState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read stored session state", e);
        }
    }
}
