package com.kura.search.service;

import com.kura.search.model.QueryLogEntry;
import com.kura.search.model.SearchMethod;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public class QueryLogRepository {

    private final JdbcTemplate jdbcTemplate;

    public QueryLogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void append(QueryLogEntry entry) {
        jdbcTemplate.update(
                "INSERT INTO query_logs (query_text, owner_id, result_count, search_method, latency_ms, status, created_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                entry.query() == null ? "" : entry.query(),
                entry.ownerId(),
                entry.resultCount(),
                entry.method() == null ? null : entry.method().label(),
                entry.elapsedMs(),
                entry.outcome(),
                Timestamp.from(entry.loggedAt())
        );
    }

    public List<QueryLogEntry> findRecent(String ownerId, int limit) {
        return jdbcTemplate.query(
                "SELECT query_text, owner_id, result_count, search_method, latency_ms, status, created_at "
                        + "FROM query_logs WHERE owner_id = ? ORDER BY created_at DESC LIMIT ?",
                (rs, rowNum) -> new QueryLogEntry(
                        rs.getString("query_text"),
                        rs.getInt("result_count"),
                        parseMethod(rs.getString("search_method")),
                        rs.getDouble("latency_ms"),
                        rs.getString("owner_id"),
                        rs.getString("status"),
                        rs.getTimestamp("created_at").toInstant()
                ),
                ownerId,
                limit
        );
    }

    private static SearchMethod parseMethod(String label) {
        if (label == null) {
            return null;
        }
        for (SearchMethod method : SearchMethod.values()) {
            if (method.label().equals(label)) {
                return method;
            }
        }
        return null;
    }
}
