package com.kura.search.client;

import com.kura.search.error.Backend;
import com.kura.search.error.BackendException;
import com.kura.search.error.FailureKind;
import com.kura.search.model.ContentAttributes;
import com.kura.search.model.ContentMetadata;
import com.kura.search.model.ContentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

@Repository
public class JdbcMetadataStore implements MetadataStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcMetadataStore.class);

    private static final String ATTRIBUTES_SQL = """
            SELECT id, user_id, content_type, tags, created_at
            FROM content
            WHERE id = ANY (?)
            """;

    private static final String METADATA_SQL = """
            SELECT id, user_id, title, content_type, tags, created_at, updated_at,
                   source, annotation, extracted_text
            FROM content
            WHERE id = ANY (?)
            """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcMetadataStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<ContentAttributes> findAttributes(Collection<String> ids) {
        return queryByIds(ATTRIBUTES_SQL, ids, (rs, rowNum) -> new ContentAttributes(
                rs.getString("id"),
                rs.getString("user_id"),
                readContentType(rs),
                readTextArray(rs, "tags"),
                readInstant(rs, "created_at")
        ));
    }

    @Override
    public List<ContentMetadata> findByIds(Collection<String> ids) {
        return queryByIds(METADATA_SQL, ids, (rs, rowNum) -> new ContentMetadata(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("title"),
                readContentType(rs),
                readTextArray(rs, "tags"),
                readInstant(rs, "created_at"),
                readInstant(rs, "updated_at"),
                rs.getString("source"),
                rs.getString("annotation"),
                rs.getString("extracted_text")
        ));
    }

    private <T> List<T> queryByIds(String sql, Collection<String> ids, RowMapper<T> mapper) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        try {
            return jdbcTemplate.query(sql, ps -> {
                Array arr = ps.getConnection().createArrayOf("text", ids.toArray());
                ps.setArray(1, arr);
            }, mapper);
        } catch (DataAccessException ex) {
            throw new BackendException(Backend.METADATA, FailureKind.UNAVAILABLE, "metadata_query_failed", ex);
        }
    }

    private static ContentType readContentType(ResultSet rs) throws SQLException {
        String raw = rs.getString("content_type");
        try {
            return ContentType.fromLabel(raw);
        } catch (RuntimeException ex) {
            log.warn("event=unknown_content_type id={} content_type={}", rs.getString("id"), raw);
            return null;
        }
    }

    private static Instant readInstant(ResultSet rs, String col) throws SQLException {
        Timestamp ts = rs.getTimestamp(col);
        return ts == null ? null : ts.toInstant();
    }

    private static List<String> readTextArray(ResultSet rs, String col) throws SQLException {
        Array arr = rs.getArray(col);
        if (arr == null) {
            return List.of();
        }
        String[] values = (String[]) arr.getArray();
        if (values == null) {
            return List.of();
        }
        return Arrays.stream(values).filter(Objects::nonNull).distinct().toList();
    }
}
