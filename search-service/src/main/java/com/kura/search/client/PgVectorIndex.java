package com.kura.search.client;

import com.kura.search.error.Backend;
import com.kura.search.error.BackendException;
import com.kura.search.error.FailureKind;
import com.kura.search.model.VectorHit;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * pgvector-backed index. {@code <=>} is cosine distance, so the nearest rows
 * come first.
 */
@Repository
public class PgVectorIndex implements VectorIndex {

    private static final String NEAREST_SQL = """
            SELECT content_id,
                   (embedding <=> CAST(? AS vector)) AS distance
            FROM content_embeddings
            WHERE owner_id = ?
            ORDER BY embedding <=> CAST(? AS vector)
            LIMIT ?
            """;

    private final JdbcTemplate jdbcTemplate;

    public PgVectorIndex(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<VectorHit> query(float[] vector, int k, String ownerId) {
        String vectorLiteral = toVectorLiteral(vector);
        try {
            return jdbcTemplate.query(
                    NEAREST_SQL,
                    (rs, rowNum) -> new VectorHit(rs.getString("content_id"), rs.getDouble("distance")),
                    vectorLiteral,
                    ownerId,
                    vectorLiteral,
                    k
            );
        } catch (QueryTimeoutException ex) {
            throw new BackendException(Backend.VECTOR, FailureKind.TIMEOUT, "vector_query_timeout", ex);
        } catch (TransientDataAccessResourceException ex) {
            throw new BackendException(Backend.VECTOR, FailureKind.UNAVAILABLE, "vector_store_unreachable", ex);
        } catch (DataAccessException ex) {
            throw new BackendException(Backend.VECTOR, FailureKind.UNAVAILABLE, "vector_query_failed", ex);
        }
    }

    static String toVectorLiteral(float[] vector) {
        StringBuilder sb = new StringBuilder(vector.length * 10 + 2);
        sb.append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(vector[i]);
        }
        sb.append(']');
        return sb.toString();
    }
}
