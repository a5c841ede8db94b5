package com.telcomax.assistant.rag;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * pgvector-backed index. Rows live in {@code chunk_embedding}, keyed by (namespace, id);
 * see {@code db/vector-schema.sql}.
 */
public class PgVectorIndex implements VectorIndex {

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String UPSERT_SQL = """
            INSERT INTO chunk_embedding (namespace, id, metadata, embedding)
            VALUES (?, ?, ?::jsonb, ?::vector)
            ON CONFLICT (namespace, id)
            DO UPDATE SET metadata = EXCLUDED.metadata, embedding = EXCLUDED.embedding
            """;

    private static final String QUERY_SQL = """
            SELECT id, metadata::text AS metadata, 1 - (embedding <=> ?::vector) AS score
            FROM chunk_embedding
            WHERE namespace = ?
            ORDER BY embedding <=> ?::vector
            LIMIT ?
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper mapper;

    public PgVectorIndex(JdbcTemplate jdbcTemplate, ObjectMapper mapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.mapper = mapper;
    }

    @Override
    public void upsert(String namespace, String id, float[] vector, Map<String, String> metadata) {
        try {
            jdbcTemplate.update(UPSERT_SQL, namespace, id, mapper.writeValueAsString(metadata),
                    toLiteral(vector));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chunk metadata id=" + id, e);
        } catch (DataAccessException e) {
            throw new VectorIndexException("Upsert failed namespace=" + namespace + " id=" + id, e);
        }
    }

    @Override
    public List<VectorMatch> query(String namespace, float[] vector, int topK) {
        String literal = toLiteral(vector);
        try {
            return jdbcTemplate.query(QUERY_SQL,
                    (rs, rowNum) -> new VectorMatch(
                            rs.getString("id"),
                            rs.getDouble("score"),
                            readMetadata(rs.getString("metadata"))),
                    literal, namespace, literal, topK);
        } catch (DataAccessException e) {
            throw new VectorIndexException("Query failed namespace=" + namespace, e);
        }
    }

    @Override
    public void deleteNamespace(String namespace) {
        try {
            jdbcTemplate.update("DELETE FROM chunk_embedding WHERE namespace = ?", namespace);
        } catch (DataAccessException e) {
            throw new VectorIndexException("Delete failed namespace=" + namespace, e);
        }
    }

    private Map<String, String> readMetadata(String json) {
        try {
            return mapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt chunk metadata", e);
        }
    }

    static String toLiteral(float[] vector) {
        StringBuilder sb = new StringBuilder(vector.length * 8).append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(vector[i]);
        }
        return sb.append(']').toString();
    }
}
