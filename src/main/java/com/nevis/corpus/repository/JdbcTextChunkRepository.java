package com.nevis.corpus.repository;

import com.nevis.corpus.model.EntityInChunk;
import com.nevis.corpus.model.TextChunk;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static java.util.stream.Collectors.groupingBy;
import static java.util.stream.Collectors.mapping;

@Repository
@RequiredArgsConstructor
public class JdbcTextChunkRepository implements TextChunkRepository {

    private final JdbcClient jdbcClient;

    private final JdbcTemplate jdbcTemplate;

    private record ChunkRow(UUID id, UUID documentId, String text, int offset, List<String> tokens) {}

    private record EntityRow(UUID chunkId, EntityInChunk entity) {}

    private final RowMapper<ChunkRow> chunkRowMapper = (rs, rowNum) -> {
        Array tokens = rs.getArray("tokens");
        return new ChunkRow(
            rs.getObject("id", UUID.class),
            rs.getObject("document_id", UUID.class),
            rs.getString("text"),
            rs.getInt("token_offset"),
            tokens == null ? List.of() : Arrays.asList((String[]) tokens.getArray())
        );
    };

    private final RowMapper<EntityRow> entityRowMapper = (rs, rowNum) -> new EntityRow(
        rs.getObject("chunk_id", UUID.class),
        new EntityInChunk(
            rs.getString("entity_key"),
            rs.getString("canonical_form"),
            rs.getString("kind"),
            rs.getInt("mention_offset")
        )
    );

    @Override
    @Transactional
    public TextChunk save(TextChunk chunk) {
        jdbcClient.sql("""
                INSERT INTO text_chunks (id, document_id, text, token_offset, tokens)
                VALUES (:id, :documentId, :text, :offset, :tokens)
                ON CONFLICT (id) DO UPDATE SET
                    text = EXCLUDED.text,
                    token_offset = EXCLUDED.token_offset,
                    tokens = EXCLUDED.tokens
                """)
            .param("id", chunk.getId())
            .param("documentId", chunk.getDocumentId())
            .param("text", chunk.getText())
            .param("offset", chunk.getOffset())
            .param("tokens", chunk.getTokens().toArray(new String[0]))
            .update();

        replaceEntities(chunk.getId(), chunk.getEntities());
        return chunk;
    }

    @Override
    @Transactional
    public void saveAll(List<TextChunk> chunks) {
        chunks.forEach(this::save);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TextChunk> findById(UUID id) {
        List<ChunkRow> rows = jdbcClient.sql("SELECT * FROM text_chunks WHERE id = :id")
            .param("id", id)
            .query(chunkRowMapper)
            .list();

        return withEntities(rows).stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public List<TextChunk> findByDocumentId(UUID documentId) {
        List<ChunkRow> rows = jdbcClient.sql("""
                SELECT * FROM text_chunks
                WHERE document_id = :documentId
                ORDER BY token_offset, id
                """)
            .param("documentId", documentId)
            .query(chunkRowMapper)
            .list();

        return withEntities(rows);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TextChunk> findMentioningAll(Collection<String> entityKeys) {
        Set<String> keys = new LinkedHashSet<>(entityKeys);
        if (keys.isEmpty()) {
            return List.of();
        }

        List<ChunkRow> rows = jdbcClient.sql("""
                SELECT * FROM text_chunks
                WHERE id IN (
                    SELECT chunk_id
                    FROM chunk_entities
                    WHERE entity_key = ANY(:keys)
                    GROUP BY chunk_id
                    HAVING COUNT(DISTINCT entity_key) = :keyCount
                )
                ORDER BY document_id, token_offset, id
                """)
            .param("keys", keys.toArray(new String[0]))
            .param("keyCount", keys.size())
            .query(chunkRowMapper)
            .list();

        return withEntities(rows);
    }

    @Override
    @Transactional
    public int deleteByDocumentId(UUID documentId) {
        return jdbcClient.sql("DELETE FROM text_chunks WHERE document_id = :documentId")
            .param("documentId", documentId)
            .update();
    }

    private void replaceEntities(UUID chunkId, List<EntityInChunk> entities) {
        jdbcClient.sql("DELETE FROM chunk_entities WHERE chunk_id = :chunkId")
            .param("chunkId", chunkId)
            .update();

        if (entities.isEmpty()) {
            return;
        }

        String sql = """
                INSERT INTO chunk_entities (chunk_id, position, entity_key, canonical_form, kind, mention_offset)
                VALUES (?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                EntityInChunk entity = entities.get(i);
                ps.setObject(1, chunkId);
                ps.setInt(2, i);
                ps.setString(3, entity.key());
                ps.setString(4, entity.canonicalForm());
                ps.setString(5, entity.kind());
                ps.setInt(6, entity.offset());
            }

            @Override
            public int getBatchSize() {
                return entities.size();
            }
        });
    }

    private List<TextChunk> withEntities(List<ChunkRow> rows) {
        if (rows.isEmpty()) {
            return List.of();
        }

        String[] ids = rows.stream().map(row -> row.id().toString()).toArray(String[]::new);
        Map<UUID, List<EntityInChunk>> entitiesByChunk = jdbcClient.sql("""
                SELECT * FROM chunk_entities
                WHERE chunk_id = ANY(CAST(:ids AS uuid[]))
                ORDER BY chunk_id, position
                """)
            .param("ids", ids)
            .query(entityRowMapper)
            .list()
            .stream()
            .collect(groupingBy(EntityRow::chunkId, mapping(EntityRow::entity, Collectors.toList())));

        List<TextChunk> chunks = new ArrayList<>(rows.size());
        for (ChunkRow row : rows) {
            chunks.add(new TextChunk(
                row.id(),
                row.documentId(),
                row.text(),
                row.offset(),
                row.tokens(),
                entitiesByChunk.getOrDefault(row.id(), List.of())
            ));
        }
        return chunks;
    }
}
