package com.nevis.corpus.repository;

import com.nevis.corpus.model.Document;
import com.nevis.corpus.model.PreprocessMetadata;
import com.nevis.corpus.model.StepOutcome;
import com.nevis.corpus.preprocess.PreprocessStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Documents in PostgreSQL. Every preprocess step owns a {@code <step>_result} array column and a
 * {@code <step>_done_at} column; the latter alone tells whether the step is done, so empty results survive.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcDocumentRepository implements DocumentRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<Document> documentRowMapper = (rs, rowNum) -> new Document(
        rs.getObject("id", UUID.class),
        rs.getString("human_identifier"),
        rs.getString("title"),
        rs.getString("url"),
        rs.getString("text"),
        rs.getObject("created_at", OffsetDateTime.class),
        new PreprocessMetadata(
            outcome(rs, PreprocessStep.TOKENIZATION, String[].class),
            outcome(rs, PreprocessStep.SEGMENTATION, Integer[].class),
            outcome(rs, PreprocessStep.TAGGING, String[].class),
            outcome(rs, PreprocessStep.NERC, String[].class)
        )
    );

    @Override
    @Transactional
    public Document save(Document document) {
        PreprocessMetadata metadata = document.getPreprocessMetadata();

        return jdbcClient.sql("""
                INSERT INTO documents (
                    id, human_identifier, title, url, text, created_at,
                    tokenization_result, tokenization_done_at,
                    segmentation_result, segmentation_done_at,
                    tagging_result, tagging_done_at,
                    nerc_result, nerc_done_at
                )
                VALUES (
                    :id, :humanIdentifier, :title, :url, :text, COALESCE(:createdAt, NOW()),
                    :tokenizationResult, :tokenizationDoneAt,
                    :segmentationResult, :segmentationDoneAt,
                    :taggingResult, :taggingDoneAt,
                    :nercResult, :nercDoneAt
                )
                ON CONFLICT (id) DO UPDATE SET
                    tokenization_result = EXCLUDED.tokenization_result,
                    tokenization_done_at = EXCLUDED.tokenization_done_at,
                    segmentation_result = EXCLUDED.segmentation_result,
                    segmentation_done_at = EXCLUDED.segmentation_done_at,
                    tagging_result = EXCLUDED.tagging_result,
                    tagging_done_at = EXCLUDED.tagging_done_at,
                    nerc_result = EXCLUDED.nerc_result,
                    nerc_done_at = EXCLUDED.nerc_done_at
                RETURNING *
                """)
            .param("id", document.getId())
            .param("humanIdentifier", document.getHumanIdentifier())
            .param("title", document.getTitle())
            .param("url", document.getUrl())
            .param("text", document.getText())
            .param("createdAt", document.getCreatedAt())
            .param("tokenizationResult", toArray(metadata.tokenization(), new String[0]))
            .param("tokenizationDoneAt", doneAt(metadata.tokenization()))
            .param("segmentationResult", toArray(metadata.segmentation(), new Integer[0]))
            .param("segmentationDoneAt", doneAt(metadata.segmentation()))
            .param("taggingResult", toArray(metadata.tagging(), new String[0]))
            .param("taggingDoneAt", doneAt(metadata.tagging()))
            .param("nercResult", toArray(metadata.nerc(), new String[0]))
            .param("nercDoneAt", doneAt(metadata.nerc()))
            .query(documentRowMapper)
            .single();
    }

    @Override
    public Optional<Document> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public Optional<Document> findByHumanIdentifier(String humanIdentifier) {
        return jdbcClient.sql("SELECT * FROM documents WHERE human_identifier = :humanIdentifier")
            .param("humanIdentifier", humanIdentifier)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Document> findAll(DocumentFilter filter) {
        Optional<String> where = whereClause(filter);
        String sql = "SELECT * FROM documents" + where.map(w -> " WHERE " + w).orElse("") + " ORDER BY created_at, id";

        List<Document> documents = jdbcClient.sql(sql)
            .query(documentRowMapper)
            .list();

        if (where.isPresent()) {
            return documents;
        }
        log.debug("Filter {} has no SQL form, evaluating over {} documents", filter, documents.size());
        return documents.stream().filter(filter).toList();
    }

    @Override
    public long count() {
        return jdbcClient.sql("SELECT COUNT(*) FROM documents")
            .query(Long.class)
            .single();
    }

    private static Optional<String> whereClause(DocumentFilter filter) {
        if (filter instanceof DocumentFilter.All) {
            return Optional.of("TRUE");
        }
        if (filter instanceof DocumentFilter.RawText) {
            return Optional.of("text = ''");
        }
        if (filter instanceof DocumentFilter.LackingPreprocess lacking) {
            return Optional.of(doneAtColumn(lacking.step()) + " IS NULL");
        }
        return Optional.empty();
    }

    private static String doneAtColumn(PreprocessStep step) {
        return step.name().toLowerCase(Locale.ROOT) + "_done_at";
    }

    private static String resultColumn(PreprocessStep step) {
        return step.name().toLowerCase(Locale.ROOT) + "_result";
    }

    private static <T> StepOutcome<T> outcome(ResultSet rs, PreprocessStep step, Class<T[]> arrayType)
        throws SQLException {
        OffsetDateTime doneAt = rs.getObject(doneAtColumn(step), OffsetDateTime.class);
        if (doneAt == null) {
            return null;
        }
        Array array = rs.getArray(resultColumn(step));
        List<T> result = array == null ? List.of() : Arrays.asList(arrayType.cast(array.getArray()));
        return new StepOutcome<>(result, doneAt);
    }

    private static <T> T[] toArray(StepOutcome<T> outcome, T[] template) {
        return outcome == null ? null : outcome.result().toArray(template);
    }

    private static OffsetDateTime doneAt(StepOutcome<?> outcome) {
        return outcome == null ? null : outcome.doneAt();
    }
}
