package com.nevis.corpus.repository;

import com.nevis.corpus.model.Document;
import com.nevis.corpus.model.Entity;
import com.nevis.corpus.model.EntityInChunk;
import com.nevis.corpus.model.TextChunk;
import com.nevis.corpus.preprocess.PreprocessStep;
import com.nevis.corpus.service.TextChunkService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcTextChunkRepositoryTest extends BaseIntegrationTest {

    @Autowired
    private TextChunkRepository chunkRepository;

    @Autowired
    private DocumentRepository documentRepository;

    @Autowired
    private TextChunkService chunkService;

    @Autowired
    private JdbcClient jdbcClient;

    private Document document;

    @BeforeEach
    void setUp() {
        jdbcClient.sql("DELETE FROM documents").update();
        document = documentRepository.save(Document.create("doc-" + UUID.randomUUID(), "Some text"));
    }

    private TextChunk chunkMentioning(String... keys) {
        TextChunk chunk = TextChunk.create(document.getId(), "chunk", 0, List.of("chunk"));
        for (String key : keys) {
            chunk.getEntities().add(new EntityInChunk(key, "Entity" + key, "person", 1));
        }
        return chunkRepository.save(chunk);
    }

    @Test
    @DisplayName("Only chunks mentioning both entities are returned")
    void shouldReturnChunksWithBothEntities() {
        chunkMentioning("A");
        TextChunk c2 = chunkMentioning("A", "B");
        chunkMentioning("B");

        List<TextChunk> chunks = chunkService.chunksWithBothEntities(new Entity("A"), new Entity("B"));

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0)).isEqualTo(c2);
    }

    @Test
    @DisplayName("Repeated mentions do not produce duplicate or false matches")
    void shouldIgnoreRepeatedMentions() {
        chunkMentioning("A", "A");
        TextChunk both = chunkMentioning("A", "B", "A", "B");

        assertThat(chunkRepository.findMentioningAll(List.of("A", "B"))).containsExactly(both);
    }

    @Test
    @DisplayName("Any number of entities can be intersected")
    void shouldIntersectManyEntities() {
        chunkMentioning("A", "B");
        TextChunk all = chunkMentioning("C", "B", "A");

        assertThat(chunkRepository.findMentioningAll(List.of("A", "B", "C"))).containsExactly(all);
        assertThat(chunkRepository.findMentioningAll(List.of("A", "Z"))).isEmpty();
    }

    @Test
    @DisplayName("Mentions round-trip in order with their payload")
    void shouldRoundTripEntities() {
        TextChunk chunk = chunkMentioning("B", "A", "B");

        TextChunk found = chunkRepository.findById(chunk.getId()).orElseThrow();

        assertThat(found.getEntities()).containsExactlyElementsOf(chunk.getEntities());
        assertThat(found.getTokens()).containsExactly("chunk");
        assertThat(found.getDocumentId()).isEqualTo(document.getId());
    }

    @Test
    @DisplayName("Saving again replaces the mentions")
    void shouldReplaceEntitiesOnSave() {
        TextChunk chunk = chunkMentioning("A");
        chunk.getEntities().add(new EntityInChunk("B", "EntityB", "org", 3));
        chunkRepository.save(chunk);

        assertThat(chunkRepository.findById(chunk.getId()).orElseThrow().getEntities())
            .extracting(EntityInChunk::key)
            .containsExactly("A", "B");
        assertThat(chunkRepository.findByDocumentId(document.getId())).containsExactly(chunk);
    }

    @Test
    @DisplayName("Lookups over more chunks and keys than a statement can bind one by one")
    void shouldHandleMoreIdsThanBindParameters() {
        int count = 33_000;
        jdbcClient.sql("""
                INSERT INTO text_chunks (id, document_id, text, token_offset, tokens)
                SELECT gen_random_uuid(), :documentId, 'chunk', n, ARRAY['chunk']
                FROM generate_series(1, :count) AS n
                """)
            .param("documentId", document.getId())
            .param("count", count)
            .update();
        jdbcClient.sql("""
                INSERT INTO chunk_entities (chunk_id, position, entity_key, canonical_form, kind, mention_offset)
                SELECT id, 0, 'K', 'Key', 'org', 0 FROM text_chunks WHERE document_id = :documentId
                """)
            .param("documentId", document.getId())
            .update();

        List<TextChunk> chunks = chunkRepository.findByDocumentId(document.getId());

        assertThat(chunks).hasSize(count);
        assertThat(chunks).allMatch(chunk -> chunk.getEntities().size() == 1);

        List<String> keys = IntStream.range(0, count).mapToObj(i -> "key-" + i).toList();
        assertThat(chunkRepository.findMentioningAll(keys)).isEmpty();
    }

    @Test
    @DisplayName("Chunking by sentences again replaces the earlier chunks")
    void shouldReplaceSentenceChunks() {
        TextChunk unrelated = chunkMentioning("B");
        Document segmented = Document.create("segmented-" + UUID.randomUUID(), "Some sentence . Indeed !");
        segmented.setPreprocessResult(PreprocessStep.TOKENIZATION, List.of("Some", "sentence", ".", "Indeed", "!"))
            .setPreprocessResult(PreprocessStep.SEGMENTATION, List.of(0, 3, 5));
        documentRepository.save(segmented);

        List<TextChunk> first = chunkService.chunkDocumentBySentences(segmented.getId());
        chunkService.addEntity(first.get(0).getId(), new EntityInChunk("A", "Some", "misc", 0));
        List<TextChunk> second = chunkService.chunkDocumentBySentences(segmented.getId());

        assertThat(chunkRepository.findByDocumentId(segmented.getId())).containsExactlyElementsOf(second);
        assertThat(chunkRepository.findById(first.get(0).getId())).isEmpty();
        assertThat(chunkRepository.findMentioningAll(List.of("A"))).isEmpty();
        assertThat(chunkRepository.findByDocumentId(document.getId())).containsExactly(unrelated);
    }

    @Test
    @DisplayName("Chunks must belong to an existing document")
    void shouldRejectOrphanChunk() {
        TextChunk orphan = TextChunk.create(UUID.randomUUID(), "orphan", 0, List.of());

        assertThatThrownBy(() -> chunkRepository.save(orphan))
            .isInstanceOf(DataIntegrityViolationException.class);
    }
}
