package com.nevis.corpus.service;

import com.nevis.corpus.config.ChunkingProperties;
import com.nevis.corpus.exception.EntityNotFoundException;
import com.nevis.corpus.model.Document;
import com.nevis.corpus.model.Entity;
import com.nevis.corpus.model.EntityInChunk;
import com.nevis.corpus.model.TextChunk;
import com.nevis.corpus.repository.DocumentRepository;
import com.nevis.corpus.repository.TextChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class TextChunkServiceImpl implements TextChunkService {

    private final TextChunkRepository chunkRepository;
    private final DocumentRepository documentRepository;
    private final ChunkingProperties chunkingProperties;

    @Override
    @Transactional
    public TextChunk createChunk(UUID documentId, String text, int offset, List<String> tokens) {
        requireDocument(documentId);
        TextChunk chunk = chunkRepository.save(TextChunk.create(documentId, text, offset, tokens));
        log.debug("Doc {}: created chunk {} at offset {}", documentId, chunk.getId(), offset);
        return chunk;
    }

    @Override
    @Transactional
    public TextChunk addEntity(UUID chunkId, EntityInChunk entity) {
        TextChunk chunk = getById(chunkId);
        chunk.getEntities().add(entity);
        return chunkRepository.save(chunk);
    }

    @Override
    @Transactional(readOnly = true)
    public TextChunk getById(UUID chunkId) {
        return chunkRepository.findById(chunkId)
            .orElseThrow(() -> {
                log.warn("Chunk not found with ID: {}", chunkId);
                return new EntityNotFoundException("Chunk", chunkId);
            });
    }

    @Override
    @Transactional(readOnly = true)
    public List<TextChunk> getChunksOfDocument(UUID documentId) {
        return chunkRepository.findByDocumentId(documentId);
    }

    /**
     * Splits a segmented document into chunks of {@code app.chunking.sentences-per-chunk} consecutive sentences.
     * The new chunks replace all chunks the document had, so calling this again does not duplicate content.
     */
    @Override
    @Transactional
    public List<TextChunk> chunkDocumentBySentences(UUID documentId) {
        Document document = requireDocument(documentId);
        int window = chunkingProperties.sentencesPerChunk();

        List<TextChunk> chunks = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        int sentencesInWindow = 0;
        int chunkStart = 0;
        int position = 0;

        for (List<String> sentence : document.getSentences()) {
            pending.addAll(sentence);
            position += sentence.size();
            sentencesInWindow++;
            if (sentencesInWindow == window) {
                chunks.add(TextChunk.create(documentId, String.join(" ", pending), chunkStart, pending));
                pending.clear();
                sentencesInWindow = 0;
                chunkStart = position;
            }
        }
        if (sentencesInWindow > 0) {
            chunks.add(TextChunk.create(documentId, String.join(" ", pending), chunkStart, pending));
        }

        int replaced = chunkRepository.deleteByDocumentId(documentId);
        chunkRepository.saveAll(chunks);
        log.info("Doc {}: built {} chunks of up to {} sentences, replacing {}", documentId, chunks.size(), window, replaced);
        return chunks;
    }

    @Override
    @Transactional(readOnly = true)
    public List<TextChunk> chunksWithBothEntities(Entity first, Entity second) {
        return chunksWithAllEntities(List.of(first, second));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TextChunk> chunksWithAllEntities(Collection<Entity> entities) {
        if (entities == null || entities.isEmpty()) {
            throw new IllegalArgumentException("At least one entity is required");
        }

        Set<String> keys = new LinkedHashSet<>();
        entities.forEach(entity -> keys.add(entity.key()));

        List<TextChunk> chunks = chunkRepository.findMentioningAll(keys);
        log.debug("{} chunks mention all of {}", chunks.size(), keys);
        return chunks;
    }

    private Document requireDocument(UUID documentId) {
        return documentRepository.findById(documentId)
            .orElseThrow(() -> new EntityNotFoundException("Document", documentId));
    }
}
