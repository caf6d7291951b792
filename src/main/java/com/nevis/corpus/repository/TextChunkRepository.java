package com.nevis.corpus.repository;

import com.nevis.corpus.model.TextChunk;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TextChunkRepository {
    TextChunk save(TextChunk chunk);
    void saveAll(List<TextChunk> chunks);
    Optional<TextChunk> findById(UUID id);
    List<TextChunk> findByDocumentId(UUID documentId);

    /**
     * Removes every chunk of the document together with its mentions.
     *
     * @return the number of chunks removed
     */
    int deleteByDocumentId(UUID documentId);

    /**
     * Chunks holding at least one mention of every key in {@code entityKeys}.
     */
    List<TextChunk> findMentioningAll(Collection<String> entityKeys);
}
