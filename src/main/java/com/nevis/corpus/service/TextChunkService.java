package com.nevis.corpus.service;

import com.nevis.corpus.model.Entity;
import com.nevis.corpus.model.EntityInChunk;
import com.nevis.corpus.model.TextChunk;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface TextChunkService {
    TextChunk createChunk(UUID documentId, String text, int offset, List<String> tokens);
    TextChunk addEntity(UUID chunkId, EntityInChunk entity);
    TextChunk getById(UUID chunkId);
    List<TextChunk> getChunksOfDocument(UUID documentId);
    List<TextChunk> chunkDocumentBySentences(UUID documentId);
    List<TextChunk> chunksWithBothEntities(Entity first, Entity second);
    List<TextChunk> chunksWithAllEntities(Collection<Entity> entities);
}
