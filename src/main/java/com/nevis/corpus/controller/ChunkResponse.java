package com.nevis.corpus.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.corpus.model.EntityInChunk;
import com.nevis.corpus.model.TextChunk;

import java.util.List;
import java.util.UUID;

public record ChunkResponse(
    UUID id,

    @JsonProperty("document_id")
    UUID documentId,

    String text,

    int offset,

    List<String> tokens,

    List<Mention> entities
) {
    public record Mention(
        String key,

        @JsonProperty("canonical_form")
        String canonicalForm,

        String kind,

        int offset
    ) {
        static Mention from(EntityInChunk entity) {
            return new Mention(entity.key(), entity.canonicalForm(), entity.kind(), entity.offset());
        }
    }

    public static ChunkResponse from(TextChunk chunk) {
        return new ChunkResponse(
            chunk.getId(),
            chunk.getDocumentId(),
            chunk.getText(),
            chunk.getOffset(),
            chunk.getTokens(),
            chunk.getEntities().stream().map(Mention::from).toList()
        );
    }
}
