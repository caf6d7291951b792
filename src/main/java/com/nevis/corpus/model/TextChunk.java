package com.nevis.corpus.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A contiguous span of a document together with the entity mentions found in it.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TextChunk {

    @ToString.Include
    @EqualsAndHashCode.Include
    private final UUID id;

    @ToString.Include
    private final UUID documentId;
    private final String text;
    private final int offset;
    private final List<String> tokens;
    private final List<EntityInChunk> entities;

    public TextChunk(UUID id, UUID documentId, String text, int offset, List<String> tokens,
                     List<EntityInChunk> entities) {
        this.id = Objects.requireNonNull(id, "id");
        this.documentId = Objects.requireNonNull(documentId, "documentId");
        this.text = text == null ? "" : text;
        this.offset = offset;
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.entities = entities == null ? new ArrayList<>() : new ArrayList<>(entities);
    }

    public static TextChunk create(UUID documentId, String text, int offset, List<String> tokens) {
        return new TextChunk(UUID.randomUUID(), documentId, text, offset, tokens, List.of());
    }
}
