package com.nevis.corpus.model;

/**
 * A mention of an entity inside a chunk. Only {@code key} identifies the entity; the rest describes the mention.
 */
public record EntityInChunk(
    String key,
    String canonicalForm,
    String kind,
    int offset
) {}
