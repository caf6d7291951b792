package com.nevis.corpus.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final UUID entityId;

    public EntityNotFoundException(UUID entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }

    public EntityNotFoundException(String kind, UUID entityId) {
        super(kind + " not found: " + entityId);
        this.entityId = entityId;
    }

    public EntityNotFoundException(String kind, String identifier) {
        super(kind + " not found: " + identifier);
        this.entityId = null;
    }
}
