package com.nevis.corpus.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.corpus.model.EntityInChunk;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record EntityInChunkRequest(
    @NotBlank
    String key,

    @JsonProperty("canonical_form")
    String canonicalForm,

    String kind,

    @Min(0)
    int offset
) {
    public EntityInChunk toEntity() {
        return new EntityInChunk(key, canonicalForm, kind, offset);
    }
}
