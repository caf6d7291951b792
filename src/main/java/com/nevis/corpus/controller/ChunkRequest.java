package com.nevis.corpus.controller;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ChunkRequest(
    @NotNull
    String text,

    @Min(0)
    int offset,

    List<String> tokens
) {}
