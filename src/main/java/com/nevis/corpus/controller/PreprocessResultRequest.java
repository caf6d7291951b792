package com.nevis.corpus.controller;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record PreprocessResultRequest(
    @NotNull
    List<Object> result
) {}
