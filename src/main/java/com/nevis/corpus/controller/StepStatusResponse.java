package com.nevis.corpus.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

public record StepStatusResponse(
    boolean done,

    List<?> result,

    @JsonProperty("done_at")
    OffsetDateTime doneAt
) {}
