package com.nevis.corpus.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record DocumentRequest(
    @NotBlank
    @JsonProperty("human_identifier")
    String humanIdentifier,

    @NotNull
    String text,

    String title,

    String url
) {}
