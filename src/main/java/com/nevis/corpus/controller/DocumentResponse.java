package com.nevis.corpus.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.corpus.model.Document;
import com.nevis.corpus.preprocess.PreprocessStep;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record DocumentResponse(
    UUID id,

    @JsonProperty("human_identifier")
    String humanIdentifier,

    String title,

    String url,

    String text,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    Map<String, StepStatusResponse> preprocess
) {
    public static DocumentResponse from(Document document) {
        Map<String, StepStatusResponse> steps = new LinkedHashMap<>();
        for (PreprocessStep step : PreprocessStep.values()) {
            steps.put(step.stepName(), new StepStatusResponse(
                document.wasPreprocessDone(step),
                document.getPreprocessResult(step).orElse(null),
                document.getPreprocessDoneAt(step).orElse(null)
            ));
        }
        return new DocumentResponse(
            document.getId(),
            document.getHumanIdentifier(),
            document.getTitle(),
            document.getUrl(),
            document.getText(),
            document.getCreatedAt(),
            steps
        );
    }
}
