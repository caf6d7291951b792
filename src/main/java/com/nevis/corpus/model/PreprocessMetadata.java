package com.nevis.corpus.model;

import com.nevis.corpus.preprocess.PreprocessStep;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Preprocess state of one document: one slot per step, {@code null} while the step is not done.
 */
public record PreprocessMetadata(
    StepOutcome<String> tokenization,
    StepOutcome<Integer> segmentation,
    StepOutcome<String> tagging,
    StepOutcome<String> nerc
) {

    public static PreprocessMetadata empty() {
        return new PreprocessMetadata(null, null, null, null);
    }

    public Optional<StepOutcome<?>> get(PreprocessStep step) {
        StepOutcome<?> outcome = switch (step) {
            case TOKENIZATION -> tokenization;
            case SEGMENTATION -> segmentation;
            case TAGGING -> tagging;
            case NERC -> nerc;
        };
        return Optional.ofNullable(outcome);
    }

    public boolean isDone(PreprocessStep step) {
        return get(step).isPresent();
    }

    public Optional<OffsetDateTime> latestDoneAt() {
        return Arrays.stream(PreprocessStep.values())
            .map(this::get)
            .flatMap(Optional::stream)
            .map(StepOutcome::doneAt)
            .filter(Objects::nonNull)
            .max(OffsetDateTime::compareTo);
    }

    public PreprocessMetadata withTokenization(StepOutcome<String> outcome) {
        return new PreprocessMetadata(outcome, segmentation, tagging, nerc);
    }

    public PreprocessMetadata withSegmentation(StepOutcome<Integer> outcome) {
        return new PreprocessMetadata(tokenization, outcome, tagging, nerc);
    }

    public PreprocessMetadata withTagging(StepOutcome<String> outcome) {
        return new PreprocessMetadata(tokenization, segmentation, outcome, nerc);
    }

    public PreprocessMetadata withNerc(StepOutcome<String> outcome) {
        return new PreprocessMetadata(tokenization, segmentation, tagging, outcome);
    }

    /**
     * This metadata with the outcome of {@code step} dropped.
     */
    public PreprocessMetadata without(PreprocessStep step) {
        return switch (step) {
            case TOKENIZATION -> new PreprocessMetadata(null, segmentation, tagging, nerc);
            case SEGMENTATION -> new PreprocessMetadata(tokenization, null, tagging, nerc);
            case TAGGING -> new PreprocessMetadata(tokenization, segmentation, null, nerc);
            case NERC -> new PreprocessMetadata(tokenization, segmentation, tagging, null);
        };
    }
}
