package com.nevis.corpus.preprocess;

import com.nevis.corpus.exception.InvalidPreprocessStepException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * The preprocess pipeline, in execution order. Every step after the first is validated against the
 * results of the steps it depends on.
 */
public enum PreprocessStep {
    TOKENIZATION("tokenization"),
    SEGMENTATION("segmentation"),
    TAGGING("tagging"),
    NERC("nerc");

    private final String stepName;

    PreprocessStep(String stepName) {
        this.stepName = stepName;
    }

    public String stepName() {
        return stepName;
    }

    /**
     * Steps whose stored results must exist before this one can be recorded. Only earlier steps may appear here.
     */
    public Set<PreprocessStep> prerequisites() {
        return switch (this) {
            case TOKENIZATION -> EnumSet.noneOf(PreprocessStep.class);
            case SEGMENTATION, TAGGING, NERC -> EnumSet.of(TOKENIZATION);
        };
    }

    /**
     * Steps that list this one as a prerequisite. Their stored results go stale when this step is recorded again.
     */
    public Set<PreprocessStep> dependents() {
        Set<PreprocessStep> dependents = EnumSet.noneOf(PreprocessStep.class);
        for (PreprocessStep step : values()) {
            if (step.prerequisites().contains(this)) {
                dependents.add(step);
            }
        }
        return dependents;
    }

    public static PreprocessStep fromName(String name) {
        return Arrays.stream(values())
            .filter(step -> step.stepName.equals(name))
            .findFirst()
            .orElseThrow(() -> new InvalidPreprocessStepException(name));
    }

    @Override
    public String toString() {
        return stepName;
    }
}
