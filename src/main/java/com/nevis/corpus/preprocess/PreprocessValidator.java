package com.nevis.corpus.preprocess;

import com.nevis.corpus.exception.PreprocessPreconditionException;
import com.nevis.corpus.exception.PreprocessValidationException;
import com.nevis.corpus.model.PreprocessMetadata;
import com.nevis.corpus.model.StepOutcome;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Structural rules for every {@link PreprocessStep}. Holds no state; prior results are always passed in.
 */
public final class PreprocessValidator {

    private PreprocessValidator() {
    }

    /**
     * Checks {@code result} against the rules of {@code step} and the stored results of its prerequisites.
     *
     * @return an immutable, element-typed copy of {@code result}
     * @throws PreprocessPreconditionException when a prerequisite step is not done
     * @throws PreprocessValidationException   when the result has the wrong shape
     */
    public static List<?> validate(PreprocessStep step, List<?> result, PreprocessMetadata prior) {
        requireRecordable(step, result, prior);
        return switch (step) {
            case TOKENIZATION -> strings(step, result);
            case SEGMENTATION -> boundaries(step, result, tokenCount(prior));
            case TAGGING, NERC -> perTokenLabels(step, result, tokenCount(prior));
        };
    }

    /**
     * Validates and returns {@code prior} with the outcome of {@code step} written in. Outcomes of steps that
     * depend on {@code step} are dropped, since they were checked against the result being replaced.
     * {@code prior} itself is never modified.
     */
    public static PreprocessMetadata record(PreprocessStep step, List<?> result, PreprocessMetadata prior,
                                            OffsetDateTime doneAt) {
        requireRecordable(step, result, prior);
        PreprocessMetadata recorded = switch (step) {
            case TOKENIZATION -> prior.withTokenization(new StepOutcome<>(strings(step, result), doneAt));
            case SEGMENTATION -> prior.withSegmentation(
                new StepOutcome<>(boundaries(step, result, tokenCount(prior)), doneAt));
            case TAGGING -> prior.withTagging(new StepOutcome<>(perTokenLabels(step, result, tokenCount(prior)), doneAt));
            case NERC -> prior.withNerc(new StepOutcome<>(perTokenLabels(step, result, tokenCount(prior)), doneAt));
        };
        for (PreprocessStep dependent : step.dependents()) {
            recorded = recorded.without(dependent);
        }
        return recorded;
    }

    private static void requireRecordable(PreprocessStep step, List<?> result, PreprocessMetadata prior) {
        for (PreprocessStep required : step.prerequisites()) {
            if (!prior.isDone(required)) {
                throw new PreprocessPreconditionException(step, required);
            }
        }
        if (result == null) {
            throw new PreprocessValidationException(step, "result is missing");
        }
    }

    private static int tokenCount(PreprocessMetadata prior) {
        return prior.tokenization().result().size();
    }

    private static List<String> strings(PreprocessStep step, List<?> result) {
        List<String> copy = new ArrayList<>(result.size());
        for (int i = 0; i < result.size(); i++) {
            Object value = result.get(i);
            if (!(value instanceof String)) {
                throw new PreprocessValidationException(step, "element " + i + " is not a string: " + value);
            }
            copy.add((String) value);
        }
        return List.copyOf(copy);
    }

    private static List<Integer> boundaries(PreprocessStep step, List<?> result, int tokenCount) {
        List<Integer> copy = new ArrayList<>(result.size());
        int previous = -1;
        for (int i = 0; i < result.size(); i++) {
            Object value = result.get(i);
            if (!(value instanceof Integer)) {
                throw new PreprocessValidationException(step, "element " + i + " is not an integer: " + value);
            }
            int boundary = (Integer) value;
            if (boundary < 0 || boundary > tokenCount) {
                throw new PreprocessValidationException(step,
                    "boundary " + boundary + " is outside [0, " + tokenCount + "]");
            }
            if (boundary <= previous) {
                throw new PreprocessValidationException(step,
                    "boundaries must be strictly ascending, got " + boundary + " after " + previous);
            }
            previous = boundary;
            copy.add(boundary);
        }
        return List.copyOf(copy);
    }

    private static List<String> perTokenLabels(PreprocessStep step, List<?> result, int tokenCount) {
        if (result.size() != tokenCount) {
            throw new PreprocessValidationException(step,
                "expected " + tokenCount + " labels, one per token, got " + result.size());
        }
        return strings(step, result);
    }
}
