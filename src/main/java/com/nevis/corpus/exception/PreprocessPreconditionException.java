package com.nevis.corpus.exception;

import com.nevis.corpus.preprocess.PreprocessStep;
import lombok.Getter;

@Getter
public class PreprocessPreconditionException extends PreprocessException {
    private final PreprocessStep missingStep;

    public PreprocessPreconditionException(PreprocessStep step, PreprocessStep missingStep) {
        super(step.stepName(), "Step " + step.stepName() + " requires " + missingStep.stepName() + " to be done first");
        this.missingStep = missingStep;
    }

    protected PreprocessPreconditionException(String operation, PreprocessStep missingStep) {
        super(missingStep.stepName(), operation + " requires " + missingStep.stepName() + " to be done first");
        this.missingStep = missingStep;
    }
}
