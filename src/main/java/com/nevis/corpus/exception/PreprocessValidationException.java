package com.nevis.corpus.exception;

import com.nevis.corpus.preprocess.PreprocessStep;

public class PreprocessValidationException extends PreprocessException {

    public PreprocessValidationException(PreprocessStep step, String reason) {
        super(step.stepName(), "Invalid " + step.stepName() + " result: " + reason);
    }
}
