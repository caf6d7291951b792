package com.nevis.corpus.exception;

public class InvalidPreprocessStepException extends PreprocessException {

    public InvalidPreprocessStepException(String stepName) {
        super(stepName, "Invalid preprocess step: " + stepName);
    }
}
