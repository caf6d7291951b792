package com.nevis.corpus.exception;

import lombok.Getter;

/**
 * Base type for every rejected preprocess write. The document is left untouched when one is thrown.
 */
@Getter
public abstract class PreprocessException extends RuntimeException {
    private final String stepName;

    protected PreprocessException(String stepName, String message) {
        super(message);
        this.stepName = stepName;
    }
}
