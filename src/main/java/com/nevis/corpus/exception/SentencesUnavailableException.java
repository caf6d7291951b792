package com.nevis.corpus.exception;

import com.nevis.corpus.preprocess.PreprocessStep;

/**
 * Sentences were requested from a document that is not yet tokenized and segmented.
 */
public class SentencesUnavailableException extends PreprocessPreconditionException {

    public SentencesUnavailableException(PreprocessStep missingStep) {
        super("Sentences", missingStep);
    }
}
