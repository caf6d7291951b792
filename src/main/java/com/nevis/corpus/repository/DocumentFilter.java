package com.nevis.corpus.repository;

import com.nevis.corpus.model.Document;
import com.nevis.corpus.preprocess.PreprocessStep;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Selection over the document collection. Stores translate the filters they know into native queries and fall back
 * to {@link #test(Document)} for the others.
 */
public interface DocumentFilter extends Predicate<Document> {

    static DocumentFilter all() {
        return new All();
    }

    static DocumentFilter rawText() {
        return new RawText();
    }

    static DocumentFilter lackingPreprocess(PreprocessStep step) {
        return new LackingPreprocess(step);
    }

    record All() implements DocumentFilter {
        @Override
        public boolean test(Document document) {
            return true;
        }
    }

    /**
     * Documents whose text is empty, whatever their preprocess state.
     */
    record RawText() implements DocumentFilter {
        @Override
        public boolean test(Document document) {
            return document.getText().isEmpty();
        }
    }

    record LackingPreprocess(PreprocessStep step) implements DocumentFilter {
        public LackingPreprocess {
            Objects.requireNonNull(step, "step");
        }

        @Override
        public boolean test(Document document) {
            return !document.wasPreprocessDone(step);
        }
    }
}
