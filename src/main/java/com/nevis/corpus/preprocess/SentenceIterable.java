package com.nevis.corpus.preprocess;

import com.nevis.corpus.exception.SentencesUnavailableException;
import com.nevis.corpus.model.PreprocessMetadata;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Sentences of a tokenized and segmented document. Every {@link #iterator()} reads the current stored state again,
 * so the sequence can be walked any number of times.
 * <p>
 * The concatenation of the produced sentences is always the full token list: a missing leading {@code 0} or
 * trailing token count boundary is implied.
 */
public class SentenceIterable implements Iterable<List<String>> {

    private final Supplier<PreprocessMetadata> metadata;

    public SentenceIterable(Supplier<PreprocessMetadata> metadata) {
        this.metadata = metadata;
        requireSegmented(metadata.get());
    }

    @Override
    public Iterator<List<String>> iterator() {
        PreprocessMetadata current = metadata.get();
        requireSegmented(current);
        List<String> tokens = current.tokenization().result();
        return new SentenceIterator(tokens, spans(current.segmentation().result(), tokens.size()));
    }

    private static void requireSegmented(PreprocessMetadata metadata) {
        for (PreprocessStep step : List.of(PreprocessStep.TOKENIZATION, PreprocessStep.SEGMENTATION)) {
            if (!metadata.isDone(step)) {
                throw new SentencesUnavailableException(step);
            }
        }
    }

    private static List<Integer> spans(List<Integer> boundaries, int tokenCount) {
        List<Integer> edges = new ArrayList<>(boundaries.size() + 2);
        if (boundaries.isEmpty() || boundaries.get(0) != 0) {
            edges.add(0);
        }
        edges.addAll(boundaries);
        if (edges.get(edges.size() - 1) != tokenCount) {
            edges.add(tokenCount);
        }
        return edges;
    }

    private static final class SentenceIterator implements Iterator<List<String>> {
        private final List<String> tokens;
        private final List<Integer> edges;
        private int next;

        private SentenceIterator(List<String> tokens, List<Integer> edges) {
            this.tokens = tokens;
            this.edges = edges;
        }

        @Override
        public boolean hasNext() {
            return next < edges.size() - 1;
        }

        @Override
        public List<String> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int start = edges.get(next);
            int end = edges.get(next + 1);
            next++;
            return tokens.subList(start, end);
        }
    }
}
