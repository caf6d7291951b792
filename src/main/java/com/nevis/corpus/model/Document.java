package com.nevis.corpus.model;

import com.nevis.corpus.exception.InvalidPreprocessStepException;
import com.nevis.corpus.preprocess.PreprocessStep;
import com.nevis.corpus.preprocess.PreprocessValidator;
import com.nevis.corpus.preprocess.SentenceIterable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A corpus document and the results of the preprocess steps run over its text.
 * <p>
 * Preprocess state changes only through {@link #setPreprocessResult}, which validates before writing and never
 * persists: callers save the document through the repository themselves. Not safe for concurrent writers.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Document {

    @ToString.Include
    @EqualsAndHashCode.Include
    private final UUID id;

    @ToString.Include
    private final String humanIdentifier;
    private final String title;
    private final String url;
    private final String text;
    private final OffsetDateTime createdAt;
    private PreprocessMetadata preprocessMetadata;

    public Document(UUID id, String humanIdentifier, String title, String url, String text,
                    OffsetDateTime createdAt, PreprocessMetadata preprocessMetadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.humanIdentifier = humanIdentifier;
        this.title = title;
        this.url = url;
        this.text = text == null ? "" : text;
        this.createdAt = createdAt;
        this.preprocessMetadata = preprocessMetadata == null ? PreprocessMetadata.empty() : preprocessMetadata;
    }

    public static Document create(String humanIdentifier, String text) {
        return create(humanIdentifier, text, null, null, Clock.systemUTC());
    }

    public static Document create(String humanIdentifier, String text, String title, String url, Clock clock) {
        return new Document(UUID.randomUUID(), humanIdentifier, title, url, text, now(clock), PreprocessMetadata.empty());
    }

    public Document setPreprocessResult(PreprocessStep step, List<?> result) {
        return setPreprocessResult(step, result, Clock.systemUTC());
    }

    public Document setPreprocessResult(String stepName, List<?> result) {
        return setPreprocessResult(PreprocessStep.fromName(stepName), result, Clock.systemUTC());
    }

    /**
     * Validates {@code result} for {@code step} and records it with the current time of {@code clock}.
     * Nothing is written when validation fails. Results of steps depending on {@code step} are cleared, so
     * recording new tokens leaves segmentation, tagging and nerc to be run again.
     *
     * @return this document
     */
    public Document setPreprocessResult(PreprocessStep step, List<?> result, Clock clock) {
        if (step == null) {
            throw new InvalidPreprocessStepException(null);
        }
        OffsetDateTime doneAt = now(clock);
        Optional<OffsetDateTime> latest = preprocessMetadata.latestDoneAt();
        if (latest.isPresent() && latest.get().isAfter(doneAt)) {
            doneAt = latest.get();
        }
        preprocessMetadata = PreprocessValidator.record(step, result, preprocessMetadata, doneAt);
        return this;
    }

    public boolean wasPreprocessDone(PreprocessStep step) {
        return preprocessMetadata.isDone(step);
    }

    public Optional<List<?>> getPreprocessResult(PreprocessStep step) {
        return preprocessMetadata.get(step).map(StepOutcome::result);
    }

    public Optional<OffsetDateTime> getPreprocessDoneAt(PreprocessStep step) {
        return preprocessMetadata.get(step).map(StepOutcome::doneAt);
    }

    public Optional<List<String>> getTokens() {
        return Optional.ofNullable(preprocessMetadata.tokenization()).map(StepOutcome::result);
    }

    public Optional<List<Integer>> getSentenceBoundaries() {
        return Optional.ofNullable(preprocessMetadata.segmentation()).map(StepOutcome::result);
    }

    /**
     * Token lists of each sentence, recomputed from the stored tokens and boundaries on every iteration.
     *
     * @throws com.nevis.corpus.exception.SentencesUnavailableException unless tokenization and segmentation are done
     */
    public Iterable<List<String>> getSentences() {
        return new SentenceIterable(this::getPreprocessMetadata);
    }

    private static OffsetDateTime now(Clock clock) {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
