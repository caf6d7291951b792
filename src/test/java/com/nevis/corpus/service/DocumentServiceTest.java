package com.nevis.corpus.service;

import com.nevis.corpus.exception.EntityNotFoundException;
import com.nevis.corpus.exception.InvalidPreprocessStepException;
import com.nevis.corpus.exception.PreprocessPreconditionException;
import com.nevis.corpus.model.Document;
import com.nevis.corpus.preprocess.PreprocessStep;
import com.nevis.corpus.repository.DocumentFilter;
import com.nevis.corpus.repository.DocumentRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DocumentServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

    private final DocumentRepository repository = Mockito.mock(DocumentRepository.class);
    private final DocumentService documentService = new DocumentServiceImpl(repository, Clock.fixed(NOW, ZoneOffset.UTC));

    private Document stored(String text) {
        Document doc = Document.create("doc", text);
        when(repository.findById(doc.getId())).thenReturn(Optional.of(doc));
        when(repository.save(any(Document.class))).thenAnswer(invocation -> invocation.getArgument(0));
        return doc;
    }

    @Nested
    @DisplayName("Creating documents")
    class CreateTest {

        @Test
        @DisplayName("Should save a document without preprocess state")
        void shouldSaveFreshDocument() {
            when(repository.save(any(Document.class))).thenAnswer(invocation -> invocation.getArgument(0));

            Document created = documentService.createDocument("doc-1", "Some text", "Title", "http://example.com");

            ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
            verify(repository).save(captor.capture());
            Document saved = captor.getValue();
            assertThat(saved).isSameAs(created);
            assertThat(saved.getHumanIdentifier()).isEqualTo("doc-1");
            assertThat(saved.getText()).isEqualTo("Some text");
            assertThat(saved.getCreatedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
            for (PreprocessStep step : PreprocessStep.values()) {
                assertThat(saved.wasPreprocessDone(step)).isFalse();
            }
        }
    }

    @Nested
    @DisplayName("Recording preprocess results")
    class PreprocessTest {

        @Test
        @DisplayName("Should validate, stamp with the clock and save")
        void shouldRecordAndSave() {
            Document doc = stored("Some sentence");

            Document result = documentService.setPreprocessResult(doc.getId(), "tokenization", List.of("Some", "sentence"));

            verify(repository).save(doc);
            assertThat(result.getTokens()).contains(List.of("Some", "sentence"));
            assertThat(result.getPreprocessDoneAt(PreprocessStep.TOKENIZATION))
                .contains(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        }

        @Test
        @DisplayName("Should save exactly once, after the result is recorded")
        void shouldSaveOnceAfterRecording() {
            Document doc = Document.create("doc", "Some sentence");
            when(repository.findById(doc.getId())).thenReturn(Optional.of(doc));
            List<Boolean> tokenizedAtSave = new ArrayList<>();
            when(repository.save(doc)).thenAnswer(invocation -> {
                tokenizedAtSave.add(invocation.<Document>getArgument(0).wasPreprocessDone(PreprocessStep.TOKENIZATION));
                return invocation.getArgument(0);
            });

            documentService.setPreprocessResult(doc.getId(), "tokenization", List.of("Some", "sentence"));

            InOrder inOrder = inOrder(repository);
            inOrder.verify(repository).findById(doc.getId());
            inOrder.verify(repository, times(1)).save(doc);
            verifyNoMoreInteractions(repository);
            assertThat(tokenizedAtSave).containsExactly(true);
        }

        @Test
        @DisplayName("Should not save when validation fails")
        void shouldNotSaveRejectedResult() {
            Document doc = stored("Some sentence");

            assertThatThrownBy(() -> documentService.setPreprocessResult(doc.getId(), "segmentation", List.of(0)))
                .isInstanceOf(PreprocessPreconditionException.class);

            verify(repository, never()).save(any());
        }

        @Test
        @DisplayName("Should reject unknown steps before loading anything")
        void shouldRejectUnknownStep() {
            UUID id = UUID.randomUUID();

            assertThatThrownBy(() -> documentService.setPreprocessResult(id, "spell it", List.of()))
                .isInstanceOf(InvalidPreprocessStepException.class);

            verifyNoInteractions(repository);
        }

        @Test
        @DisplayName("Should fail for unknown documents")
        void shouldFailForMissingDocument() {
            UUID id = UUID.randomUUID();
            when(repository.findById(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> documentService.setPreprocessResult(id, "tokenization", List.of()))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessageContaining(id.toString());
        }
    }

    @Nested
    @DisplayName("Filtering documents")
    class FilterTest {

        @Test
        @DisplayName("Raw documents are requested with the raw text filter")
        void shouldQueryRawDocuments() {
            Document raw = Document.create("raw", "");
            when(repository.findAll(DocumentFilter.rawText())).thenReturn(List.of(raw));

            assertThat(documentService.getRawDocuments()).containsExactly(raw);
        }

        @Test
        @DisplayName("Documents lacking a step are requested with that step")
        void shouldQueryDocumentsLackingStep() {
            Document doc = Document.create("untagged", "text");
            when(repository.findAll(DocumentFilter.lackingPreprocess(PreprocessStep.TAGGING))).thenReturn(List.of(doc));

            assertThat(documentService.getDocumentsLackingPreprocess(PreprocessStep.TAGGING)).containsExactly(doc);
            verify(repository, never()).findAll(DocumentFilter.lackingPreprocess(PreprocessStep.TOKENIZATION));
        }
    }

    @Test
    @DisplayName("Sentences are materialized from the stored document")
    void shouldReturnSentences() {
        Document doc = stored("Some sentence . Indeed !");
        doc.setPreprocessResult(PreprocessStep.TOKENIZATION, List.of("Some", "sentence", ".", "Indeed", "!"));
        doc.setPreprocessResult(PreprocessStep.SEGMENTATION, List.of(0, 3, 5));

        assertThat(documentService.getSentences(doc.getId()))
            .containsExactly(List.of("Some", "sentence", "."), List.of("Indeed", "!"));
    }

    @Test
    @DisplayName("Lookup by human identifier fails loudly when absent")
    void shouldFailForUnknownIdentifier() {
        when(repository.findByHumanIdentifier("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> documentService.getByHumanIdentifier("nope"))
            .isInstanceOf(EntityNotFoundException.class);
    }
}
