package com.nevis.corpus.service;

import com.nevis.corpus.exception.EntityNotFoundException;
import com.nevis.corpus.exception.PreprocessException;
import com.nevis.corpus.model.Document;
import com.nevis.corpus.preprocess.PreprocessStep;
import com.nevis.corpus.repository.DocumentFilter;
import com.nevis.corpus.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private final DocumentRepository documentRepository;
    private final Clock clock;

    @Override
    @Transactional
    public Document createDocument(String humanIdentifier, String text, String title, String url) {
        Document saved = documentRepository.save(Document.create(humanIdentifier, text, title, url, clock));
        log.info("Created document {} ({})", saved.getId(), humanIdentifier);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Document getById(UUID id) {
        log.debug("Fetching document by ID: {}", id);

        return documentRepository.findById(id)
            .orElseThrow(() -> {
                log.warn("Document not found with ID: {}", id);
                return new EntityNotFoundException("Document", id);
            });
    }

    @Override
    @Transactional(readOnly = true)
    public Document getByHumanIdentifier(String humanIdentifier) {
        return documentRepository.findByHumanIdentifier(humanIdentifier)
            .orElseThrow(() -> new EntityNotFoundException("Document", humanIdentifier));
    }

    @Override
    public long count() {
        return documentRepository.count();
    }

    @Override
    @Transactional
    public Document setPreprocessResult(UUID id, String stepName, List<?> result) {
        PreprocessStep step = PreprocessStep.fromName(stepName);
        Document document = getById(id);
        List<PreprocessStep> stale = step.dependents().stream().filter(document::wasPreprocessDone).toList();
        try {
            document.setPreprocessResult(step, result, clock);
        } catch (PreprocessException e) {
            log.warn("Doc {}: rejected {} result: {}", id, step, e.getMessage());
            throw e;
        }
        if (!stale.isEmpty()) {
            log.info("Doc {}: new {} result cleared {}", id, step, stale);
        }
        Document saved = documentRepository.save(document);
        log.info("Doc {}: recorded {} result with {} elements", id, step, result.size());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Document> getRawDocuments() {
        return documentRepository.findAll(DocumentFilter.rawText());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Document> getDocumentsLackingPreprocess(PreprocessStep step) {
        List<Document> documents = documentRepository.findAll(DocumentFilter.lackingPreprocess(step));
        log.debug("{} documents lack {}", documents.size(), step);
        return documents;
    }

    @Override
    @Transactional(readOnly = true)
    public List<List<String>> getSentences(UUID id) {
        List<List<String>> sentences = new ArrayList<>();
        getById(id).getSentences().forEach(sentences::add);
        return sentences;
    }
}
