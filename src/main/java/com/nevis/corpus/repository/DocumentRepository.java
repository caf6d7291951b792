package com.nevis.corpus.repository;

import com.nevis.corpus.model.Document;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DocumentRepository {
    Document save(Document document);
    Optional<Document> findById(UUID id);
    Optional<Document> findByHumanIdentifier(String humanIdentifier);
    List<Document> findAll(DocumentFilter filter);
    long count();
}
