package com.nevis.corpus.service;

import com.nevis.corpus.model.Document;
import com.nevis.corpus.preprocess.PreprocessStep;

import java.util.List;
import java.util.UUID;

public interface DocumentService {
    Document createDocument(String humanIdentifier, String text, String title, String url);
    Document getById(UUID id);
    Document getByHumanIdentifier(String humanIdentifier);
    long count();
    Document setPreprocessResult(UUID id, String stepName, List<?> result);
    List<Document> getRawDocuments();
    List<Document> getDocumentsLackingPreprocess(PreprocessStep step);
    List<List<String>> getSentences(UUID id);
}
