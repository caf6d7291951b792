package com.nevis.corpus.controller;

import com.nevis.corpus.preprocess.PreprocessStep;
import com.nevis.corpus.service.DocumentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;

    @PostMapping
    public ResponseEntity<DocumentResponse> createDocument(@Valid @RequestBody DocumentRequest request) {
        var document = documentService.createDocument(
            request.humanIdentifier(),
            request.text(),
            request.title(),
            request.url()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(document));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID id) {
        return ResponseEntity.ok(DocumentResponse.from(documentService.getById(id)));
    }

    @GetMapping(params = "human_identifier")
    public ResponseEntity<DocumentResponse> getDocumentByIdentifier(
        @RequestParam(name = "human_identifier") String humanIdentifier) {
        return ResponseEntity.ok(DocumentResponse.from(documentService.getByHumanIdentifier(humanIdentifier)));
    }

    @GetMapping("/raw")
    public ResponseEntity<List<DocumentResponse>> getRawDocuments() {
        return ResponseEntity.ok(documentService.getRawDocuments().stream()
            .map(DocumentResponse::from)
            .toList());
    }

    @GetMapping("/lacking/{step}")
    public ResponseEntity<List<DocumentResponse>> getDocumentsLackingPreprocess(@PathVariable String step) {
        return ResponseEntity.ok(documentService.getDocumentsLackingPreprocess(PreprocessStep.fromName(step)).stream()
            .map(DocumentResponse::from)
            .toList());
    }

    @PutMapping("/{id}/preprocess/{step}")
    public ResponseEntity<DocumentResponse> setPreprocessResult(
        @PathVariable UUID id,
        @PathVariable String step,
        @Valid @RequestBody PreprocessResultRequest request) {

        var document = documentService.setPreprocessResult(id, step, request.result());
        return ResponseEntity.ok(DocumentResponse.from(document));
    }

    @GetMapping("/{id}/sentences")
    public ResponseEntity<List<List<String>>> getSentences(@PathVariable UUID id) {
        return ResponseEntity.ok(documentService.getSentences(id));
    }
}
