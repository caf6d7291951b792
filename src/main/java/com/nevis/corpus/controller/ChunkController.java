package com.nevis.corpus.controller;

import com.nevis.corpus.model.Entity;
import com.nevis.corpus.service.TextChunkService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class ChunkController {

    private final TextChunkService chunkService;

    @PostMapping("/documents/{documentId}/chunks")
    public ResponseEntity<ChunkResponse> createChunk(
        @PathVariable UUID documentId,
        @Valid @RequestBody ChunkRequest request) {

        var chunk = chunkService.createChunk(documentId, request.text(), request.offset(), request.tokens());
        return ResponseEntity.status(HttpStatus.CREATED).body(ChunkResponse.from(chunk));
    }

    @PostMapping("/documents/{documentId}/chunks/by-sentences")
    public ResponseEntity<List<ChunkResponse>> chunkBySentences(@PathVariable UUID documentId) {
        var chunks = chunkService.chunkDocumentBySentences(documentId);
        return ResponseEntity.status(HttpStatus.CREATED).body(chunks.stream().map(ChunkResponse::from).toList());
    }

    @GetMapping("/documents/{documentId}/chunks")
    public ResponseEntity<List<ChunkResponse>> getChunksOfDocument(@PathVariable UUID documentId) {
        return ResponseEntity.ok(chunkService.getChunksOfDocument(documentId).stream()
            .map(ChunkResponse::from)
            .toList());
    }

    @GetMapping("/chunks/{id}")
    public ResponseEntity<ChunkResponse> getChunk(@PathVariable UUID id) {
        return ResponseEntity.ok(ChunkResponse.from(chunkService.getById(id)));
    }

    @PostMapping("/chunks/{id}/entities")
    public ResponseEntity<ChunkResponse> addEntity(
        @PathVariable UUID id,
        @Valid @RequestBody EntityInChunkRequest request) {

        return ResponseEntity.ok(ChunkResponse.from(chunkService.addEntity(id, request.toEntity())));
    }

    @GetMapping("/chunks")
    public ResponseEntity<List<ChunkResponse>> findChunksMentioning(
        @RequestParam(name = "entity") List<String> entityKeys) {

        var entities = entityKeys.stream().map(Entity::new).toList();
        return ResponseEntity.ok(chunkService.chunksWithAllEntities(entities).stream()
            .map(ChunkResponse::from)
            .toList());
    }
}
