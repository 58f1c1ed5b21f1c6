package com.example.kbassist.controller;

import com.example.kbassist.ingest.DocumentIndexingService;
import com.example.kbassist.request.IndexTextRequest;
import com.example.kbassist.response.IndexingResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/knowledge-bases/{kbId}")
@RequiredArgsConstructor
@Tag(name = "Indexing", description = "Add extracted document text to the vector index and remove it again")
public class IndexingController {

    private final DocumentIndexingService indexingService;

    @Operation(summary = "Chunk, embed and index extracted text of a document")
    @PostMapping("/documents/{documentId}/text")
    public Mono<ResponseEntity<IndexingResponse>> indexText(
            @PathVariable String kbId,
            @PathVariable String documentId,
            @Valid @RequestBody IndexTextRequest request) {
        return indexingService.index(kbId, documentId, request.sourceDocument(), request.page(), request.text())
                .map(count -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(new IndexingResponse(documentId, kbId, count)));
    }

    @Operation(summary = "Remove every fragment of a document")
    @DeleteMapping("/documents/{documentId}")
    public Mono<ResponseEntity<Void>> deleteDocument(@PathVariable String kbId, @PathVariable String documentId) {
        return Mono.fromRunnable(() -> indexingService.removeDocument(documentId))
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    @Operation(summary = "Remove every fragment of a knowledge base")
    @DeleteMapping("/fragments")
    public Mono<ResponseEntity<Void>> deleteKnowledgeBase(@PathVariable String kbId) {
        return Mono.fromRunnable(() -> indexingService.removeKnowledgeBase(kbId))
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }
}
