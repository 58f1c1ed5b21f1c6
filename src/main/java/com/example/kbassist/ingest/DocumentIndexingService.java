package com.example.kbassist.ingest;

import com.example.kbassist.config.KbAssistProperties;
import com.example.kbassist.index.VectorIndex;
import com.example.kbassist.llm.BoundedModelClient;
import com.example.kbassist.model.Fragment;
import com.example.kbassist.model.FragmentCandidate;
import com.example.kbassist.model.FragmentMetadata;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Turns extracted document text into indexed fragments, and removes them again.
 * Knowledge base and document ids are opaque keys owned by the document store.
 */
@Slf4j
@Service
public class DocumentIndexingService {

    private final TextChunker chunker;
    private final BoundedModelClient modelClient;
    private final VectorIndex vectorIndex;
    private final KbAssistProperties.Chunking chunking;

    public DocumentIndexingService(TextChunker chunker,
                                   BoundedModelClient modelClient,
                                   VectorIndex vectorIndex,
                                   KbAssistProperties properties) {
        this.chunker = chunker;
        this.modelClient = modelClient;
        this.vectorIndex = vectorIndex;
        this.chunking = properties.getChunking();
    }

    /**
     * Chunks and embeds {@code text}, then stores all fragments in one batch. Nothing is stored
     * if any embedding call fails.
     *
     * @return number of fragments stored
     */
    public Mono<Integer> index(String knowledgeBaseId, String documentId, String sourceDocument, Integer page, String text) {
        return Mono.defer(() -> {
            requireId("knowledgeBaseId", knowledgeBaseId);
            requireId("documentId", documentId);
            List<FragmentCandidate> candidates =
                    chunker.chunk(text, chunking.getMaxWords(), chunking.getOverlapWords(), sourceDocument, page);
            if (candidates.isEmpty()) {
                log.info("Document {} in kb {} has no text, nothing indexed", documentId, knowledgeBaseId);
                return Mono.just(0);
            }
            return Flux.fromIterable(candidates)
                    .concatMap(candidate -> modelClient.embed(candidate.text())
                            .map(vector -> toFragment(knowledgeBaseId, documentId, candidate, vector)))
                    .collectList()
                    .map(fragments -> {
                        int stored = vectorIndex.store(fragments);
                        log.info("Indexed {} fragments of document {} into kb {}", stored, documentId, knowledgeBaseId);
                        return stored;
                    });
        });
    }

    public int removeDocument(String documentId) {
        requireId("documentId", documentId);
        int removed = vectorIndex.deleteByDocument(documentId);
        log.info("Removed {} fragments of document {}", removed, documentId);
        return removed;
    }

    public int removeKnowledgeBase(String knowledgeBaseId) {
        requireId("knowledgeBaseId", knowledgeBaseId);
        int removed = vectorIndex.deleteByScope(knowledgeBaseId);
        log.info("Removed {} fragments of kb {}", removed, knowledgeBaseId);
        return removed;
    }

    private static Fragment toFragment(String knowledgeBaseId, String documentId, FragmentCandidate candidate, float[] vector) {
        return Fragment.builder()
                .id(UUID.randomUUID().toString())
                .documentId(documentId)
                .knowledgeBaseId(knowledgeBaseId)
                .text(candidate.text())
                .metadata(candidate.metadata())
                .meta(FragmentMetadata.KNOWLEDGE_BASE_ID, knowledgeBaseId)
                .embedding(vector)
                .build();
    }

    private static void requireId(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
