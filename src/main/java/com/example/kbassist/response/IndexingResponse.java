package com.example.kbassist.response;

public record IndexingResponse(
        String documentId,
        String knowledgeBaseId,
        int fragmentCount
) {
}
