package com.example.kbassist.response;

import com.example.kbassist.model.Interaction;
import java.time.Instant;
import java.util.List;

public record InteractionResponse(
        String id,
        String knowledgeBaseId,
        String question,
        String answer,
        String status,
        List<CitationResponse> citations,
        Instant createdAt
) {

    public static InteractionResponse from(Interaction interaction) {
        return new InteractionResponse(
                interaction.getId(),
                interaction.getKnowledgeBaseId(),
                interaction.getQuestion(),
                interaction.getAnswer(),
                interaction.getStatus().apiValue(),
                interaction.getCitations().stream().map(CitationResponse::from).toList(),
                interaction.getCreatedAt());
    }
}
