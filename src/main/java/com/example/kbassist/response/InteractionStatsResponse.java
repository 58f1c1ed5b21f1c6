package com.example.kbassist.response;

import com.example.kbassist.model.InteractionStatus;
import java.util.Map;

public record InteractionStatsResponse(
        String knowledgeBaseId,
        long total,
        long answered,
        long unknown,
        long error
) {

    public static InteractionStatsResponse from(String knowledgeBaseId, Map<InteractionStatus, Long> counts) {
        long answered = counts.getOrDefault(InteractionStatus.ANSWERED, 0L);
        long unknown = counts.getOrDefault(InteractionStatus.UNKNOWN, 0L);
        long error = counts.getOrDefault(InteractionStatus.ERROR, 0L);
        return new InteractionStatsResponse(knowledgeBaseId, answered + unknown + error, answered, unknown, error);
    }
}
