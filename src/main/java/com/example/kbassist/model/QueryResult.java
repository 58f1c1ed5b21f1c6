package com.example.kbassist.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * What a caller gets back from one query. "answered" and "unknown" results have the same
 * shape; only the persisted {@link Interaction} tells an empty retrieval apart from a
 * rejected answer.
 */
@Value
@Builder
public class QueryResult {
    InteractionStatus status;
    String answer;
    @Singular
    List<Citation> citations;
    String interactionId;
    /** Only set for {@link InteractionStatus#ERROR}. */
    String error;
}
