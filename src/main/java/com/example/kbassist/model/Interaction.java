package com.example.kbassist.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Append-only record of one question and its outcome. */
@Value
@Builder(toBuilder = true)
public class Interaction {
    String id;
    String knowledgeBaseId;
    String question;
    String answer;
    InteractionStatus status;
    @Singular
    List<Citation> citations;
    Instant createdAt;
}
