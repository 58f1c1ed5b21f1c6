package com.example.kbassist.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one query execution. Owned by a single pipeline run and never shared.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class QueryContext {
  public static final String UNKNOWN_ANSWER = "I don't have that information in the provided knowledge base.";

  // input
  private String interactionId;
  private String knowledgeBaseId;
  private String question;

  // retrieval
  private float[] queryEmbedding;
  private List<Fragment> fragments = new ArrayList<>();

  // generation + grounding
  private String prompt;
  private String generatedAnswer;
  private GroundingDecision grounding;

  // outcome
  private InteractionStatus status;
  private String answer;
  private List<Citation> citations = new ArrayList<>();
  private String error;

  // audit trail
  private QueryStage stage = QueryStage.EMBEDDING;
  private Instant startedAt = Instant.now();
  private List<StepLog> steps = new ArrayList<>();

  public static QueryContext start(String interactionId, String knowledgeBaseId, String question) {
    return new QueryContext()
        .setInteractionId(interactionId)
        .setKnowledgeBaseId(knowledgeBaseId)
        .setQuestion(question);
  }

  public QueryContext addStep(QueryStage next, String note) {
    Instant now = Instant.now();
    this.stage = next;
    steps.add(new StepLog(next, note, now, Duration.between(startedAt, now).toMillis()));
    return this;
  }

  /** Refusal: the generated text, if any, is dropped and nothing is cited. */
  public QueryContext refuse(String note) {
    this.status = InteractionStatus.UNKNOWN;
    this.answer = UNKNOWN_ANSWER;
    this.citations = new ArrayList<>();
    return addStep(QueryStage.UNKNOWN_EXIT, note);
  }

  public QueryContext answer(List<Citation> supporting) {
    this.status = InteractionStatus.ANSWERED;
    this.answer = generatedAnswer;
    this.citations = new ArrayList<>(supporting);
    return addStep(QueryStage.CITING, "citations=" + supporting.size());
  }

  public QueryContext fail(String message) {
    this.status = InteractionStatus.ERROR;
    this.answer = null;
    this.citations = new ArrayList<>();
    this.error = message;
    return addStep(QueryStage.FAILED, message);
  }

  public Interaction toInteraction(Instant createdAt) {
    return Interaction.builder()
        .id(interactionId)
        .knowledgeBaseId(knowledgeBaseId)
        .question(question)
        .answer(answer)
        .status(status)
        .citations(citations)
        .createdAt(createdAt)
        .build();
  }

  public QueryResult toResult() {
    return QueryResult.builder()
        .status(status)
        .answer(answer)
        .citations(citations)
        .interactionId(interactionId)
        .error(error)
        .build();
  }
}
