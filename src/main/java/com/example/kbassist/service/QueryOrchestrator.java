package com.example.kbassist.service;

import com.example.kbassist.config.KbAssistProperties;
import com.example.kbassist.grounding.GroundingEvaluator;
import com.example.kbassist.index.VectorIndex;
import com.example.kbassist.llm.BoundedModelClient;
import com.example.kbassist.llm.UpstreamModelException;
import com.example.kbassist.model.Citation;
import com.example.kbassist.model.Fragment;
import com.example.kbassist.model.GroundingDecision;
import com.example.kbassist.model.QueryContext;
import com.example.kbassist.model.QueryResult;
import com.example.kbassist.model.QueryStage;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Answers one question against one knowledge base:
 * embed, retrieve, generate, ground, cite, persist.
 *
 * <p>Empty retrieval and an ungrounded answer both end in the same "unknown" refusal. An
 * embedding or generation failure ends in an "error" result; the partial interaction is still
 * recorded when the log accepts it. Every run records at most one interaction, under the id it
 * returns. Dimension mismatches between the embedding model and the index are configuration
 * errors and are not converted into results.
 */
@Slf4j
@Service
public class QueryOrchestrator {

    static final String PROMPT_TEMPLATE = """
            Answer the following question based ONLY on the provided context. \
            If the context doesn't contain the answer, say so.

            Context:
            %s

            Question: %s""";

    private final BoundedModelClient modelClient;
    private final VectorIndex vectorIndex;
    private final GroundingEvaluator groundingEvaluator;
    private final InteractionLog interactionLog;
    private final int topK;

    public QueryOrchestrator(BoundedModelClient modelClient,
                             VectorIndex vectorIndex,
                             GroundingEvaluator groundingEvaluator,
                             InteractionLog interactionLog,
                             KbAssistProperties properties) {
        this.modelClient = modelClient;
        this.vectorIndex = vectorIndex;
        this.groundingEvaluator = groundingEvaluator;
        this.interactionLog = interactionLog;
        this.topK = properties.getRetrieval().getTopK();
    }

    public Mono<QueryResult> execute(String knowledgeBaseId, String question) {
        return Mono.defer(() -> {
            if (knowledgeBaseId == null || knowledgeBaseId.isBlank()) {
                return Mono.error(new IllegalArgumentException("knowledgeBaseId is required"));
            }
            if (question == null || question.isBlank()) {
                return Mono.error(new IllegalArgumentException("question is required"));
            }

            QueryContext ctx = QueryContext.start(UUID.randomUUID().toString(), knowledgeBaseId, question);
            ctx.addStep(QueryStage.EMBEDDING, "question chars=" + question.length());
            log.debug("[{}] embedding question for kb {}", ctx.getInteractionId(), knowledgeBaseId);

            return modelClient.embed(question)
                    .map(vector -> retrieve(ctx, vector))
                    .flatMap(c -> c.getFragments().isEmpty()
                            ? Mono.just(c.refuse("no fragments retrieved"))
                            : generateAndGround(c))
                    .flatMap(this::persist)
                    .map(this::finish)
                    .onErrorResume(UpstreamModelException.class, ex -> recordFailure(ctx, ex))
                    .onErrorResume(InteractionLogException.class, ex -> reportLogFailure(ctx, ex));
        });
    }

    private QueryContext retrieve(QueryContext ctx, float[] vector) {
        ctx.setQueryEmbedding(vector);
        ctx.addStep(QueryStage.RETRIEVING, "topK=" + topK);
        List<Fragment> fragments = vectorIndex.search(vector, ctx.getKnowledgeBaseId(), topK);
        ctx.setFragments(fragments);
        log.debug("[{}] retrieved {} fragments", ctx.getInteractionId(), fragments.size());
        return ctx;
    }

    private Mono<QueryContext> generateAndGround(QueryContext ctx) {
        String context = renderContext(ctx.getFragments());
        String prompt = PROMPT_TEMPLATE.formatted(context, ctx.getQuestion());
        ctx.setPrompt(prompt);
        ctx.addStep(QueryStage.GENERATING, "prompt chars=" + prompt.length());
        log.debug("[{}] generating answer", ctx.getInteractionId());

        return modelClient.generate(prompt, context)
                .map(answer -> {
                    ctx.setGeneratedAnswer(answer);
                    GroundingDecision decision =
                            groundingEvaluator.evaluate(ctx.getQuestion(), answer, ctx.getFragments());
                    ctx.setGrounding(decision);
                    ctx.addStep(QueryStage.GROUNDING, decision.getReasoning());
                    log.debug("[{}] grounding: {} (confidence {})",
                            ctx.getInteractionId(), decision.getReasoning(), decision.getConfidence());
                    if (!decision.isGrounded()) {
                        return ctx.refuse("answer not grounded");
                    }
                    return ctx.answer(cite(ctx.getFragments(), decision));
                });
    }

    static String renderContext(List<Fragment> fragments) {
        return fragments.stream()
                .map(fragment -> "[Fragment " + fragment.getId() + "]: " + fragment.getText())
                .collect(Collectors.joining("\n\n"));
    }

    /** One citation per supporting fragment, in retrieval order. */
    static List<Citation> cite(List<Fragment> fragments, GroundingDecision decision) {
        return fragments.stream()
                .filter(fragment -> decision.getSupportingFragmentIds().contains(fragment.getId()))
                .map(Citation::of)
                .toList();
    }

    private Mono<QueryContext> persist(QueryContext ctx) {
        ctx.addStep(QueryStage.PERSISTING, "status=" + ctx.getStatus());
        return save(ctx).thenReturn(ctx);
    }

    private Mono<Void> save(QueryContext ctx) {
        return Mono.fromCallable(() -> interactionLog.save(ctx.toInteraction(Instant.now())))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(ex -> !(ex instanceof InteractionLogException),
                        ex -> new InteractionLogException(
                                "Failed to record interaction " + ctx.getInteractionId(), ex))
                .then();
    }

    private QueryResult finish(QueryContext ctx) {
        ctx.addStep(QueryStage.DONE, null);
        log.info("[{}] kb={} status={} fragments={} confidence={}",
                ctx.getInteractionId(),
                ctx.getKnowledgeBaseId(),
                ctx.getStatus(),
                ctx.getFragments().size(),
                ctx.getGrounding() == null ? "n/a" : String.format("%.2f", ctx.getGrounding().getConfidence()));
        return ctx.toResult();
    }

    private Mono<QueryResult> recordFailure(QueryContext ctx, UpstreamModelException ex) {
        log.warn("[{}] {} stage failed for kb {}: {}",
                ctx.getInteractionId(), ex.getStage(), ctx.getKnowledgeBaseId(), ex.getMessage());
        ctx.fail(ex.getMessage());
        return save(ctx)
                .onErrorResume(saveError -> {
                    log.error("[{}] could not record failed interaction", ctx.getInteractionId(), saveError);
                    return Mono.empty();
                })
                .then(Mono.fromSupplier(ctx::toResult));
    }

    private Mono<QueryResult> reportLogFailure(QueryContext ctx, InteractionLogException ex) {
        log.error("[{}] interaction log rejected the {} outcome", ctx.getInteractionId(), ctx.getStatus(), ex);
        ctx.fail(ex.getMessage());
        return Mono.just(ctx.toResult());
    }
}
