package com.example.kbassist.llm;

import com.example.kbassist.config.KbAssistProperties;
import com.example.kbassist.model.QueryStage;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs {@link ModelGateway} calls off the event loop with a hard timeout. Any failure,
 * including the timeout, surfaces as {@link UpstreamModelException}. Nothing is retried here.
 */
@Slf4j
@Component
public class BoundedModelClient {

    private final ModelGateway gateway;
    private final Duration timeout;

    public BoundedModelClient(ModelGateway gateway, KbAssistProperties properties) {
        this.gateway = gateway;
        this.timeout = properties.getModel().getTimeout();
    }

    public Mono<float[]> embed(String text) {
        return call(QueryStage.EMBEDDING, () -> gateway.embed(text));
    }

    public Mono<String> generate(String prompt, String context) {
        return call(QueryStage.GENERATING, () -> gateway.generate(prompt, context));
    }

    private <T> Mono<T> call(QueryStage stage, Callable<T> call) {
        return Mono.fromCallable(call)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .onErrorMap(ex -> !(ex instanceof UpstreamModelException), ex -> {
                    String message = ex instanceof TimeoutException
                            ? "%s timed out after %d ms".formatted(describe(stage), timeout.toMillis())
                            : "%s failed: %s".formatted(describe(stage), ex.getMessage());
                    log.warn(message);
                    return new UpstreamModelException(stage, message, ex);
                });
    }

    private static String describe(QueryStage stage) {
        return stage == QueryStage.EMBEDDING ? "Embedding call" : "Generation call";
    }
}
