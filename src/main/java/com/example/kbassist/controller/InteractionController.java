package com.example.kbassist.controller;

import com.example.kbassist.response.InteractionPageResponse;
import com.example.kbassist.response.InteractionResponse;
import com.example.kbassist.response.InteractionStatsResponse;
import com.example.kbassist.service.InteractionLog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/v1/interactions")
@RequiredArgsConstructor
@Tag(name = "Interactions", description = "Read-only history of answered and refused questions")
public class InteractionController {

    static final int MAX_LIMIT = 200;

    private final InteractionLog interactionLog;

    @Operation(summary = "List interactions, most recent first")
    @GetMapping
    public Mono<InteractionPageResponse> list(
            @RequestParam(name = "kbId", required = false) String knowledgeBaseId,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        if (limit < 1 || limit > MAX_LIMIT) {
            return Mono.error(new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT));
        }
        if (offset < 0) {
            return Mono.error(new IllegalArgumentException("offset must not be negative"));
        }
        return Mono.fromCallable(() -> interactionLog.list(knowledgeBaseId, limit, offset))
                .subscribeOn(Schedulers.boundedElastic())
                .map(items -> new InteractionPageResponse(
                        items.stream().map(InteractionResponse::from).toList(), limit, offset));
    }

    @Operation(summary = "Interaction counts per status")
    @GetMapping("/stats")
    public Mono<InteractionStatsResponse> stats(@RequestParam(name = "kbId", required = false) String knowledgeBaseId) {
        return Mono.fromCallable(() -> interactionLog.countByStatus(knowledgeBaseId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(counts -> InteractionStatsResponse.from(knowledgeBaseId, counts));
    }

    @Operation(summary = "Get one interaction by id")
    @GetMapping("/{id}")
    public Mono<ResponseEntity<InteractionResponse>> findOne(@PathVariable String id) {
        return Mono.fromCallable(() -> interactionLog.get(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(found -> found
                        .map(interaction -> ResponseEntity.ok(InteractionResponse.from(interaction)))
                        .orElse(ResponseEntity.notFound().build()));
    }
}
