package com.example.kbassist.controller;

import com.example.kbassist.request.QueryRequest;
import com.example.kbassist.response.QueryResponse;
import com.example.kbassist.service.QueryOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/query")
@RequiredArgsConstructor
@Tag(name = "Query", description = "Ask a question against one knowledge base")
public class QueryController {

    private final QueryOrchestrator orchestrator;

    @Operation(summary = "Answer a question from indexed fragments",
            description = "Returns status answered with citations, or unknown with a fixed refusal. "
                    + "Model failures return status error.")
    @PostMapping
    public Mono<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        return orchestrator.execute(request.knowledgeBaseId(), request.question())
                .map(QueryResponse::from);
    }
}
