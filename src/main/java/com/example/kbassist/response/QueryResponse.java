package com.example.kbassist.response;

import com.example.kbassist.model.QueryResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse(
        String status,
        String answer,
        List<CitationResponse> citations,
        String interactionId,
        String error
) {

    public static QueryResponse from(QueryResult result) {
        return new QueryResponse(
                result.getStatus().apiValue(),
                result.getAnswer(),
                result.getCitations().stream().map(CitationResponse::from).toList(),
                result.getInteractionId(),
                result.getError());
    }
}
