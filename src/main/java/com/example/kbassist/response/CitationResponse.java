package com.example.kbassist.response;

import com.example.kbassist.model.Citation;

public record CitationResponse(
        String sourceDocument,
        Integer page,
        String fragmentId,
        double relevanceScore
) {

    public static CitationResponse from(Citation citation) {
        return new CitationResponse(
                citation.sourceDocument(), citation.page(), citation.fragmentId(), citation.relevanceScore());
    }
}
