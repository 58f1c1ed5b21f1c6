package com.example.kbassist.model;

/**
 * Source reference for an answered question, one per supporting fragment.
 *
 * @param relevanceScore always {@link #NEUTRAL_RELEVANCE}; retrieval distances are not propagated
 */
public record Citation(
        String sourceDocument,
        Integer page,
        String fragmentId,
        double relevanceScore
) {

    public static final double NEUTRAL_RELEVANCE = 0.0;

    public static Citation of(Fragment fragment) {
        return new Citation(fragment.getSourceDocument(), fragment.getPage(), fragment.getId(), NEUTRAL_RELEVANCE);
    }
}
