package com.example.kbassist.grounding;

import java.util.Set;

/** Function words ignored when comparing an answer against retrieved text. */
final class StopWords {

    static final Set<String> ENGLISH = Set.of(
            // articles
            "a", "an", "the",
            // pronouns
            "i", "me", "my", "we", "us", "our", "you", "your", "he", "him", "his", "she", "her",
            "it", "its", "they", "them", "their", "this", "that", "these", "those",
            // auxiliaries
            "is", "are", "was", "were", "be", "been", "being", "am",
            "do", "does", "did", "have", "has", "had",
            "can", "could", "will", "would", "shall", "should", "may", "might", "must",
            // conjunctions
            "and", "or", "but", "if", "so", "than", "then",
            // prepositions
            "in", "on", "at", "of", "to", "for", "with", "by", "from", "as",
            // negation
            "not", "no");

    private StopWords() {}
}
