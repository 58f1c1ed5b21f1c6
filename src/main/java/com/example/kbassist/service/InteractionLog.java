package com.example.kbassist.service;

import com.example.kbassist.model.Interaction;
import com.example.kbassist.model.InteractionStatus;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only record of query outcomes. Implementations accept concurrent {@link #save} calls;
 * each write is atomic and visible to readers once it returns.
 */
public interface InteractionLog {

    /**
     * @throws InteractionLogException when the record could not be written
     */
    Interaction save(Interaction interaction);

    Optional<Interaction> get(String id);

    /**
     * Most recent first.
     *
     * @param knowledgeBaseId restricts the listing to one knowledge base, or {@code null} for all
     */
    List<Interaction> list(String knowledgeBaseId, int limit, int offset);

    /** Count per status, every status present. {@code knowledgeBaseId} may be {@code null}. */
    Map<InteractionStatus, Long> countByStatus(String knowledgeBaseId);
}
