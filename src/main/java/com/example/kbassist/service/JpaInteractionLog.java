package com.example.kbassist.service;

import com.example.kbassist.dao.InteractionRepository;
import com.example.kbassist.entity.InteractionEntity;
import com.example.kbassist.model.Interaction;
import com.example.kbassist.model.InteractionStatus;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;

/** Durable log on the {@code interactions} table. */
@Slf4j
@RequiredArgsConstructor
public class JpaInteractionLog implements InteractionLog {

    private final InteractionRepository repository;

    @Override
    public Interaction save(Interaction interaction) {
        try {
            repository.saveAndFlush(toEntity(interaction));
        } catch (DataIntegrityViolationException ex) {
            throw new InteractionLogException("Interaction " + interaction.getId() + " already recorded", ex);
        } catch (DataAccessException ex) {
            throw new InteractionLogException("Failed to record interaction " + interaction.getId(), ex);
        }
        log.debug("Recorded interaction {} ({})", interaction.getId(), interaction.getStatus());
        return interaction;
    }

    @Override
    public Optional<Interaction> get(String id) {
        return repository.findById(id).map(JpaInteractionLog::toModel);
    }

    @Override
    public List<Interaction> list(String knowledgeBaseId, int limit, int offset) {
        List<InteractionEntity> rows = knowledgeBaseId == null
                ? repository.findRecent(limit, offset)
                : repository.findRecentByKnowledgeBase(knowledgeBaseId, limit, offset);
        return rows.stream().map(JpaInteractionLog::toModel).toList();
    }

    @Override
    public Map<InteractionStatus, Long> countByStatus(String knowledgeBaseId) {
        Map<InteractionStatus, Long> counts = new EnumMap<>(InteractionStatus.class);
        for (InteractionStatus status : InteractionStatus.values()) {
            long count = knowledgeBaseId == null
                    ? repository.countByStatus(status)
                    : repository.countByKnowledgeBaseIdAndStatus(knowledgeBaseId, status);
            counts.put(status, count);
        }
        return counts;
    }

    private static InteractionEntity toEntity(Interaction interaction) {
        return new InteractionEntity()
                .setId(interaction.getId())
                .setKnowledgeBaseId(interaction.getKnowledgeBaseId())
                .setQuestion(interaction.getQuestion())
                .setAnswer(interaction.getAnswer())
                .setStatus(interaction.getStatus())
                .setCitations(new ArrayList<>(interaction.getCitations()))
                .setCreatedAt(interaction.getCreatedAt());
    }

    private static Interaction toModel(InteractionEntity entity) {
        return Interaction.builder()
                .id(entity.getId())
                .knowledgeBaseId(entity.getKnowledgeBaseId())
                .question(entity.getQuestion())
                .answer(entity.getAnswer())
                .status(entity.getStatus())
                .citations(entity.getCitations())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
