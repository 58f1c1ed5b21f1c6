package com.example.kbassist.service;

import com.example.kbassist.model.Interaction;
import com.example.kbassist.model.InteractionStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/** Non-durable log for development and tests. Contents are lost on restart. */
@Slf4j
public class InMemoryInteractionLog implements InteractionLog {

    private static final Comparator<Entry> NEWEST_FIRST = Comparator
            .comparing((Entry e) -> e.interaction().getCreatedAt(), Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparingLong(Entry::sequence)
            .reversed();

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Interaction save(Interaction interaction) {
        Objects.requireNonNull(interaction.getId(), "interaction id");
        Entry previous = entries.putIfAbsent(interaction.getId(), new Entry(sequence.incrementAndGet(), interaction));
        if (previous != null) {
            throw new InteractionLogException("Interaction " + interaction.getId() + " already recorded", null);
        }
        log.debug("Recorded interaction {} ({})", interaction.getId(), interaction.getStatus());
        return interaction;
    }

    @Override
    public Optional<Interaction> get(String id) {
        return Optional.ofNullable(entries.get(id)).map(Entry::interaction);
    }

    @Override
    public List<Interaction> list(String knowledgeBaseId, int limit, int offset) {
        return scoped(knowledgeBaseId)
                .sorted(NEWEST_FIRST)
                .skip(offset)
                .limit(limit)
                .map(Entry::interaction)
                .toList();
    }

    @Override
    public Map<InteractionStatus, Long> countByStatus(String knowledgeBaseId) {
        Map<InteractionStatus, Long> counts = new EnumMap<>(InteractionStatus.class);
        for (InteractionStatus status : InteractionStatus.values()) {
            counts.put(status, 0L);
        }
        scoped(knowledgeBaseId).forEach(e -> counts.merge(e.interaction().getStatus(), 1L, Long::sum));
        return counts;
    }

    private Stream<Entry> scoped(String knowledgeBaseId) {
        List<Entry> snapshot = new ArrayList<>(entries.values());
        return snapshot.stream()
                .filter(e -> knowledgeBaseId == null || knowledgeBaseId.equals(e.interaction().getKnowledgeBaseId()));
    }

    private record Entry(long sequence, Interaction interaction) {
    }
}
