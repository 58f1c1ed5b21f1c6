package com.example.kbassist.entity;

import com.example.kbassist.model.Citation;
import com.example.kbassist.model.InteractionStatus;
import com.example.kbassist.util.CitationListConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.experimental.Accessors;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Accessors(chain = true)
@Entity
@Table(name = "interactions", indexes = {
        @Index(name = "idx_interactions_kb_created", columnList = "knowledge_base_id, created_at")
})
public class InteractionEntity implements Persistable<String> {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "knowledge_base_id", nullable = false)
    private String knowledgeBaseId;

    @Column(name = "question", nullable = false, columnDefinition = "text")
    private String question;

    @Column(name = "answer", columnDefinition = "text")
    private String answer;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private InteractionStatus status;

    @Convert(converter = CitationListConverter.class)
    @Column(name = "citations", nullable = false, columnDefinition = "text")
    private List<Citation> citations = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /** Rows are append only, so saving always inserts and a reused id fails instead of merging. */
    @Override
    public boolean isNew() {
        return true;
    }
}
