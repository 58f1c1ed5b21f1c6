package com.example.kbassist.dao;

import com.example.kbassist.entity.InteractionEntity;
import com.example.kbassist.model.InteractionStatus;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface InteractionRepository extends JpaRepository<InteractionEntity, String> {

    @Query(value = "SELECT * FROM interactions ORDER BY created_at DESC, id DESC LIMIT :limit OFFSET :offset",
            nativeQuery = true)
    List<InteractionEntity> findRecent(@Param("limit") int limit, @Param("offset") int offset);

    @Query(value = "SELECT * FROM interactions WHERE knowledge_base_id = :kbId "
            + "ORDER BY created_at DESC, id DESC LIMIT :limit OFFSET :offset",
            nativeQuery = true)
    List<InteractionEntity> findRecentByKnowledgeBase(
            @Param("kbId") String knowledgeBaseId, @Param("limit") int limit, @Param("offset") int offset);

    long countByStatus(InteractionStatus status);

    long countByKnowledgeBaseIdAndStatus(String knowledgeBaseId, InteractionStatus status);
}
