package com.flamingo.ai.contextmemory.domain.repository;

import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ConversationMemory entities. */
@Repository
public interface ConversationMemoryRepository extends JpaRepository<ConversationMemory, UUID> {

  Optional<ConversationMemory> findByConversationId(String conversationId);

  List<ConversationMemory> findByConversationIdIn(Collection<String> conversationIds);

  /** Lists a user's memories, most important first. */
  List<ConversationMemory> findByUserIdOrderByImportanceDescEndTimeDesc(String userId);

  /** Similarity candidates: embedded, not pending, and inside the depth window. */
  @Query(
      "SELECT m FROM ConversationMemory m WHERE m.userId = :userId "
          + "AND m.embedding IS NOT NULL AND m.pendingEmbedding = false "
          + "AND COALESCE(m.endTime, m.updatedAt) >= :since")
  List<ConversationMemory> findSearchCandidates(
      @Param("userId") String userId, @Param("since") LocalDateTime since);

  @Query("SELECT m FROM ConversationMemory m WHERE m.pendingEmbedding = true ORDER BY m.updatedAt")
  List<ConversationMemory> findPendingEmbedding(Pageable pageable);

  long countByPendingEmbeddingTrue();

  /** Best-effort counter bump for retrieved memories. */
  @Modifying
  @Query(
      "UPDATE ConversationMemory m SET m.accessCount = m.accessCount + 1, "
          + "m.lastAccessed = :now WHERE m.conversationId IN :conversationIds")
  int incrementAccessCount(
      @Param("conversationIds") Collection<String> conversationIds,
      @Param("now") LocalDateTime now);

  /** Moves a pending memory to the back of the sweep queue. */
  @Modifying
  @Query(
      "UPDATE ConversationMemory m SET m.updatedAt = :now "
          + "WHERE m.conversationId = :conversationId AND m.pendingEmbedding = true")
  int touchPending(
      @Param("conversationId") String conversationId, @Param("now") LocalDateTime now);
}
