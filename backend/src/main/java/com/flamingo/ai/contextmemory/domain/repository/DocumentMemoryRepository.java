package com.flamingo.ai.contextmemory.domain.repository;

import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
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

/** Repository for DocumentMemory entities. */
@Repository
public interface DocumentMemoryRepository extends JpaRepository<DocumentMemory, UUID> {

  Optional<DocumentMemory> findByDocumentId(String documentId);

  List<DocumentMemory> findByDocumentIdIn(Collection<String> documentIds);

  @Query(
      "SELECT d FROM DocumentMemory d WHERE d.userId = :userId "
          + "AND d.embedding IS NOT NULL AND d.pendingEmbedding = false "
          + "AND COALESCE(d.lastAccessed, d.updatedAt) >= :since")
  List<DocumentMemory> findSearchCandidates(
      @Param("userId") String userId, @Param("since") LocalDateTime since);

  @Query("SELECT d FROM DocumentMemory d WHERE d.pendingEmbedding = true ORDER BY d.updatedAt")
  List<DocumentMemory> findPendingEmbedding(Pageable pageable);

  long countByPendingEmbeddingTrue();

  @Modifying
  @Query(
      "UPDATE DocumentMemory d SET d.accessCount = d.accessCount + 1, "
          + "d.lastAccessed = :now WHERE d.documentId IN :documentIds")
  int incrementAccessCount(
      @Param("documentIds") Collection<String> documentIds, @Param("now") LocalDateTime now);

  @Modifying
  @Query(
      "UPDATE DocumentMemory d SET d.updatedAt = :now "
          + "WHERE d.documentId = :documentId AND d.pendingEmbedding = true")
  int touchPending(@Param("documentId") String documentId, @Param("now") LocalDateTime now);
}
