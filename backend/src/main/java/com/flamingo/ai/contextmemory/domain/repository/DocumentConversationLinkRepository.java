package com.flamingo.ai.contextmemory.domain.repository;

import com.flamingo.ai.contextmemory.domain.entity.DocumentConversationLink;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for document/conversation links. */
@Repository
public interface DocumentConversationLinkRepository
    extends JpaRepository<DocumentConversationLink, Long> {

  /**
   * Appends the link in one statement unless it already exists.
   *
   * @return 1 when a row was inserted, 0 when the pair was already linked
   */
  @Modifying
  @Query(
      value =
          "INSERT INTO document_conversation_links "
              + "(document_id, conversation_id, user_id, linked_at) "
              + "SELECT :documentId, :conversationId, :userId, :linkedAt "
              + "WHERE NOT EXISTS (SELECT 1 FROM document_conversation_links "
              + "WHERE document_id = :documentId AND conversation_id = :conversationId)",
      nativeQuery = true)
  int insertIfAbsent(
      @Param("documentId") String documentId,
      @Param("conversationId") String conversationId,
      @Param("userId") String userId,
      @Param("linkedAt") LocalDateTime linkedAt);

  /** Conversation ids in the order they first referenced the document. */
  @Query(
      "SELECT l.conversationId FROM DocumentConversationLink l "
          + "WHERE l.documentId = :documentId ORDER BY l.id")
  List<String> findConversationIds(@Param("documentId") String documentId);

  List<DocumentConversationLink> findByDocumentIdOrderByIdAsc(String documentId);

  long countByDocumentIdAndConversationId(String documentId, String conversationId);
}
