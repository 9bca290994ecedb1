package com.flamingo.ai.contextmemory.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A conversation that referenced a document. Rows are append-only; the generated id gives the
 * order in which conversations first referenced the document.
 */
@Entity
@Table(
    name = "document_conversation_links",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_document_conversation",
            columnNames = {"document_id", "conversation_id"}),
    indexes = @Index(name = "idx_link_document", columnList = "document_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentConversationLink {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "document_id", nullable = false)
  private String documentId;

  @Column(name = "conversation_id", nullable = false)
  private String conversationId;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Column(name = "linked_at", nullable = false)
  private LocalDateTime linkedAt;
}
