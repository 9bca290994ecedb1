package com.flamingo.ai.contextmemory.domain.entity;

import com.flamingo.ai.contextmemory.domain.converter.EmbeddingConverter;
import com.flamingo.ai.contextmemory.domain.converter.StringListConverter;
import com.flamingo.ai.contextmemory.domain.converter.StringMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Full-content record of an uploaded or referenced document. The text is stored whole; the
 * conversations that referenced the document live in {@link DocumentConversationLink}.
 */
@Entity
@Table(
    name = "document_memory",
    indexes = {
      @Index(name = "idx_document_memory_user", columnList = "user_id"),
      @Index(name = "idx_document_memory_pending", columnList = "pending_embedding")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentMemory {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "document_id", nullable = false, unique = true)
  private String documentId;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Column(name = "full_content", columnDefinition = "TEXT", nullable = false)
  private String fullContent;

  @Column(columnDefinition = "TEXT")
  private String summary;

  @Convert(converter = StringListConverter.class)
  @Column(name = "key_topics", columnDefinition = "TEXT")
  @Builder.Default
  private List<String> keyTopics = new ArrayList<>();

  /** Structural metadata handed over by the extractor (page count, mime type, title). */
  @Convert(converter = StringMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, String> metadata = new LinkedHashMap<>();

  @Convert(converter = EmbeddingConverter.class)
  @Column(columnDefinition = "TEXT")
  private float[] embedding;

  @Column(name = "pending_embedding", nullable = false)
  private boolean pendingEmbedding;

  @Column(name = "access_count", nullable = false)
  private long accessCount;

  @Column(name = "last_accessed")
  private LocalDateTime lastAccessed;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(name = "updated_at", nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  public boolean isSearchable() {
    return embedding != null && !pendingEmbedding;
  }

  public LocalDateTime recency() {
    return lastAccessed != null ? lastAccessed : updatedAt;
  }
}
