package com.flamingo.ai.contextmemory.domain.entity;

import com.flamingo.ai.contextmemory.domain.converter.EmbeddingConverter;
import com.flamingo.ai.contextmemory.domain.converter.StringListConverter;
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
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One summarized conversation segment. There is exactly one record per conversation id;
 * finalizing the same conversation again merges into it.
 */
@Entity
@Table(
    name = "conversation_memory",
    indexes = {
      @Index(name = "idx_conversation_memory_user", columnList = "user_id"),
      @Index(name = "idx_conversation_memory_pending", columnList = "pending_embedding")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationMemory {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Column(name = "conversation_id", nullable = false, unique = true)
  private String conversationId;

  @Column(name = "session_id")
  private String sessionId;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String summary;

  @Convert(converter = StringListConverter.class)
  @Column(name = "key_points", columnDefinition = "TEXT")
  @Builder.Default
  private List<String> keyPoints = new ArrayList<>();

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> decisions = new ArrayList<>();

  @Convert(converter = StringListConverter.class)
  @Column(name = "document_ids", columnDefinition = "TEXT")
  @Builder.Default
  private List<String> documentIds = new ArrayList<>();

  /** References to artifacts (quizzes, plans) generated during the conversation. */
  @Convert(converter = StringListConverter.class)
  @Column(name = "artifact_refs", columnDefinition = "TEXT")
  @Builder.Default
  private List<String> artifactRefs = new ArrayList<>();

  /** Summary embedding; {@code null} until computed. */
  @Convert(converter = EmbeddingConverter.class)
  @Column(columnDefinition = "TEXT")
  private float[] embedding;

  /** Set when embedding failed after retries; cleared by the background sweep. */
  @Column(name = "pending_embedding", nullable = false)
  private boolean pendingEmbedding;

  @Builder.Default private double importance = 0.0;

  @Column(name = "message_count", nullable = false)
  private int messageCount;

  @Column(name = "access_count", nullable = false)
  private long accessCount;

  @Column(name = "start_time")
  private LocalDateTime startTime;

  @Column(name = "end_time")
  private LocalDateTime endTime;

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

  /** Whether this record can take part in similarity search. */
  public boolean isSearchable() {
    return embedding != null && !pendingEmbedding;
  }

  /** Timestamp used as the final recency tie-breaker. */
  public LocalDateTime recency() {
    return endTime != null ? endTime : updatedAt;
  }
}
