package com.flamingo.ai.contextmemory.domain.entity;

import com.flamingo.ai.contextmemory.domain.converter.StringListConverter;
import com.flamingo.ai.contextmemory.domain.converter.StringMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
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

/** Short-lived working memory of one live session. */
@Entity
@Table(
    name = "session_state",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_session_state_user_session",
            columnNames = {"user_id", "session_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionState {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Column(name = "session_id", nullable = false)
  private String sessionId;

  @Convert(converter = StringListConverter.class)
  @Column(name = "active_document_ids", columnDefinition = "TEXT")
  @Builder.Default
  private List<String> activeDocumentIds = new ArrayList<>();

  @Column(name = "current_plan_ref")
  private String currentPlanRef;

  @Convert(converter = StringMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, String> scratch = new LinkedHashMap<>();

  @Column(name = "expires_at", nullable = false)
  private LocalDateTime expiresAt;

  /** Set once a newer session begins for the same user. */
  @Column(nullable = false)
  private boolean superseded;

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

  /** Whether the state may still be read at {@code now}. */
  public boolean isActiveAt(LocalDateTime now) {
    return !superseded && expiresAt.isAfter(now);
  }
}
