package com.flamingo.ai.contextmemory.domain.entity;

import com.flamingo.ai.contextmemory.domain.converter.CountMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Accumulated personalization signal for one user. */
@Entity
@Table(name = "user_preferences")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserPreferences {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, unique = true)
  private String userId;

  /** How often each question type was requested. */
  @Convert(converter = CountMapConverter.class)
  @Column(name = "question_type_counts", columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, Integer> questionTypeCounts = new LinkedHashMap<>();

  /** Preferred difficulty, e.g. easy, medium, hard. */
  @Column(name = "difficulty_bias")
  private String difficultyBias;

  private String language;

  @Column(name = "communication_style")
  private String communicationStyle;

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

  /** Share of each question type among all recorded requests, in insertion order. */
  public Map<String, Double> questionTypeBias() {
    Map<String, Double> bias = new LinkedHashMap<>();
    int total = questionTypeCounts.values().stream().mapToInt(Integer::intValue).sum();
    if (total == 0) {
      return bias;
    }
    questionTypeCounts.forEach((type, count) -> bias.put(type, (double) count / total));
    return bias;
  }
}
