package com.flamingo.ai.contextmemory.domain.model;

import com.flamingo.ai.contextmemory.domain.enums.MessageRole;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Bounded prompt context of one turn, split into the immediate, long-term and synthesized layers.
 */
public record AssembledContext(
    List<ImmediateMessage> immediate,
    LongTerm longTerm,
    String synthesizedSummary,
    boolean longTermDegraded) {

  /** A verbatim recent message, possibly cut to the per-message ceiling. */
  public record ImmediateMessage(MessageRole role, String content) {}

  public record LongTerm(
      List<RelevantMemory> relevantMemories,
      List<LinkedDocument> linkedDocuments,
      PreferenceSnapshot userPreferences) {}

  public record RelevantMemory(
      String conversationId, String summary, double similarity, double importance) {}

  public record LinkedDocument(String documentId, String summary, LocalDateTime lastUsed) {}

  /** Read-only view of a user's preferences; {@link #empty()} when none are stored. */
  public record PreferenceSnapshot(
      Map<String, Double> questionTypeBias,
      String difficultyBias,
      String language,
      String communicationStyle) {

    public static PreferenceSnapshot empty() {
      return new PreferenceSnapshot(Map.of(), null, null, null);
    }

    public boolean isEmpty() {
      return questionTypeBias.isEmpty()
          && difficultyBias == null
          && language == null
          && communicationStyle == null;
    }
  }
}
