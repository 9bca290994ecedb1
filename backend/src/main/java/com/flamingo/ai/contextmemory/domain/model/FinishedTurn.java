package com.flamingo.ai.contextmemory.domain.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * A conversation turn whose reply has been finalized and may now be remembered.
 *
 * @param transcript the conversation so far, oldest first
 * @param documentIds documents referenced during the turn
 * @param artifactRefs references to generated artifacts (quizzes, plans)
 * @param questionType question type requested in the turn, if any
 */
public record FinishedTurn(
    String userId,
    String conversationId,
    String sessionId,
    List<RecentMessage> transcript,
    List<String> documentIds,
    List<String> artifactRefs,
    String questionType,
    LocalDateTime startedAt,
    LocalDateTime finishedAt) {

  public FinishedTurn {
    transcript = withoutNulls(transcript);
    documentIds = withoutNulls(documentIds);
    artifactRefs = withoutNulls(artifactRefs);
  }

  private static <T> List<T> withoutNulls(List<T> values) {
    return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
  }
}
