package com.flamingo.ai.contextmemory.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything the assembler needs to build the context of one turn.
 *
 * @param memoryDepthDays how far back semantic search looks
 * @param recentMessages messages of the active conversation, oldest first
 */
public record ContextQuery(
    String userId,
    String conversationId,
    String sessionId,
    String currentMessageText,
    List<String> attachedDocumentIds,
    boolean enableMemory,
    int memoryDepthDays,
    List<RecentMessage> recentMessages) {

  public ContextQuery {
    attachedDocumentIds = withoutNulls(attachedDocumentIds);
    recentMessages = withoutNulls(recentMessages);
  }

  private static <T> List<T> withoutNulls(List<T> values) {
    return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
  }
}
