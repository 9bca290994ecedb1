package com.flamingo.ai.contextmemory.api.dto.response;

import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for conversation memory data. The embedding itself is not exposed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryResponse {

  private String conversationId;
  private String userId;
  private String sessionId;
  private String summary;
  private List<String> keyPoints;
  private List<String> decisions;
  private List<String> documentIds;
  private List<String> artifactRefs;
  private double importance;
  private int messageCount;
  private long accessCount;
  private boolean pendingEmbedding;
  private LocalDateTime startTime;
  private LocalDateTime endTime;
  private LocalDateTime lastAccessed;

  /** Creates a MemoryResponse from a ConversationMemory entity. */
  public static MemoryResponse fromEntity(ConversationMemory memory) {
    return MemoryResponse.builder()
        .conversationId(memory.getConversationId())
        .userId(memory.getUserId())
        .sessionId(memory.getSessionId())
        .summary(memory.getSummary())
        .keyPoints(memory.getKeyPoints())
        .decisions(memory.getDecisions())
        .documentIds(memory.getDocumentIds())
        .artifactRefs(memory.getArtifactRefs())
        .importance(memory.getImportance())
        .messageCount(memory.getMessageCount())
        .accessCount(memory.getAccessCount())
        .pendingEmbedding(memory.isPendingEmbedding())
        .startTime(memory.getStartTime())
        .endTime(memory.getEndTime())
        .lastAccessed(memory.getLastAccessed())
        .build();
  }
}
