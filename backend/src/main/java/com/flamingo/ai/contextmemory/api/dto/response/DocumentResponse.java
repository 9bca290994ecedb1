package com.flamingo.ai.contextmemory.api.dto.response;

import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.model.DocumentView;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document memory data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private String documentId;
  private String userId;
  private String fullContent;
  private String summary;
  private List<String> keyTopics;
  private Map<String, String> metadata;
  private List<String> conversationIds;
  private long accessCount;
  private boolean pendingEmbedding;
  private LocalDateTime lastAccessed;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a DocumentResponse from a freshly ingested document, which has no links yet. */
  public static DocumentResponse fromEntity(DocumentMemory document) {
    return fromView(new DocumentView(document, List.of()));
  }

  public static DocumentResponse fromView(DocumentView view) {
    DocumentMemory document = view.document();
    return DocumentResponse.builder()
        .documentId(document.getDocumentId())
        .userId(document.getUserId())
        .fullContent(document.getFullContent())
        .summary(document.getSummary())
        .keyTopics(document.getKeyTopics())
        .metadata(document.getMetadata())
        .conversationIds(view.conversationIds())
        .accessCount(document.getAccessCount())
        .pendingEmbedding(document.isPendingEmbedding())
        .lastAccessed(document.getLastAccessed())
        .createdAt(document.getCreatedAt())
        .updatedAt(document.getUpdatedAt())
        .build();
  }
}
