package com.flamingo.ai.contextmemory.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a document link request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkResponse {

  private String documentId;
  private String conversationId;

  /** False when the pair was already linked. */
  private boolean newlyLinked;
}
