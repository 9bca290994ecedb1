package com.flamingo.ai.contextmemory.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for linking a document to a conversation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkDocumentRequest {

  @NotBlank(message = "Conversation ID is required")
  private String conversationId;
}
