package com.flamingo.ai.contextmemory.api.dto.request;

import com.flamingo.ai.contextmemory.domain.model.ContextQuery;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for assembling the context of a turn. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextRequest {

  @NotBlank(message = "User ID is required")
  private String userId;

  private String conversationId;

  private String sessionId;

  private String currentMessageText;

  @Builder.Default
  private List<@NotBlank(message = "Document IDs must not be blank") String> attachedDocumentIds =
      new ArrayList<>();

  @Builder.Default private Boolean enableMemory = true;

  /** Days of history searched; the configured default when absent. */
  @Min(value = 1, message = "Memory depth must be at least 1 day")
  private Integer memoryDepthDays;

  @Valid @Builder.Default
  private List<@NotNull(message = "Messages must not be null") RecentMessageRequest>
      recentMessages = new ArrayList<>();

  public ContextQuery toQuery() {
    return new ContextQuery(
        userId,
        conversationId,
        sessionId,
        currentMessageText,
        attachedDocumentIds,
        enableMemory == null || enableMemory,
        memoryDepthDays == null ? 0 : memoryDepthDays,
        recentMessages == null
            ? List.of()
            : recentMessages.stream().map(RecentMessageRequest::toMessage).toList());
  }
}
