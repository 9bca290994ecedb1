package com.flamingo.ai.contextmemory.api.dto.request;

import com.flamingo.ai.contextmemory.domain.enums.MessageRole;
import com.flamingo.ai.contextmemory.domain.model.RecentMessage;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One message of a conversation as sent by the chat layer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecentMessageRequest {

  @NotNull(message = "Role is required")
  private MessageRole role;

  @NotNull(message = "Content is required")
  private String content;

  private LocalDateTime timestamp;

  public RecentMessage toMessage() {
    return new RecentMessage(role, content, timestamp);
  }
}
