package com.flamingo.ai.contextmemory.api.dto.request;

import com.flamingo.ai.contextmemory.domain.model.FinishedTurn;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO handing a finished turn over to the memory writer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinishedTurnRequest {

  @NotBlank(message = "User ID is required")
  private String userId;

  @NotBlank(message = "Conversation ID is required")
  private String conversationId;

  private String sessionId;

  /** The whole conversation so far, oldest message first. */
  @Valid
  @NotEmpty(message = "Transcript must not be empty")
  private List<@NotNull(message = "Messages must not be null") RecentMessageRequest> transcript;

  @Builder.Default
  private List<@NotBlank(message = "Document IDs must not be blank") String> documentIds =
      new ArrayList<>();

  @Builder.Default
  private List<@NotBlank(message = "Artifact refs must not be blank") String> artifactRefs =
      new ArrayList<>();

  private String questionType;

  private LocalDateTime startedAt;

  private LocalDateTime finishedAt;

  public FinishedTurn toTurn() {
    return new FinishedTurn(
        userId,
        conversationId,
        sessionId,
        transcript.stream().map(RecentMessageRequest::toMessage).toList(),
        documentIds,
        artifactRefs,
        questionType,
        startedAt,
        finishedAt == null ? LocalDateTime.now() : finishedAt);
  }
}
