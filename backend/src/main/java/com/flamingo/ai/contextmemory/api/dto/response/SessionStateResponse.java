package com.flamingo.ai.contextmemory.api.dto.response;

import com.flamingo.ai.contextmemory.domain.entity.SessionState;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for session working memory. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionStateResponse {

  private String userId;
  private String sessionId;
  private List<String> activeDocumentIds;
  private String currentPlanRef;
  private Map<String, String> scratch;
  private LocalDateTime expiresAt;
  private LocalDateTime updatedAt;

  public static SessionStateResponse fromEntity(SessionState state) {
    return SessionStateResponse.builder()
        .userId(state.getUserId())
        .sessionId(state.getSessionId())
        .activeDocumentIds(state.getActiveDocumentIds())
        .currentPlanRef(state.getCurrentPlanRef())
        .scratch(state.getScratch())
        .expiresAt(state.getExpiresAt())
        .updatedAt(state.getUpdatedAt())
        .build();
  }
}
