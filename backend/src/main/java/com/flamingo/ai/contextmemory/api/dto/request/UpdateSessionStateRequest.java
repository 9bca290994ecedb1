package com.flamingo.ai.contextmemory.api.dto.request;

import com.flamingo.ai.contextmemory.domain.model.SessionStateUpdate;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for writing session working memory. Absent fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSessionStateRequest {

  private List<String> activeDocumentIds;

  private String currentPlanRef;

  private Map<String, String> scratch;

  @Min(value = 1, message = "TTL must be at least 1 minute")
  private Integer ttlMinutes;

  /** Starts the session afresh, superseding the user's other sessions. */
  private boolean begin;

  public Duration ttl() {
    return ttlMinutes == null ? null : Duration.ofMinutes(ttlMinutes);
  }

  public SessionStateUpdate toUpdate() {
    return new SessionStateUpdate(activeDocumentIds, currentPlanRef, scratch, ttl());
  }
}
