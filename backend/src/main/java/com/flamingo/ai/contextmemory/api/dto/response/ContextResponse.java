package com.flamingo.ai.contextmemory.api.dto.response;

import com.flamingo.ai.contextmemory.domain.model.AssembledContext;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.ImmediateMessage;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.LongTerm;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an assembled turn context. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextResponse {

  private List<ImmediateMessage> immediate;
  private LongTerm longTerm;
  private String synthesizedSummary;
  private boolean longTermDegraded;

  public static ContextResponse fromContext(AssembledContext context) {
    return ContextResponse.builder()
        .immediate(context.immediate())
        .longTerm(context.longTerm())
        .synthesizedSummary(context.synthesizedSummary())
        .longTermDegraded(context.longTermDegraded())
        .build();
  }
}
