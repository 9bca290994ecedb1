package com.flamingo.ai.contextmemory.api.rest;

import com.flamingo.ai.contextmemory.api.dto.request.ContextRequest;
import com.flamingo.ai.contextmemory.api.dto.request.FinishedTurnRequest;
import com.flamingo.ai.contextmemory.api.dto.response.ContextResponse;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext;
import com.flamingo.ai.contextmemory.service.context.ContextAssemblyService;
import com.flamingo.ai.contextmemory.service.writer.MemoryWriterService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the per-turn read and write paths used by the chat layer. */
@RestController
@RequestMapping("/api/context")
@RequiredArgsConstructor
@Slf4j
public class ContextController {

  private final ContextAssemblyService contextAssemblyService;
  private final MemoryWriterService memoryWriterService;

  /**
   * Assembles the prompt context for the turn about to be answered.
   *
   * @param request the turn
   * @return the assembled context; long-term layers may be missing when degraded
   */
  @PostMapping
  public ResponseEntity<ContextResponse> assemble(@Valid @RequestBody ContextRequest request) {
    AssembledContext context = contextAssemblyService.assemble(request.toQuery());
    return ResponseEntity.ok(ContextResponse.fromContext(context));
  }

  /**
   * Hands a finished turn to the memory writer. Returns before the memory is written.
   *
   * @param request the finished turn
   * @return 202 Accepted
   */
  @PostMapping("/turns")
  public ResponseEntity<Void> finishTurn(@Valid @RequestBody FinishedTurnRequest request) {
    log.debug(
        "Dispatching memory write for conversation {} ({} messages)",
        request.getConversationId(),
        request.getTranscript().size());
    memoryWriterService.writeAsync(request.toTurn());
    return ResponseEntity.accepted().build();
  }
}
