package com.flamingo.ai.contextmemory.api.rest;

import com.flamingo.ai.contextmemory.api.dto.response.MemoryResponse;
import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.service.memory.ConversationMemoryService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for conversation memories. */
@RestController
@RequestMapping("/api/users/{userId}/memories")
@RequiredArgsConstructor
public class MemoryController {

  private final ConversationMemoryService conversationMemoryService;

  /**
   * Lists all memories of a user.
   *
   * @param userId the owner
   * @return memories ordered by importance, most recent first on ties
   */
  @GetMapping
  public ResponseEntity<List<MemoryResponse>> listMemories(@PathVariable String userId) {
    List<ConversationMemory> memories = conversationMemoryService.listMemories(userId);
    return ResponseEntity.ok(memories.stream().map(MemoryResponse::fromEntity).toList());
  }

  /**
   * Gets the memory of one conversation.
   *
   * @param userId the owner
   * @param conversationId the conversation
   * @return the memory
   */
  @GetMapping("/{conversationId}")
  public ResponseEntity<MemoryResponse> getMemory(
      @PathVariable String userId, @PathVariable String conversationId) {
    ConversationMemory memory = conversationMemoryService.getMemory(userId, conversationId);
    return ResponseEntity.ok(MemoryResponse.fromEntity(memory));
  }
}
