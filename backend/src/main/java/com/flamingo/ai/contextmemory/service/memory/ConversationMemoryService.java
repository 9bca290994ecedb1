package com.flamingo.ai.contextmemory.service.memory;

import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.exception.MemoryAccessDeniedException;
import com.flamingo.ai.contextmemory.exception.MemoryNotFoundException;
import com.flamingo.ai.contextmemory.service.store.MemoryStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Read access to a user's conversation memories. */
@Service
@RequiredArgsConstructor
public class ConversationMemoryService {

  private final MemoryStore memoryStore;

  /** Lists the user's memories, most important first. */
  public List<ConversationMemory> listMemories(String userId) {
    return memoryStore.listConversations(userId);
  }

  /**
   * Returns the memory of one conversation.
   *
   * @throws MemoryNotFoundException if the conversation has no memory
   * @throws MemoryAccessDeniedException if the memory belongs to another user
   */
  public ConversationMemory getMemory(String userId, String conversationId) {
    ConversationMemory memory =
        memoryStore
            .findConversation(conversationId)
            .orElseThrow(() -> new MemoryNotFoundException(conversationId));
    if (!memory.getUserId().equals(userId)) {
      throw new MemoryAccessDeniedException(userId, conversationId);
    }
    return memory;
  }
}
