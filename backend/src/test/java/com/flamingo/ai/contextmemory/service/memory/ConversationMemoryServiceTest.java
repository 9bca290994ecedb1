package com.flamingo.ai.contextmemory.service.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.exception.MemoryAccessDeniedException;
import com.flamingo.ai.contextmemory.exception.MemoryNotFoundException;
import com.flamingo.ai.contextmemory.service.store.MemoryStore;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConversationMemoryServiceTest {

  @Mock private MemoryStore memoryStore;

  private ConversationMemoryService memoryService;

  @BeforeEach
  void setUp() {
    memoryService = new ConversationMemoryService(memoryStore);
  }

  private static ConversationMemory memory(String conversationId, String userId) {
    return ConversationMemory.builder()
        .conversationId(conversationId)
        .userId(userId)
        .summary("Quiz on photosynthesis")
        .build();
  }

  @Test
  @DisplayName("should list the user's memories as stored")
  void shouldListMemories() {
    when(memoryStore.listConversations("u1"))
        .thenReturn(List.of(memory("C2", "u1"), memory("C1", "u1")));

    assertThat(memoryService.listMemories("u1"))
        .extracting(ConversationMemory::getConversationId)
        .containsExactly("C2", "C1");
  }

  @Test
  @DisplayName("should return the user's own memory")
  void shouldReturnOwnMemory() {
    when(memoryStore.findConversation("C1")).thenReturn(Optional.of(memory("C1", "u1")));

    assertThat(memoryService.getMemory("u1", "C1").getSummary())
        .isEqualTo("Quiz on photosynthesis");
  }

  @Test
  @DisplayName("should fail for a conversation without memory")
  void shouldFailForMissingMemory() {
    when(memoryStore.findConversation("C9")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> memoryService.getMemory("u1", "C9"))
        .isInstanceOf(MemoryNotFoundException.class);
  }

  @Test
  @DisplayName("should deny another user's memory")
  void shouldDenyForeignMemory() {
    when(memoryStore.findConversation("C1")).thenReturn(Optional.of(memory("C1", "u2")));

    assertThatThrownBy(() -> memoryService.getMemory("u1", "C1"))
        .isInstanceOf(MemoryAccessDeniedException.class);
  }
}
