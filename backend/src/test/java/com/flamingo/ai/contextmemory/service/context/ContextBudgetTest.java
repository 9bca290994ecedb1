package com.flamingo.ai.contextmemory.service.context;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.enums.MessageRole;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.ImmediateMessage;
import com.flamingo.ai.contextmemory.domain.model.RecentMessage;
import com.flamingo.ai.contextmemory.domain.model.ScoredMemory;
import com.flamingo.ai.contextmemory.service.context.ContextBudget.LongTermSelection;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ContextBudgetTest {

  private MemoryConfig memoryConfig;
  private ContextBudget budget;

  @BeforeEach
  void setUp() {
    memoryConfig = new MemoryConfig();
    budget = new ContextBudget(memoryConfig);
  }

  @Nested
  @DisplayName("immediate")
  class Immediate {

    @Test
    @DisplayName("should keep only the last three exchanges")
    void shouldKeepLastSixMessages() {
      List<RecentMessage> messages = new ArrayList<>();
      for (int i = 1; i <= 8; i++) {
        messages.add(message(i % 2 == 1 ? MessageRole.USER : MessageRole.ASSISTANT, "m" + i));
      }

      List<ImmediateMessage> immediate = budget.immediate(messages);

      assertThat(immediate)
          .extracting(ImmediateMessage::content)
          .containsExactly("m3", "m4", "m5", "m6", "m7", "m8");
    }

    @Test
    @DisplayName("should cut an oversized message to the per-message ceiling")
    void shouldCutLongMessage() {
      List<ImmediateMessage> immediate =
          budget.immediate(List.of(message(MessageRole.ASSISTANT, "x".repeat(5000))));

      assertThat(immediate.get(0).content()).hasSize(3000).endsWith("...");
    }

    @Test
    @DisplayName("should drop the oldest messages only past the absolute ceiling")
    void shouldApplyHardCeiling() {
      memoryConfig.getContext().setImmediateHardCeilingChars(7000);
      List<RecentMessage> messages = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        messages.add(message(MessageRole.USER, String.valueOf(i).repeat(3000)));
      }

      List<ImmediateMessage> immediate = budget.immediate(messages);

      assertThat(immediate).hasSize(2);
      assertThat(immediate.get(1).content()).startsWith("3");
    }

    @Test
    @DisplayName("should return nothing for an empty conversation")
    void shouldHandleEmptyConversation() {
      assertThat(budget.immediate(List.of())).isEmpty();
    }
  }

  @Nested
  @DisplayName("fit")
  class Fit {

    @Test
    @DisplayName("should keep everything that fits")
    void shouldKeepEverythingWithinBudget() {
      LongTermSelection selection =
          budget.fit(
              List.of(new ImmediateMessage(MessageRole.USER, "hello")),
              List.of(memory("c1", "short"), memory("c2", "short")),
              List.of(document("d1", "short")));

      assertThat(selection.memories()).hasSize(2);
      assertThat(selection.documents()).hasSize(1);
    }

    @Test
    @DisplayName("should drop the lowest-ranked memories first")
    void shouldDropLowestRankedMemoriesFirst() {
      // 26 tokens immediate, 50 per memory, 25 for the document
      memoryConfig.getContext().setTokenBudget(160);
      List<ImmediateMessage> immediate =
          List.of(new ImmediateMessage(MessageRole.USER, "u".repeat(100)));

      LongTermSelection selection =
          budget.fit(
              immediate,
              List.of(
                  memory("best", "a".repeat(200)),
                  memory("middle", "b".repeat(200)),
                  memory("worst", "c".repeat(200))),
              List.of(document("d1", "d".repeat(100))));

      assertThat(selection.memories())
          .extracting(hit -> hit.record().getConversationId())
          .containsExactly("best", "middle");
      assertThat(selection.documents()).hasSize(1);
    }

    @Test
    @DisplayName("should drop documents from the last one once no memory is left")
    void shouldDropDocumentsAfterMemories() {
      memoryConfig.getContext().setTokenBudget(60);
      List<ImmediateMessage> immediate =
          List.of(new ImmediateMessage(MessageRole.USER, "u".repeat(100)));

      LongTermSelection selection =
          budget.fit(
              immediate,
              List.of(memory("c1", "a".repeat(200))),
              List.of(document("first", "d".repeat(100)), document("second", "e".repeat(100))));

      assertThat(selection.memories()).isEmpty();
      assertThat(selection.documents())
          .extracting(DocumentMemory::getDocumentId)
          .containsExactly("first");
    }

    @Test
    @DisplayName("should never drop immediate messages to meet the budget")
    void shouldNeverTouchImmediate() {
      memoryConfig.getContext().setTokenBudget(1);
      List<ImmediateMessage> immediate =
          List.of(new ImmediateMessage(MessageRole.USER, "u".repeat(400)));

      LongTermSelection selection =
          budget.fit(immediate, List.of(memory("c1", "summary")), List.of());

      assertThat(selection.memories()).isEmpty();
      assertThat(immediate).hasSize(1);
    }
  }

  @Test
  @DisplayName("should estimate four characters per token, rounding up")
  void shouldEstimateTokens() {
    assertThat(ContextBudget.estimateTokens("")).isZero();
    assertThat(ContextBudget.estimateTokens("abcd")).isEqualTo(1);
    assertThat(ContextBudget.estimateTokens("abcde")).isEqualTo(2);
  }

  private static RecentMessage message(MessageRole role, String content) {
    return new RecentMessage(role, content, LocalDateTime.now());
  }

  private static ScoredMemory<ConversationMemory> memory(String conversationId, String summary) {
    return new ScoredMemory<>(
        ConversationMemory.builder().conversationId(conversationId).summary(summary).build(), 0.9);
  }

  private static DocumentMemory document(String documentId, String summary) {
    return DocumentMemory.builder().documentId(documentId).summary(summary).build();
  }
}
