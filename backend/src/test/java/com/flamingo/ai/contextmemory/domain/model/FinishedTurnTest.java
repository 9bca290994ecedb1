package com.flamingo.ai.contextmemory.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.contextmemory.domain.enums.MessageRole;
import java.time.LocalDateTime;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FinishedTurnTest {

  @Test
  @DisplayName("a finished turn should drop null ids and messages")
  void finishedTurnShouldDropNulls() {
    RecentMessage message = new RecentMessage(MessageRole.USER, "hi", LocalDateTime.now());

    FinishedTurn turn =
        new FinishedTurn(
            "u1",
            "C1",
            null,
            Arrays.asList(message, null),
            Arrays.asList("D1", null),
            Arrays.asList(null, "quiz-1"),
            null,
            null,
            LocalDateTime.now());

    assertThat(turn.transcript()).containsExactly(message);
    assertThat(turn.documentIds()).containsExactly("D1");
    assertThat(turn.artifactRefs()).containsExactly("quiz-1");
  }

  @Test
  @DisplayName("a context query should drop null attached ids and tolerate missing lists")
  void contextQueryShouldDropNulls() {
    ContextQuery query =
        new ContextQuery("u1", "C1", null, "hi", Arrays.asList(null, "D2"), true, 0, null);

    assertThat(query.attachedDocumentIds()).containsExactly("D2");
    assertThat(query.recentMessages()).isEmpty();
  }
}
