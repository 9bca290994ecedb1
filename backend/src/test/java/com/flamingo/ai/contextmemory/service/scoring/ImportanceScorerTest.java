package com.flamingo.ai.contextmemory.service.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ImportanceScorerTest {

  private MemoryConfig memoryConfig;
  private ImportanceScorer scorer;

  @BeforeEach
  void setUp() {
    memoryConfig = new MemoryConfig();
    scorer = new ImportanceScorer(memoryConfig);
  }

  @Test
  @DisplayName("should return the same score for the same input")
  void shouldBeDeterministic() {
    double first = scorer.score(7, true, false, 3);
    for (int i = 0; i < 10; i++) {
      assertThat(scorer.score(7, true, false, 3)).isEqualTo(first);
    }
  }

  @Test
  @DisplayName("should score an empty turn as zero")
  void shouldScoreEmptyTurnAsZero() {
    assertThat(scorer.score(0, false, false, 0)).isZero();
  }

  @Test
  @DisplayName("should reach exactly one when every term saturates")
  void shouldReachOneWhenSaturated() {
    assertThat(scorer.score(20, true, true, 8)).isCloseTo(1.0, within(1e-9));
  }

  @Test
  @DisplayName("should weigh each term as configured")
  void shouldWeighTerms() {
    // 10 of 20 messages, documents present, no artifacts, 4 of 8 key points
    double expected = 0.35 * 0.5 + 0.2 + 0.3 * 0.5;

    assertThat(scorer.score(10, true, false, 4)).isCloseTo(expected, within(1e-9));
  }

  @Nested
  @DisplayName("saturation")
  class Saturation {

    @Test
    @DisplayName("should stop growing past the saturation point")
    void shouldNotGrowPastSaturation() {
      assertThat(scorer.score(500, false, false, 0)).isEqualTo(scorer.score(20, false, false, 0));
    }

    @Test
    @DisplayName("should treat negative counts as zero")
    void shouldTreatNegativeAsZero() {
      assertThat(ImportanceScorer.saturate(-3, 10)).isZero();
    }

    @Test
    @DisplayName("should stay within [0, 1] for any input")
    void shouldStayBounded() {
      for (int messages = 0; messages < 60; messages += 7) {
        for (int keyPoints = 0; keyPoints < 20; keyPoints += 3) {
          assertThat(scorer.score(messages, true, true, keyPoints)).isBetween(0.0, 1.0);
        }
      }
    }
  }

  @Test
  @DisplayName("should score a memory from its message, document, artifact and key point counts")
  void shouldScoreMemory() {
    ConversationMemory memory =
        ConversationMemory.builder()
            .messageCount(20)
            .documentIds(new ArrayList<>(List.of("doc-1")))
            .artifactRefs(new ArrayList<>())
            .keyPoints(new ArrayList<>(List.of("a", "b", "c", "d", "e", "f", "g", "h")))
            .build();

    assertThat(scorer.score(memory)).isCloseTo(0.35 + 0.2 + 0.3, within(1e-9));
  }

  @Test
  @DisplayName("should follow configured weights")
  void shouldFollowConfiguredWeights() {
    memoryConfig.getScoring().setMessageWeight(1.0);
    memoryConfig.getScoring().setDocumentWeight(0.0);
    memoryConfig.getScoring().setArtifactWeight(0.0);
    memoryConfig.getScoring().setKeyPointWeight(0.0);

    assertThat(scorer.score(5, true, true, 8)).isCloseTo(0.25, within(1e-9));
  }
}
