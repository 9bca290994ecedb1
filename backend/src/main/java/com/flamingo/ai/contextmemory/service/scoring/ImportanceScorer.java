package com.flamingo.ai.contextmemory.service.scoring;

import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Scores how worth keeping a conversation memory is. Pure function of the record's shape: no
 * clock, no randomness, no external calls.
 *
 * <pre>
 * importance = clamp01(w1 * min(messages / K1, 1)
 *                    + w2 * [has documents]
 *                    + w3 * [has artifacts]
 *                    + w4 * min(keyPoints / K2, 1))
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class ImportanceScorer {

  private final MemoryConfig memoryConfig;

  public double score(ConversationMemory memory) {
    return score(
        memory.getMessageCount(),
        !memory.getDocumentIds().isEmpty(),
        !memory.getArtifactRefs().isEmpty(),
        memory.getKeyPoints().size());
  }

  public double score(
      int messageCount, boolean hasDocuments, boolean hasArtifacts, int keyPointCount) {
    MemoryConfig.Scoring weights = memoryConfig.getScoring();
    double raw =
        weights.getMessageWeight() * saturate(messageCount, weights.getMessageSaturation())
            + weights.getDocumentWeight() * indicator(hasDocuments)
            + weights.getArtifactWeight() * indicator(hasArtifacts)
            + weights.getKeyPointWeight()
                * saturate(keyPointCount, weights.getKeyPointSaturation());
    return clamp01(raw);
  }

  static double saturate(int count, int saturationPoint) {
    if (count <= 0) {
      return 0.0;
    }
    return Math.min((double) count / saturationPoint, 1.0);
  }

  private static double indicator(boolean flag) {
    return flag ? 1.0 : 0.0;
  }

  private static double clamp01(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
