package com.flamingo.ai.contextmemory.service.embedding;

import com.flamingo.ai.contextmemory.exception.EmbeddingUnavailableException;
import java.time.Duration;

/** Turns text into a fixed-length vector through the external embedding provider. */
public interface EmbeddingService {

  /**
   * Embeds text with the configured default timeout.
   *
   * @throws EmbeddingUnavailableException on provider error or timeout
   */
  float[] embed(String text);

  /**
   * Embeds text, giving up after {@code timeout}.
   *
   * @throws EmbeddingUnavailableException on provider error or timeout
   */
  float[] embed(String text, Duration timeout);

  /** Length every stored vector must have. */
  int dimensions();
}
