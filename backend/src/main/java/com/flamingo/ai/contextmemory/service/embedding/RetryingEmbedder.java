package com.flamingo.ai.contextmemory.service.embedding;

import com.flamingo.ai.contextmemory.exception.EmbeddingUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Embeds text for the write paths with the bounded exponential backoff of the {@code embedding}
 * retry instance. An empty result means the caller should persist the record as pending.
 */
@Component
@Slf4j
public class RetryingEmbedder {

  private final EmbeddingService embeddingService;
  private final Retry embeddingRetry;

  public RetryingEmbedder(EmbeddingService embeddingService, RetryRegistry retryRegistry) {
    this.embeddingService = embeddingService;
    this.embeddingRetry = retryRegistry.retry("embedding");
  }

  public Optional<float[]> tryEmbed(String text, String recordKey) {
    try {
      return Optional.of(
          Retry.decorateSupplier(embeddingRetry, () -> embeddingService.embed(text)).get());
    } catch (EmbeddingUnavailableException e) {
      log.warn(
          "Embedding unavailable for {} after {} attempts: {}",
          recordKey,
          embeddingRetry.getRetryConfig().getMaxAttempts(),
          e.getMessage());
      return Optional.empty();
    }
  }
}
