package com.flamingo.ai.contextmemory.service.sweep;

import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.exception.EmbeddingUnavailableException;
import com.flamingo.ai.contextmemory.exception.InvalidRecordException;
import com.flamingo.ai.contextmemory.exception.StoreUnavailableException;
import com.flamingo.ai.contextmemory.service.embedding.EmbeddingService;
import com.flamingo.ai.contextmemory.service.store.MemoryStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background job that embeds memories stored with {@code pendingEmbedding = true}.
 *
 * <p>Each run handles at most one batch per record kind. A run stops early as soon as the provider
 * is still unavailable; the remaining records are picked up by the next run.
 */
@Component
@ConditionalOnProperty(name = "memory.sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PendingEmbeddingSweeper {

  private final MemoryStore memoryStore;
  private final EmbeddingService embeddingService;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;

  @Scheduled(
      fixedDelayString = "${memory.sweep.interval:PT5M}",
      initialDelayString = "${memory.sweep.interval:PT5M}")
  public void scheduledSweep() {
    try {
      sweep();
    } catch (RuntimeException e) {
      log.error("Pending embedding sweep failed: {}", e.getMessage(), e);
    }
  }

  /**
   * Runs one sweep.
   *
   * @return number of records recovered
   */
  public int sweep() {
    int batchSize = memoryConfig.getSweep().getBatchSize();
    List<ConversationMemory> conversations = memoryStore.findPendingConversations(batchSize);
    List<DocumentMemory> documents = memoryStore.findPendingDocuments(batchSize);
    if (conversations.isEmpty() && documents.isEmpty()) {
      log.debug("No pending embeddings");
      return 0;
    }
    log.info(
        "Sweeping {} conversation and {} document memories with pending embeddings",
        conversations.size(),
        documents.size());

    int recovered = 0;
    try {
      for (ConversationMemory memory : conversations) {
        recovered += recoverConversation(memory);
      }
      for (DocumentMemory document : documents) {
        recovered += recoverDocument(document);
      }
    } catch (EmbeddingUnavailableException e) {
      log.warn("Embedding still unavailable, sweep stopped early: {}", e.getMessage());
    }

    meterRegistry.counter("memory.sweep.recovered").increment(recovered);
    log.info("Pending embedding sweep recovered {} records", recovered);
    return recovered;
  }

  private int recoverConversation(ConversationMemory memory) {
    float[] embedding = embeddingService.embed(memory.getSummary());
    try {
      return memoryStore.completeConversationEmbedding(
              memory.getConversationId(), memory.getSummary(), embedding)
          ? 1
          : 0;
    } catch (InvalidRecordException e) {
      meterRegistry.counter("memory.invalid_record").increment();
      log.warn(
          "Late embedding rejected for conversation {}: {}",
          memory.getConversationId(),
          e.getMessage());
      defer(() -> memoryStore.deferPendingConversation(memory.getConversationId()));
      return 0;
    }
  }

  private int recoverDocument(DocumentMemory document) {
    String input =
        document.getSummary() != null && !document.getSummary().isBlank()
            ? document.getSummary()
            : document.getFullContent();
    float[] embedding = embeddingService.embed(input);
    try {
      return memoryStore.completeDocumentEmbedding(document.getDocumentId(), embedding) ? 1 : 0;
    } catch (InvalidRecordException e) {
      meterRegistry.counter("memory.invalid_record").increment();
      log.warn(
          "Late embedding rejected for document {}: {}", document.getDocumentId(), e.getMessage());
      defer(() -> memoryStore.deferPendingDocument(document.getDocumentId()));
      return 0;
    }
  }

  private void defer(Runnable requeue) {
    try {
      requeue.run();
    } catch (StoreUnavailableException e) {
      log.warn("Could not requeue rejected record: {}", e.getMessage());
    }
  }
}
