package com.flamingo.ai.contextmemory.service.linker;

import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.exception.DocumentNotFoundException;
import com.flamingo.ai.contextmemory.exception.LinkConflictException;
import com.flamingo.ai.contextmemory.exception.MemoryAccessDeniedException;
import com.flamingo.ai.contextmemory.service.store.MemoryStore;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Maintains which conversations referenced which documents.
 *
 * <p>{@link #link} is idempotent: the append happens at the storage layer and only if the pair is
 * absent, so concurrent turns on the same document never drop each other's conversation id. Each
 * call counts as one access of the document.
 */
@Service
@Slf4j
public class DocumentLinkService {

  private final MemoryStore memoryStore;
  private final MeterRegistry meterRegistry;
  private final Retry linkRetry;

  public DocumentLinkService(
      MemoryStore memoryStore, MeterRegistry meterRegistry, RetryRegistry retryRegistry) {
    this.memoryStore = memoryStore;
    this.meterRegistry = meterRegistry;
    this.linkRetry = retryRegistry.retry("documentLink");
  }

  /**
   * Links a conversation to a document and bumps the document's access count.
   *
   * @return true if the conversation was not linked before
   * @throws DocumentNotFoundException if the document was never ingested
   * @throws MemoryAccessDeniedException if the document belongs to another user
   */
  public boolean link(String documentId, String conversationId, String userId) {
    DocumentMemory document =
        memoryStore
            .findDocument(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    if (!document.getUserId().equals(userId)) {
      throw new MemoryAccessDeniedException(userId, documentId);
    }

    boolean appended;
    try {
      appended =
          Retry.decorateSupplier(
                  linkRetry,
                  () -> {
                    try {
                      return memoryStore.appendLink(documentId, conversationId, userId);
                    } catch (LinkConflictException e) {
                      meterRegistry.counter("document.link.conflict").increment();
                      log.debug(
                          "Link conflict on document {} / conversation {}, retrying",
                          documentId,
                          conversationId);
                      throw e;
                    }
                  })
              .get();
    } catch (LinkConflictException e) {
      // every attempt lost to a concurrent insert of the same pair, so the link exists
      log.warn(
          "Link of document {} to conversation {} kept conflicting: {}",
          documentId,
          conversationId,
          e.getMessage());
      appended = false;
    }

    memoryStore.recordDocumentAccess(documentId);
    meterRegistry.counter("document.linked", "new", String.valueOf(appended)).increment();
    if (appended) {
      log.info("Linked document {} to conversation {}", documentId, conversationId);
    } else {
      log.debug("Document {} already linked to conversation {}", documentId, conversationId);
    }
    return appended;
  }
}
