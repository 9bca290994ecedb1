package com.flamingo.ai.contextmemory.service.store;

import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.repository.ConversationMemoryRepository;
import com.flamingo.ai.contextmemory.domain.repository.DocumentConversationLinkRepository;
import com.flamingo.ai.contextmemory.domain.repository.DocumentMemoryRepository;
import com.flamingo.ai.contextmemory.exception.InvalidRecordException;
import com.flamingo.ai.contextmemory.exception.LinkConflictException;
import com.flamingo.ai.contextmemory.exception.StoreUnavailableException;
import com.flamingo.ai.contextmemory.service.embedding.EmbeddingService;
import com.flamingo.ai.contextmemory.service.search.MemoryVectorIndex;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Data-access facade over conversation and document memories.
 *
 * <p>Writes for one conversation id are serialized with a striped lock and run in their own
 * transaction, so concurrent writers for the same conversation cannot lose each other's merge.
 * Store failures surface as {@link StoreUnavailableException} after the {@code memoryStore} retry
 * is exhausted.
 */
@Component
@Slf4j
public class MemoryStore {

  private static final int LOCK_STRIPES = 64;

  private final ConversationMemoryRepository conversationRepository;
  private final DocumentMemoryRepository documentRepository;
  private final DocumentConversationLinkRepository linkRepository;
  private final MemoryVectorIndex vectorIndex;
  private final EmbeddingService embeddingService;
  private final TransactionTemplate transactionTemplate;
  private final Executor accessExecutor;
  private final Retry storeRetry;
  private final Striped<Lock> conversationLocks = Striped.lock(LOCK_STRIPES);

  public MemoryStore(
      ConversationMemoryRepository conversationRepository,
      DocumentMemoryRepository documentRepository,
      DocumentConversationLinkRepository linkRepository,
      MemoryVectorIndex vectorIndex,
      EmbeddingService embeddingService,
      TransactionTemplate transactionTemplate,
      @Qualifier("memoryAccessExecutor") Executor accessExecutor,
      RetryRegistry retryRegistry) {
    this.conversationRepository = conversationRepository;
    this.documentRepository = documentRepository;
    this.linkRepository = linkRepository;
    this.vectorIndex = vectorIndex;
    this.embeddingService = embeddingService;
    this.transactionTemplate = transactionTemplate;
    this.accessExecutor = accessExecutor;
    this.storeRetry = retryRegistry.retry("memoryStore");
  }

  // ---- conversation memories ----

  public Optional<ConversationMemory> findConversation(String conversationId) {
    return read(() -> conversationRepository.findByConversationId(conversationId));
  }

  public List<ConversationMemory> findConversations(Collection<String> conversationIds) {
    if (conversationIds.isEmpty()) {
      return List.of();
    }
    return read(() -> conversationRepository.findByConversationIdIn(conversationIds));
  }

  public List<ConversationMemory> listConversations(String userId) {
    return read(() -> conversationRepository.findByUserIdOrderByImportanceDescEndTimeDesc(userId));
  }

  /**
   * Inserts or merges the memory of one conversation while holding that conversation's lock.
   *
   * @param merge receives the stored record, or {@code null} when there is none, and returns the
   *     record to persist
   * @throws InvalidRecordException if the merged record is malformed; never retried
   */
  public ConversationMemory upsertConversation(
      String conversationId, Function<ConversationMemory, ConversationMemory> merge) {
    ConversationMemory saved =
        write(
            () -> {
              Lock lock = conversationLocks.get(conversationId);
              lock.lock();
              try {
                return transactionTemplate.execute(
                    status -> {
                      ConversationMemory existing =
                          conversationRepository.findByConversationId(conversationId).orElse(null);
                      // the merge may update the stored entity in place
                      String storedOwner = existing != null ? existing.getUserId() : null;
                      ConversationMemory merged = merge.apply(existing);
                      validate(merged, storedOwner);
                      return conversationRepository.save(merged);
                    });
              } finally {
                lock.unlock();
              }
            });
    syncIndex(saved);
    return saved;
  }

  public List<ConversationMemory> findPendingConversations(int batchSize) {
    return read(() -> conversationRepository.findPendingEmbedding(PageRequest.of(0, batchSize)));
  }

  /**
   * Stores a late embedding and clears the pending flag, unless the memory was rewritten since the
   * embedded summary was read.
   *
   * @return true if the embedding was stored
   */
  public boolean completeConversationEmbedding(
      String conversationId, String embeddedSummary, float[] embedding) {
    if (findConversation(conversationId).isEmpty()) {
      return false;
    }
    boolean[] applied = {false};
    upsertConversation(
        conversationId,
        existing -> {
          if (existing == null) {
            throw new InvalidRecordException(conversationId, "Memory vanished during update");
          }
          applied[0] =
              existing.isPendingEmbedding() && existing.getSummary().equals(embeddedSummary);
          if (applied[0]) {
            existing.setEmbedding(embedding);
            existing.setPendingEmbedding(false);
          }
          return existing;
        });
    return applied[0];
  }

  /** Requeues a pending memory whose late embedding was rejected behind the other pending ones. */
  public void deferPendingConversation(String conversationId) {
    write(
        () ->
            transactionTemplate.execute(
                status ->
                    conversationRepository.touchPending(conversationId, LocalDateTime.now())));
  }

  // ---- document memories ----

  public Optional<DocumentMemory> findDocument(String documentId) {
    return read(() -> documentRepository.findByDocumentId(documentId));
  }

  public List<DocumentMemory> findDocuments(Collection<String> documentIds) {
    if (documentIds.isEmpty()) {
      return List.of();
    }
    return read(() -> documentRepository.findByDocumentIdIn(documentIds));
  }

  public DocumentMemory saveDocument(DocumentMemory document) {
    validate(document);
    DocumentMemory saved =
        write(() -> transactionTemplate.execute(status -> documentRepository.save(document)));
    syncIndex(saved);
    return saved;
  }

  public List<DocumentMemory> findPendingDocuments(int batchSize) {
    return read(() -> documentRepository.findPendingEmbedding(PageRequest.of(0, batchSize)));
  }

  /** Stores a late document embedding if the document is still pending. */
  public boolean completeDocumentEmbedding(String documentId, float[] embedding) {
    DocumentMemory saved =
        write(
            () ->
                transactionTemplate.execute(
                    status ->
                        documentRepository
                            .findByDocumentId(documentId)
                            .filter(DocumentMemory::isPendingEmbedding)
                            .map(
                                document -> {
                                  document.setEmbedding(embedding);
                                  document.setPendingEmbedding(false);
                                  validate(document);
                                  return documentRepository.save(document);
                                })
                            .orElse(null)));
    if (saved == null) {
      return false;
    }
    syncIndex(saved);
    return true;
  }

  public void deferPendingDocument(String documentId) {
    write(
        () ->
            transactionTemplate.execute(
                status -> documentRepository.touchPending(documentId, LocalDateTime.now())));
  }

  // ---- links ----

  /**
   * Appends the (document, conversation) link in one storage-level statement.
   *
   * @return true when the link was new
   * @throws LinkConflictException when a concurrent append of the same pair won the race
   */
  public boolean appendLink(String documentId, String conversationId, String userId) {
    try {
      Integer inserted =
          transactionTemplate.execute(
              status ->
                  linkRepository.insertIfAbsent(
                      documentId, conversationId, userId, LocalDateTime.now()));
      return inserted != null && inserted > 0;
    } catch (DataIntegrityViolationException e) {
      throw new LinkConflictException(documentId, conversationId, e);
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Failed to link document " + documentId, e);
    }
  }

  public List<String> linkedConversationIds(String documentId) {
    return read(() -> linkRepository.findConversationIds(documentId));
  }

  // ---- access bookkeeping ----

  /** Increments a document's access count in place and refreshes {@code lastAccessed}. */
  public void recordDocumentAccess(String documentId) {
    write(
        () ->
            transactionTemplate.execute(
                status ->
                    documentRepository.incrementAccessCount(
                        List.of(documentId), LocalDateTime.now())));
  }

  /** Fire-and-forget access bump for retrieved conversation memories. */
  public void recordConversationAccessAsync(Collection<String> conversationIds) {
    if (conversationIds.isEmpty()) {
      return;
    }
    List<String> ids = List.copyOf(conversationIds);
    dispatchAccess(
        () ->
            transactionTemplate.execute(
                status -> conversationRepository.incrementAccessCount(ids, LocalDateTime.now())),
        "conversations " + ids);
  }

  /** Fire-and-forget access bump for read documents. */
  public void recordDocumentAccessAsync(Collection<String> documentIds) {
    if (documentIds.isEmpty()) {
      return;
    }
    List<String> ids = List.copyOf(documentIds);
    dispatchAccess(
        () ->
            transactionTemplate.execute(
                status -> documentRepository.incrementAccessCount(ids, LocalDateTime.now())),
        "documents " + ids);
  }

  private void dispatchAccess(Runnable update, String target) {
    try {
      accessExecutor.execute(
          () -> {
            try {
              update.run();
            } catch (RuntimeException e) {
              log.debug("Access count update lost for {}: {}", target, e.getMessage());
            }
          });
    } catch (RuntimeException e) {
      log.debug("Access count update rejected for {}: {}", target, e.getMessage());
    }
  }

  // ---- internals ----

  @VisibleForTesting
  void validate(ConversationMemory memory, String storedOwner) {
    String key = memory.getConversationId();
    if (key == null || key.isBlank()) {
      throw new InvalidRecordException("<none>", "Conversation memory without conversation id");
    }
    if (memory.getUserId() == null || memory.getUserId().isBlank()) {
      throw new InvalidRecordException(key, "Conversation memory without owner");
    }
    if (storedOwner != null && !storedOwner.equals(memory.getUserId())) {
      throw new InvalidRecordException(key, "Conversation memory owner cannot change");
    }
    if (memory.getSummary() == null || memory.getSummary().isBlank()) {
      throw new InvalidRecordException(key, "Conversation memory without summary");
    }
    if (memory.getImportance() < 0.0 || memory.getImportance() > 1.0) {
      throw new InvalidRecordException(key, "Importance out of range: " + memory.getImportance());
    }
    validateEmbedding(key, memory.getEmbedding());
  }

  @VisibleForTesting
  void validate(DocumentMemory document) {
    String key = document.getDocumentId();
    if (key == null || key.isBlank()) {
      throw new InvalidRecordException("<none>", "Document memory without document id");
    }
    if (document.getUserId() == null || document.getUserId().isBlank()) {
      throw new InvalidRecordException(key, "Document memory without owner");
    }
    if (document.getFullContent() == null) {
      throw new InvalidRecordException(key, "Document memory without content");
    }
    validateEmbedding(key, document.getEmbedding());
  }

  private void validateEmbedding(String key, float[] embedding) {
    if (embedding != null && embedding.length != embeddingService.dimensions()) {
      throw new InvalidRecordException(
          key,
          String.format(
              "Embedding length %d, expected %d", embedding.length, embeddingService.dimensions()));
    }
  }

  private void syncIndex(ConversationMemory memory) {
    if (memory == null || !memory.isSearchable()) {
      return;
    }
    try {
      vectorIndex.upsert(memory);
    } catch (RuntimeException e) {
      log.warn(
          "Vector index update failed for conversation {}: {}",
          memory.getConversationId(),
          e.getMessage());
    }
  }

  private void syncIndex(DocumentMemory document) {
    if (document == null || !document.isSearchable()) {
      return;
    }
    try {
      vectorIndex.upsert(document);
    } catch (RuntimeException e) {
      log.warn(
          "Vector index update failed for document {}: {}",
          document.getDocumentId(),
          e.getMessage());
    }
  }

  private <T> T read(Supplier<T> query) {
    try {
      return query.get();
    } catch (DataAccessException | TransactionException e) {
      throw new StoreUnavailableException("Memory store read failed: " + e.getMessage(), e);
    }
  }

  private <T> T write(Supplier<T> operation) {
    return Retry.decorateSupplier(
            storeRetry,
            () -> {
              try {
                return operation.get();
              } catch (DataAccessException | TransactionException e) {
                throw new StoreUnavailableException(
                    "Memory store write failed: " + e.getMessage(), e);
              }
            })
        .get();
  }
}
