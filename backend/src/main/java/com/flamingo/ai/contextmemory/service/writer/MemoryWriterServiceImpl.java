package com.flamingo.ai.contextmemory.service.writer;

import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.domain.model.FinishedTurn;
import com.flamingo.ai.contextmemory.domain.model.RecentMessage;
import com.flamingo.ai.contextmemory.domain.model.TurnSummary;
import com.flamingo.ai.contextmemory.exception.DocumentNotFoundException;
import com.flamingo.ai.contextmemory.exception.InvalidRecordException;
import com.flamingo.ai.contextmemory.exception.MemoryAccessDeniedException;
import com.flamingo.ai.contextmemory.service.embedding.RetryingEmbedder;
import com.flamingo.ai.contextmemory.service.linker.DocumentLinkService;
import com.flamingo.ai.contextmemory.service.preferences.UserPreferencesService;
import com.flamingo.ai.contextmemory.service.scoring.ImportanceScorer;
import com.flamingo.ai.contextmemory.service.session.SessionStateService;
import com.flamingo.ai.contextmemory.service.store.MemoryStore;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Out-of-band persistence of finished turns.
 *
 * <p>Pipeline per turn: summarize, embed (bounded retry, pending on exhaustion), score, upsert
 * keyed by conversation id, link referenced documents, then record preference and session
 * signals. Only the upsert decides whether the turn is remembered; the later steps are
 * best-effort.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryWriterServiceImpl implements MemoryWriterService {

  private final TurnSummarizer turnSummarizer;
  private final RetryingEmbedder retryingEmbedder;
  private final ImportanceScorer importanceScorer;
  private final MemoryStore memoryStore;
  private final DocumentLinkService documentLinkService;
  private final UserPreferencesService userPreferencesService;
  private final SessionStateService sessionStateService;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Async("memoryWriterExecutor")
  public CompletableFuture<Optional<ConversationMemory>> writeAsync(FinishedTurn turn) {
    return CompletableFuture.completedFuture(write(turn));
  }

  @Override
  @Timed(value = "memory.write", description = "Time to persist a finished turn")
  public Optional<ConversationMemory> write(FinishedTurn turn) {
    if (!memoryConfig.isEnabled()) {
      log.debug("Memory disabled, not persisting conversation {}", turn.conversationId());
      return Optional.empty();
    }

    Optional<ConversationMemory> persisted = persist(turn);
    if (persisted.isEmpty()) {
      return persisted;
    }

    linkDocuments(turn);
    recordSignals(turn);
    return persisted;
  }

  private Optional<ConversationMemory> persist(FinishedTurn turn) {
    String conversationId = turn.conversationId();
    try {
      requireIdentity(turn);
      TurnSummary summary = turnSummarizer.summarize(turn.transcript());
      Optional<float[]> embedding =
          retryingEmbedder.tryEmbed(summary.summary(), "conversation " + conversationId);

      ConversationMemory saved =
          memoryStore.upsertConversation(
              conversationId, existing -> merge(existing, turn, summary, embedding.orElse(null)));

      meterRegistry.counter("memory.written").increment();
      if (saved.isPendingEmbedding()) {
        meterRegistry.counter("memory.pending_embedding", "kind", "conversation").increment();
      }
      log.info(
          "Persisted memory for conversation {} (messages={}, importance={}, pendingEmbedding={})",
          conversationId,
          saved.getMessageCount(),
          String.format("%.3f", saved.getImportance()),
          saved.isPendingEmbedding());
      return Optional.of(saved);
    } catch (InvalidRecordException e) {
      meterRegistry.counter("memory.invalid_record").increment();
      log.warn("Rejected memory for conversation {}: {}", conversationId, e.getMessage());
      return Optional.empty();
    } catch (RuntimeException e) {
      meterRegistry.counter("memory.write.lost").increment();
      log.error(
          "Memory for conversation {} lost after retries: {}", conversationId, e.getMessage(), e);
      return Optional.empty();
    }
  }

  /**
   * Builds the record to store: a fresh one for a new conversation, otherwise the stored one with
   * key points and decisions merged in order and timestamps refreshed. A turn that finished before
   * the stored one only contributes its key points, decisions, documents and artifacts.
   */
  @VisibleForTesting
  ConversationMemory merge(
      ConversationMemory existing, FinishedTurn turn, TurnSummary summary, float[] embedding) {
    LocalDateTime finishedAt = turn.finishedAt() != null ? turn.finishedAt() : LocalDateTime.now();
    ConversationMemory memory = existing;
    if (memory == null) {
      memory =
          ConversationMemory.builder()
              .userId(turn.userId())
              .conversationId(turn.conversationId())
              .startTime(startOf(turn, finishedAt))
              .build();
    } else if (memory.getStartTime() == null) {
      memory.setStartTime(startOf(turn, finishedAt));
    }

    memory.setUserId(turn.userId());
    memory.setKeyPoints(union(memory.getKeyPoints(), summary.keyPoints()));
    memory.setDecisions(union(memory.getDecisions(), summary.decisions()));
    memory.setDocumentIds(union(memory.getDocumentIds(), turn.documentIds()));
    memory.setArtifactRefs(union(memory.getArtifactRefs(), turn.artifactRefs()));

    if (existing != null && isOlderThanStored(existing, turn, finishedAt)) {
      log.debug(
          "Turn of conversation {} finished before the stored one, keeping the stored summary",
          turn.conversationId());
      memory.setImportance(importanceScorer.score(memory));
      return memory;
    }

    if (turn.sessionId() != null) {
      memory.setSessionId(turn.sessionId());
    }
    memory.setSummary(summary.summary());
    memory.setMessageCount(turn.transcript().size());
    memory.setEndTime(finishedAt);
    memory.setEmbedding(embedding);
    memory.setPendingEmbedding(embedding == null);
    memory.setImportance(importanceScorer.score(memory));
    return memory;
  }

  private void linkDocuments(FinishedTurn turn) {
    for (String documentId : new LinkedHashSet<>(turn.documentIds())) {
      try {
        documentLinkService.link(documentId, turn.conversationId(), turn.userId());
      } catch (DocumentNotFoundException | MemoryAccessDeniedException e) {
        log.warn(
            "Not linking document {} to conversation {}: {}",
            documentId,
            turn.conversationId(),
            e.getMessage());
      } catch (RuntimeException e) {
        log.warn(
            "Linking document {} to conversation {} failed: {}",
            documentId,
            turn.conversationId(),
            e.getMessage());
      }
    }
  }

  private void recordSignals(FinishedTurn turn) {
    try {
      userPreferencesService.recordQuestionType(turn.userId(), turn.questionType());
    } catch (RuntimeException e) {
      log.warn("Could not record question type for user {}: {}", turn.userId(), e.getMessage());
    }
    try {
      sessionStateService.markDocumentsActive(
          turn.userId(), turn.sessionId(), turn.documentIds());
    } catch (RuntimeException e) {
      log.warn("Could not update session {} state: {}", turn.sessionId(), e.getMessage());
    }
  }

  private static void requireIdentity(FinishedTurn turn) {
    if (turn.conversationId() == null || turn.conversationId().isBlank()) {
      throw new InvalidRecordException("<none>", "Finished turn without conversation id");
    }
    if (turn.userId() == null || turn.userId().isBlank()) {
      throw new InvalidRecordException(turn.conversationId(), "Finished turn without user id");
    }
    if (turn.transcript().isEmpty()) {
      throw new InvalidRecordException(turn.conversationId(), "Finished turn without messages");
    }
  }

  private static boolean isOlderThanStored(
      ConversationMemory stored, FinishedTurn turn, LocalDateTime finishedAt) {
    if (stored.getMessageCount() > turn.transcript().size()) {
      return true;
    }
    return stored.getEndTime() != null && stored.getEndTime().isAfter(finishedAt);
  }

  private static LocalDateTime startOf(FinishedTurn turn, LocalDateTime fallback) {
    if (turn.startedAt() != null) {
      return turn.startedAt();
    }
    return turn.transcript().stream()
        .map(RecentMessage::timestamp)
        .filter(Objects::nonNull)
        .min(LocalDateTime::compareTo)
        .orElse(fallback);
  }

  private static List<String> union(Collection<String> current, Collection<String> added) {
    LinkedHashSet<String> merged = new LinkedHashSet<>(current);
    merged.addAll(added);
    return new ArrayList<>(merged);
  }
}
