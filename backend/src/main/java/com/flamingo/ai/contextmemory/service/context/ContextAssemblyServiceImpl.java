package com.flamingo.ai.contextmemory.service.context;

import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.enums.MemoryKind;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.ImmediateMessage;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.LinkedDocument;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.LongTerm;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.PreferenceSnapshot;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.RelevantMemory;
import com.flamingo.ai.contextmemory.domain.model.ContextQuery;
import com.flamingo.ai.contextmemory.domain.model.ScoredMemory;
import com.flamingo.ai.contextmemory.domain.model.SimilarityQuery;
import com.flamingo.ai.contextmemory.service.context.ContextBudget.LongTermSelection;
import com.flamingo.ai.contextmemory.service.document.DocumentMemoryService;
import com.flamingo.ai.contextmemory.service.embedding.EmbeddingService;
import com.flamingo.ai.contextmemory.service.preferences.UserPreferencesService;
import com.flamingo.ai.contextmemory.service.search.SimilaritySearchService;
import com.flamingo.ai.contextmemory.service.session.SessionStateService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Context assembler. Memory search, preferences and linked documents are looked up in parallel on
 * the {@code contextAssemblyExecutor}; the synthesis call is the join point. One deadline bounds
 * the whole assembly.
 */
@Service
@Slf4j
public class ContextAssemblyServiceImpl implements ContextAssemblyService {

  private final EmbeddingService embeddingService;
  private final SimilaritySearchService similaritySearchService;
  private final DocumentMemoryService documentMemoryService;
  private final UserPreferencesService userPreferencesService;
  private final SessionStateService sessionStateService;
  private final ContextBudget contextBudget;
  private final ContextSynthesizer contextSynthesizer;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;
  private final Executor contextAssemblyExecutor;

  public ContextAssemblyServiceImpl(
      EmbeddingService embeddingService,
      SimilaritySearchService similaritySearchService,
      DocumentMemoryService documentMemoryService,
      UserPreferencesService userPreferencesService,
      SessionStateService sessionStateService,
      ContextBudget contextBudget,
      ContextSynthesizer contextSynthesizer,
      MemoryConfig memoryConfig,
      MeterRegistry meterRegistry,
      @Qualifier("contextAssemblyExecutor") Executor contextAssemblyExecutor) {
    this.embeddingService = embeddingService;
    this.similaritySearchService = similaritySearchService;
    this.documentMemoryService = documentMemoryService;
    this.userPreferencesService = userPreferencesService;
    this.sessionStateService = sessionStateService;
    this.contextBudget = contextBudget;
    this.contextSynthesizer = contextSynthesizer;
    this.memoryConfig = memoryConfig;
    this.meterRegistry = meterRegistry;
    this.contextAssemblyExecutor = contextAssemblyExecutor;
  }

  @Override
  @Timed(value = "context.assemble", description = "Time to assemble a turn context")
  public AssembledContext assemble(ContextQuery query) {
    if (query.userId() == null || query.userId().isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
    MemoryConfig.Context settings = memoryConfig.getContext();
    Fanout fanout = new Fanout(System.nanoTime() + settings.getTimeout().toNanos());

    boolean retrieval = memoryConfig.isEnabled();
    boolean semantic = retrieval && query.enableMemory();

    Future<List<ScoredMemory<ConversationMemory>>> memoriesTask =
        semantic ? fanout.submit(() -> searchMemories(query, fanout.deadlineNanos)) : null;
    Future<PreferenceSnapshot> preferencesTask =
        retrieval
            ? fanout.submit(() -> userPreferencesService.getPreferences(query.userId()))
            : null;
    Future<List<DocumentMemory>> documentsTask =
        retrieval ? fanout.submit(() -> linkedDocuments(query)) : null;

    List<ImmediateMessage> immediate = contextBudget.immediate(query.recentMessages());

    List<ScoredMemory<ConversationMemory>> memories =
        fanout.await(memoriesTask, List.of(), "memory search");
    PreferenceSnapshot preferences =
        fanout.await(preferencesTask, PreferenceSnapshot.empty(), "preferences");
    List<DocumentMemory> documents = fanout.await(documentsTask, List.of(), "linked documents");

    if (!immediate.isEmpty() && query.conversationId() != null) {
      memories =
          memories.stream()
              .filter(hit -> !query.conversationId().equals(hit.record().getConversationId()))
              .toList();
    }
    LongTermSelection selection = contextBudget.fit(immediate, memories, documents);
    LongTerm longTerm =
        new LongTerm(
            selection.memories().stream().map(ContextAssemblyServiceImpl::toRelevant).toList(),
            selection.documents().stream().map(ContextAssemblyServiceImpl::toLinked).toList(),
            preferences);

    String currentMessage = query.currentMessageText();
    String synthesized = "";
    if (semantic) {
      synthesized =
          settings.isSynthesisEnabled() && !fanout.interrupted
              ? synthesizeWithin(fanout.deadlineNanos, currentMessage, immediate, longTerm)
              : contextSynthesizer.digest(currentMessage, immediate, longTerm);
    }

    if (fanout.degraded) {
      meterRegistry.counter("context.degraded").increment();
    }
    log.debug(
        "Assembled context for user {} conversation {}: {} immediate, {} memories, {} documents,"
            + " degraded={}",
        query.userId(),
        query.conversationId(),
        immediate.size(),
        longTerm.relevantMemories().size(),
        longTerm.linkedDocuments().size(),
        fanout.degraded);
    return new AssembledContext(immediate, longTerm, synthesized, fanout.degraded);
  }

  private List<ScoredMemory<ConversationMemory>> searchMemories(
      ContextQuery query, long deadlineNanos) {
    String text = query.currentMessageText();
    if (text == null || text.isBlank()) {
      return List.of();
    }
    Duration remaining = Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
    Duration timeout = min(memoryConfig.getEmbedding().getTimeout(), remaining);
    float[] vector = embeddingService.embed(text, timeout);
    SimilarityQuery similarityQuery =
        similaritySearchService.defaultQuery(
            vector, query.userId(), MemoryKind.CONVERSATION, query.memoryDepthDays());
    return similaritySearchService.searchConversations(similarityQuery);
  }

  private List<DocumentMemory> linkedDocuments(ContextQuery query) {
    Set<String> documentIds = new LinkedHashSet<>(query.attachedDocumentIds());
    if (query.sessionId() != null) {
      sessionStateService
          .findActive(query.userId(), query.sessionId())
          .ifPresent(state -> documentIds.addAll(state.getActiveDocumentIds()));
    }
    if (documentIds.isEmpty()) {
      return List.of();
    }
    return documentMemoryService.findLinkedDocuments(query.userId(), documentIds);
  }

  private String synthesizeWithin(
      long deadlineNanos,
      String currentMessage,
      List<ImmediateMessage> immediate,
      LongTerm longTerm) {
    long remaining = deadlineNanos - System.nanoTime();
    if (remaining <= 0) {
      return digestAfterFailure("deadline already spent", currentMessage, immediate, longTerm);
    }
    FutureTask<String> task =
        new FutureTask<>(() -> contextSynthesizer.synthesize(currentMessage, immediate, longTerm));
    try {
      contextAssemblyExecutor.execute(task);
      String briefing = task.get(remaining, TimeUnit.NANOSECONDS);
      return briefing == null ? "" : briefing;
    } catch (TimeoutException e) {
      task.cancel(true);
      return digestAfterFailure("timed out", currentMessage, immediate, longTerm);
    } catch (ExecutionException | RejectedExecutionException e) {
      return digestAfterFailure(e.toString(), currentMessage, immediate, longTerm);
    } catch (InterruptedException e) {
      task.cancel(true);
      Thread.currentThread().interrupt();
      return contextSynthesizer.digest(currentMessage, immediate, longTerm);
    }
  }

  private String digestAfterFailure(
      String reason, String currentMessage, List<ImmediateMessage> immediate, LongTerm longTerm) {
    log.warn("Context synthesis skipped ({}), using digest", reason);
    meterRegistry.counter("context.synthesis.fallback").increment();
    return contextSynthesizer.digest(currentMessage, immediate, longTerm);
  }

  private static RelevantMemory toRelevant(ScoredMemory<ConversationMemory> hit) {
    ConversationMemory memory = hit.record();
    return new RelevantMemory(
        memory.getConversationId(), memory.getSummary(), hit.similarity(), memory.getImportance());
  }

  private static LinkedDocument toLinked(DocumentMemory document) {
    return new LinkedDocument(document.getDocumentId(), document.getSummary(), document.recency());
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  /** Sub-lookups of one assembly, sharing its deadline. */
  private final class Fanout {

    private final long deadlineNanos;
    private final List<Future<?>> tasks = new ArrayList<>();
    private boolean degraded;
    private boolean interrupted;

    private Fanout(long deadlineNanos) {
      this.deadlineNanos = deadlineNanos;
    }

    <T> Future<T> submit(Callable<T> work) {
      FutureTask<T> task = new FutureTask<>(work);
      try {
        contextAssemblyExecutor.execute(task);
      } catch (RejectedExecutionException e) {
        return CompletableFuture.failedFuture(e);
      }
      tasks.add(task);
      return task;
    }

    /** Waits for a lookup until the deadline; {@code fallback} marks the context degraded. */
    <T> T await(Future<T> task, T fallback, String layer) {
      if (task == null) {
        return fallback;
      }
      if (!interrupted) {
        try {
          long remaining = Math.max(0, deadlineNanos - System.nanoTime());
          return Objects.requireNonNullElse(task.get(remaining, TimeUnit.NANOSECONDS), fallback);
        } catch (TimeoutException e) {
          task.cancel(true);
          log.warn("Context layer '{}' missed the assembly deadline", layer);
        } catch (ExecutionException e) {
          log.warn("Context layer '{}' unavailable: {}", layer, e.getCause().toString());
        } catch (InterruptedException e) {
          interrupted = true;
          tasks.forEach(pending -> pending.cancel(true));
          Thread.currentThread().interrupt();
          log.debug("Context assembly interrupted, cancelled {} lookups", tasks.size());
        }
      }
      degraded = true;
      return fallback;
    }
  }
}
