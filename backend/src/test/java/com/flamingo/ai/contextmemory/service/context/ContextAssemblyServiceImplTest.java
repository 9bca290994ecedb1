package com.flamingo.ai.contextmemory.service.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contextmemory.agent.ContextSynthesisAgent;
import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.entity.SessionState;
import com.flamingo.ai.contextmemory.domain.enums.MemoryKind;
import com.flamingo.ai.contextmemory.domain.enums.MessageRole;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.PreferenceSnapshot;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.RelevantMemory;
import com.flamingo.ai.contextmemory.domain.model.ContextQuery;
import com.flamingo.ai.contextmemory.domain.model.RecentMessage;
import com.flamingo.ai.contextmemory.domain.model.ScoredMemory;
import com.flamingo.ai.contextmemory.domain.model.SimilarityQuery;
import com.flamingo.ai.contextmemory.exception.EmbeddingUnavailableException;
import com.flamingo.ai.contextmemory.service.document.DocumentMemoryService;
import com.flamingo.ai.contextmemory.service.embedding.EmbeddingService;
import com.flamingo.ai.contextmemory.service.preferences.UserPreferencesService;
import com.flamingo.ai.contextmemory.service.search.SimilaritySearchService;
import com.flamingo.ai.contextmemory.service.session.SessionStateService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ContextAssemblyServiceImplTest {

  private static final String USER = "user-1";
  private static final String CONVERSATION = "conv-current";
  private static final float[] VECTOR = {0.1f, 0.2f, 0.3f};

  @Mock private EmbeddingService embeddingService;
  @Mock private SimilaritySearchService similaritySearchService;
  @Mock private DocumentMemoryService documentMemoryService;
  @Mock private UserPreferencesService userPreferencesService;
  @Mock private SessionStateService sessionStateService;
  @Mock private ContextSynthesisAgent contextSynthesisAgent;

  private MemoryConfig memoryConfig;
  private SimpleMeterRegistry meterRegistry;
  private ExecutorService executor;
  private ContextAssemblyServiceImpl service;

  private final PreferenceSnapshot preferences =
      new PreferenceSnapshot(Map.of("quiz", 1.0), "hard", "en", "concise");
  private final SimilarityQuery similarityQuery =
      new SimilarityQuery(VECTOR, USER, MemoryKind.CONVERSATION, 10, 0.7, 30);

  @BeforeEach
  void setUp() {
    memoryConfig = new MemoryConfig();
    meterRegistry = new SimpleMeterRegistry();
    executor = Executors.newCachedThreadPool();
    service =
        new ContextAssemblyServiceImpl(
            embeddingService,
            similaritySearchService,
            documentMemoryService,
            userPreferencesService,
            sessionStateService,
            new ContextBudget(memoryConfig),
            new ContextSynthesizer(contextSynthesisAgent, meterRegistry),
            memoryConfig,
            meterRegistry,
            executor);

    when(embeddingService.embed(anyString(), any(Duration.class))).thenReturn(VECTOR);
    when(similaritySearchService.defaultQuery(any(), eq(USER), eq(MemoryKind.CONVERSATION), any()))
        .thenReturn(similarityQuery);
    when(similaritySearchService.searchConversations(similarityQuery)).thenReturn(List.of());
    when(userPreferencesService.getPreferences(USER)).thenReturn(preferences);
    when(sessionStateService.findActive(anyString(), anyString())).thenReturn(Optional.empty());
    when(documentMemoryService.findLinkedDocuments(eq(USER), anyCollection()))
        .thenReturn(List.of());
    when(contextSynthesisAgent.synthesize(anyString(), anyString(), anyString(), anyString()))
        .thenReturn("Briefing.");
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  @DisplayName("should assemble all three layers")
  void shouldAssembleAllLayers() {
    when(similaritySearchService.searchConversations(similarityQuery))
        .thenReturn(List.of(hit("conv-old", "Worked on cell biology", 0.91)));

    AssembledContext context = service.assemble(query("make another biology quiz", true));

    assertThat(context.immediate()).hasSize(2);
    assertThat(context.longTerm().relevantMemories())
        .extracting(RelevantMemory::conversationId)
        .containsExactly("conv-old");
    assertThat(context.longTerm().relevantMemories().get(0).similarity()).isEqualTo(0.91);
    assertThat(context.longTerm().userPreferences()).isEqualTo(preferences);
    assertThat(context.synthesizedSummary()).isEqualTo("Briefing.");
    assertThat(context.longTermDegraded()).isFalse();
  }

  @Test
  @DisplayName("should reject a request without a user")
  void shouldRejectMissingUser() {
    ContextQuery query =
        new ContextQuery(" ", CONVERSATION, null, "hi", List.of(), true, 30, List.of());

    assertThatThrownBy(() -> service.assemble(query)).isInstanceOf(IllegalArgumentException.class);
  }

  @Nested
  @DisplayName("deduplication")
  class Deduplication {

    @Test
    @DisplayName("should not repeat the current conversation when it is already immediate")
    void shouldDropCurrentConversationFromLongTerm() {
      when(similaritySearchService.searchConversations(similarityQuery))
          .thenReturn(
              List.of(hit(CONVERSATION, "This very chat", 0.99), hit("conv-old", "Older", 0.8)));

      AssembledContext context = service.assemble(query("continue", true));

      assertThat(context.longTerm().relevantMemories())
          .extracting(RelevantMemory::conversationId)
          .containsExactly("conv-old");
    }

    @Test
    @DisplayName("should keep the current conversation when nothing is immediate")
    void shouldKeepCurrentConversationWithoutImmediate() {
      when(similaritySearchService.searchConversations(similarityQuery))
          .thenReturn(List.of(hit(CONVERSATION, "This very chat", 0.99)));
      ContextQuery query =
          new ContextQuery(USER, CONVERSATION, null, "continue", List.of(), true, 30, List.of());

      AssembledContext context = service.assemble(query);

      assertThat(context.longTerm().relevantMemories()).hasSize(1);
    }
  }

  @Nested
  @DisplayName("degradation")
  class Degradation {

    @Test
    @DisplayName("should return immediate and preferences when embedding is unavailable")
    void shouldDegradeWhenEmbeddingFails() {
      when(embeddingService.embed(anyString(), any(Duration.class)))
          .thenThrow(new EmbeddingUnavailableException("provider down"));

      AssembledContext context = service.assemble(query("anything", true));

      assertThat(context.longTermDegraded()).isTrue();
      assertThat(context.immediate()).isNotEmpty();
      assertThat(context.longTerm().relevantMemories()).isEmpty();
      assertThat(context.longTerm().userPreferences()).isEqualTo(preferences);
      assertThat(meterRegistry.counter("context.degraded").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should give up on a slow lookup at the deadline")
    void shouldRespectDeadline() {
      memoryConfig.getContext().setTimeout(Duration.ofMillis(300));
      when(similaritySearchService.searchConversations(similarityQuery))
          .thenAnswer(
              invocation -> {
                Thread.sleep(5_000);
                return List.of();
              });

      long started = System.nanoTime();
      AssembledContext context = service.assemble(query("anything", true));
      Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

      assertThat(elapsed).isLessThan(Duration.ofSeconds(3));
      assertThat(context.longTermDegraded()).isTrue();
      assertThat(context.immediate()).hasSize(2);
    }

    @Test
    @DisplayName("should restore the interrupt flag and skip lookups when interrupted")
    void shouldHonourInterruption() {
      when(similaritySearchService.searchConversations(similarityQuery))
          .thenAnswer(
              invocation -> {
                Thread.sleep(5_000);
                return List.of();
              });
      Thread.currentThread().interrupt();

      AssembledContext context = service.assemble(query("anything", true));

      assertThat(Thread.interrupted()).isTrue();
      assertThat(context.longTermDegraded()).isTrue();
      assertThat(context.immediate()).hasSize(2);
      verify(contextSynthesisAgent, never())
          .synthesize(anyString(), anyString(), anyString(), anyString());
    }
  }

  @Nested
  @DisplayName("synthesis")
  class Synthesis {

    @Test
    @DisplayName("should fall back to a digest when the model fails")
    void shouldFallBackToDigest() {
      when(contextSynthesisAgent.synthesize(anyString(), anyString(), anyString(), anyString()))
          .thenThrow(new RuntimeException("model unavailable"));
      when(similaritySearchService.searchConversations(similarityQuery))
          .thenReturn(List.of(hit("conv-old", "Algebra practice", 0.8)));

      AssembledContext context = service.assemble(query("more algebra", true));

      assertThat(context.synthesizedSummary())
          .contains("Current request: more algebra")
          .contains("Algebra practice");
      assertThat(context.longTermDegraded()).isFalse();
      assertThat(meterRegistry.counter("context.synthesis.fallback").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should use the digest when synthesis is switched off")
    void shouldUseDigestWhenDisabled() {
      memoryConfig.getContext().setSynthesisEnabled(false);

      AssembledContext context = service.assemble(query("hello", true));

      assertThat(context.synthesizedSummary()).startsWith("Current request: hello");
      verify(contextSynthesisAgent, never())
          .synthesize(anyString(), anyString(), anyString(), anyString());
    }
  }

  @Nested
  @DisplayName("memory switches")
  class MemorySwitches {

    @Test
    @DisplayName("should skip search and synthesis when the request disables memory")
    void shouldSkipSearchWhenRequestDisablesMemory() {
      AssembledContext context = service.assemble(query("hello", false));

      verify(embeddingService, never()).embed(anyString(), any(Duration.class));
      assertThat(context.synthesizedSummary()).isEmpty();
      assertThat(context.longTerm().userPreferences()).isEqualTo(preferences);
      assertThat(context.longTermDegraded()).isFalse();
    }

    @Test
    @DisplayName("should return only the immediate layer when memory is switched off")
    void shouldReturnImmediateOnlyWhenDisabled() {
      memoryConfig.setEnabled(false);

      AssembledContext context = service.assemble(query("hello", true));

      verify(userPreferencesService, never()).getPreferences(anyString());
      assertThat(context.immediate()).hasSize(2);
      assertThat(context.longTerm().userPreferences().isEmpty()).isTrue();
      assertThat(context.longTermDegraded()).isFalse();
    }
  }

  @Test
  @DisplayName("should add the session's active documents to the attached ones")
  void shouldMergeSessionDocuments() {
    SessionState state =
        SessionState.builder()
            .userId(USER)
            .sessionId("session-1")
            .activeDocumentIds(new ArrayList<>(List.of("doc-b", "doc-a")))
            .expiresAt(LocalDateTime.now().plusHours(1))
            .build();
    when(sessionStateService.findActive(USER, "session-1")).thenReturn(Optional.of(state));
    DocumentMemory docA = DocumentMemory.builder().documentId("doc-a").summary("A").build();
    DocumentMemory docB = DocumentMemory.builder().documentId("doc-b").summary("B").build();
    when(documentMemoryService.findLinkedDocuments(eq(USER), anyCollection()))
        .thenReturn(List.of(docA, docB));
    ContextQuery query =
        new ContextQuery(
            USER, CONVERSATION, "session-1", "hi", List.of("doc-a"), true, 30, messages());

    AssembledContext context = service.assemble(query);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Collection<String>> ids = ArgumentCaptor.forClass(Collection.class);
    verify(documentMemoryService).findLinkedDocuments(eq(USER), ids.capture());
    assertThat(ids.getValue()).containsExactly("doc-a", "doc-b");
    assertThat(context.longTerm().linkedDocuments()).hasSize(2);
  }

  private ContextQuery query(String text, boolean enableMemory) {
    return new ContextQuery(
        USER, CONVERSATION, null, text, List.of(), enableMemory, 30, messages());
  }

  private static List<RecentMessage> messages() {
    LocalDateTime now = LocalDateTime.now();
    return List.of(
        new RecentMessage(MessageRole.USER, "Question", now.minusMinutes(1)),
        new RecentMessage(MessageRole.ASSISTANT, "Answer", now));
  }

  private static ScoredMemory<ConversationMemory> hit(
      String conversationId, String summary, double similarity) {
    ConversationMemory memory =
        ConversationMemory.builder()
            .userId(USER)
            .conversationId(conversationId)
            .summary(summary)
            .importance(0.5)
            .build();
    return new ScoredMemory<>(memory, similarity);
  }
}
