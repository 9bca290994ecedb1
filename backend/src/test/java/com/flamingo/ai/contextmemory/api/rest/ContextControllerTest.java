package com.flamingo.ai.contextmemory.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.contextmemory.api.dto.request.ContextRequest;
import com.flamingo.ai.contextmemory.api.dto.request.FinishedTurnRequest;
import com.flamingo.ai.contextmemory.api.dto.request.RecentMessageRequest;
import com.flamingo.ai.contextmemory.domain.enums.MessageRole;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.ImmediateMessage;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.LongTerm;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.PreferenceSnapshot;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.RelevantMemory;
import com.flamingo.ai.contextmemory.domain.model.ContextQuery;
import com.flamingo.ai.contextmemory.domain.model.FinishedTurn;
import com.flamingo.ai.contextmemory.exception.GlobalExceptionHandler;
import com.flamingo.ai.contextmemory.exception.StoreUnavailableException;
import com.flamingo.ai.contextmemory.service.context.ContextAssemblyService;
import com.flamingo.ai.contextmemory.service.writer.MemoryWriterService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
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
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ContextController")
class ContextControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;
  private SimpleMeterRegistry meterRegistry;

  @Mock private ContextAssemblyService contextAssemblyService;
  @Mock private MemoryWriterService memoryWriterService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new ContextController(contextAssemblyService, memoryWriterService))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
    objectMapper = new ObjectMapper().findAndRegisterModules();
  }

  @Nested
  @DisplayName("POST /api/context")
  class Assemble {

    @Test
    @DisplayName("should return the assembled layers")
    void shouldReturnAssembledContext() throws Exception {
      AssembledContext context =
          new AssembledContext(
              List.of(new ImmediateMessage(MessageRole.USER, "Quiz me on ATP")),
              new LongTerm(
                  List.of(new RelevantMemory("C2", "Biology quiz", 0.9, 0.5)),
                  List.of(),
                  PreferenceSnapshot.empty()),
              "The student is revising cell energy.",
              false);
      when(contextAssemblyService.assemble(any(ContextQuery.class))).thenReturn(context);

      ContextRequest request =
          ContextRequest.builder()
              .userId("u1")
              .conversationId("C3")
              .currentMessageText("Quiz me on ATP")
              .recentMessages(
                  List.of(
                      RecentMessageRequest.builder()
                          .role(MessageRole.USER)
                          .content("Quiz me on ATP")
                          .build()))
              .build();

      mockMvc
          .perform(
              post("/api/context")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.immediate[0].role").value("USER"))
          .andExpect(jsonPath("$.longTerm.relevantMemories[0].conversationId").value("C2"))
          .andExpect(jsonPath("$.synthesizedSummary").value("The student is revising cell energy."))
          .andExpect(jsonPath("$.longTermDegraded").value(false));

      ArgumentCaptor<ContextQuery> captor = ArgumentCaptor.forClass(ContextQuery.class);
      verify(contextAssemblyService).assemble(captor.capture());
      assertThat(captor.getValue().enableMemory()).isTrue();
      assertThat(captor.getValue().memoryDepthDays()).isZero();
      assertThat(captor.getValue().recentMessages()).hasSize(1);
    }

    @Test
    @DisplayName("should reject a request without user")
    void shouldRejectMissingUser() throws Exception {
      mockMvc
          .perform(
              post("/api/context")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"currentMessageText\":\"hi\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"));

      verify(contextAssemblyService, never()).assemble(any());
    }

    @Test
    @DisplayName("should reject a non-positive memory depth")
    void shouldRejectZeroDepth() throws Exception {
      mockMvc
          .perform(
              post("/api/context")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"userId\":\"u1\",\"memoryDepthDays\":0}"))
          .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("should reject a null attached document id as a validation error")
    void shouldRejectNullDocumentId() throws Exception {
      mockMvc
          .perform(
              post("/api/context")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"userId\":\"u1\",\"attachedDocumentIds\":[null]}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"));

      verify(contextAssemblyService, never()).assemble(any());
    }

    @Test
    @DisplayName("should answer 503 when the store is down")
    void shouldMapStoreFailure() throws Exception {
      when(contextAssemblyService.assemble(any()))
          .thenThrow(new StoreUnavailableException("Store unavailable", new RuntimeException()));

      mockMvc
          .perform(
              post("/api/context")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"userId\":\"u1\"}"))
          .andExpect(status().isServiceUnavailable())
          .andExpect(jsonPath("$.code").value("STORE_001"))
          .andExpect(jsonPath("$.path").value("/api/context"));

      assertThat(
              meterRegistry.counter("api_errors_total", "error_type", "store_unavailable").count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("POST /api/context/turns")
  class FinishTurn {

    @Test
    @DisplayName("should accept the turn and hand it to the writer")
    void shouldAcceptTurn() throws Exception {
      when(memoryWriterService.writeAsync(any()))
          .thenReturn(CompletableFuture.completedFuture(Optional.empty()));
      FinishedTurnRequest request =
          FinishedTurnRequest.builder()
              .userId("u1")
              .conversationId("C1")
              .transcript(
                  List.of(
                      RecentMessageRequest.builder()
                          .role(MessageRole.USER)
                          .content("Explain photosynthesis")
                          .build(),
                      RecentMessageRequest.builder()
                          .role(MessageRole.ASSISTANT)
                          .content("Plants turn light into sugar.")
                          .build()))
              .documentIds(List.of("D1"))
              .build();

      mockMvc
          .perform(
              post("/api/context/turns")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isAccepted());

      ArgumentCaptor<FinishedTurn> captor = ArgumentCaptor.forClass(FinishedTurn.class);
      verify(memoryWriterService).writeAsync(captor.capture());
      assertThat(captor.getValue().transcript()).hasSize(2);
      assertThat(captor.getValue().documentIds()).containsExactly("D1");
      assertThat(captor.getValue().finishedAt()).isNotNull();
    }

    @Test
    @DisplayName("should reject an empty transcript")
    void shouldRejectEmptyTranscript() throws Exception {
      mockMvc
          .perform(
              post("/api/context/turns")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"userId\":\"u1\",\"conversationId\":\"C1\",\"transcript\":[]}"))
          .andExpect(status().isBadRequest());

      verify(memoryWriterService, never()).writeAsync(any());
    }

    @Test
    @DisplayName("should reject a null referenced document id as a validation error")
    void shouldRejectNullTurnDocumentId() throws Exception {
      mockMvc
          .perform(
              post("/api/context/turns")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      "{\"userId\":\"u1\",\"conversationId\":\"C1\","
                          + "\"transcript\":[{\"role\":\"USER\",\"content\":\"hi\"}],"
                          + "\"documentIds\":[null]}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"));

      verify(memoryWriterService, never()).writeAsync(any());
    }
  }
}
