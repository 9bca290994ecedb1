package com.flamingo.ai.contextmemory.service.linker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.exception.DocumentNotFoundException;
import com.flamingo.ai.contextmemory.exception.LinkConflictException;
import com.flamingo.ai.contextmemory.exception.MemoryAccessDeniedException;
import com.flamingo.ai.contextmemory.service.store.MemoryStore;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DocumentLinkServiceTest {

  @Mock private MemoryStore memoryStore;

  private SimpleMeterRegistry meterRegistry;
  private DocumentLinkService linkService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    RetryRegistry retryRegistry = RetryRegistry.ofDefaults();
    retryRegistry.retry(
        "documentLink",
        RetryConfig.custom()
            .maxAttempts(5)
            .waitDuration(Duration.ofMillis(1))
            .retryExceptions(LinkConflictException.class)
            .build());
    linkService = new DocumentLinkService(memoryStore, meterRegistry, retryRegistry);

    when(memoryStore.findDocument("D1"))
        .thenReturn(
            Optional.of(
                DocumentMemory.builder()
                    .documentId("D1")
                    .userId("u1")
                    .fullContent("Photosynthesis notes")
                    .build()));
  }

  private static LinkConflictException conflict() {
    return new LinkConflictException("D1", "C3", new RuntimeException("unique constraint"));
  }

  @Nested
  @DisplayName("link")
  class Link {

    @Test
    @DisplayName("should append the first reference and bump access")
    void shouldAppendFirstReference() {
      when(memoryStore.appendLink("D1", "C3", "u1")).thenReturn(true);

      boolean linked = linkService.link("D1", "C3", "u1");

      assertThat(linked).isTrue();
      verify(memoryStore).recordDocumentAccess("D1");
      assertThat(meterRegistry.counter("document.linked", "new", "true").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should not append a repeated reference but still bump access")
    void shouldBeIdempotentForRepeatedReference() {
      when(memoryStore.appendLink("D1", "C3", "u1")).thenReturn(false);

      boolean linked = linkService.link("D1", "C3", "u1");

      assertThat(linked).isFalse();
      verify(memoryStore).recordDocumentAccess("D1");
      assertThat(meterRegistry.counter("document.linked", "new", "false").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should retry a conflicting append until it settles")
    void shouldRetryConflicts() {
      when(memoryStore.appendLink("D1", "C3", "u1"))
          .thenThrow(conflict())
          .thenThrow(conflict())
          .thenReturn(false);

      boolean linked = linkService.link("D1", "C3", "u1");

      assertThat(linked).isFalse();
      verify(memoryStore, times(3)).appendLink("D1", "C3", "u1");
      assertThat(meterRegistry.counter("document.link.conflict").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should treat a link that keeps conflicting as already present")
    void shouldGiveUpAfterRepeatedConflicts() {
      when(memoryStore.appendLink("D1", "C3", "u1")).thenThrow(conflict());

      boolean linked = linkService.link("D1", "C3", "u1");

      assertThat(linked).isFalse();
      verify(memoryStore, times(5)).appendLink("D1", "C3", "u1");
      verify(memoryStore).recordDocumentAccess("D1");
    }

    @Test
    @DisplayName("should reject a document that was never ingested")
    void shouldRejectUnknownDocument() {
      when(memoryStore.findDocument("missing")).thenReturn(Optional.empty());

      assertThatThrownBy(() -> linkService.link("missing", "C3", "u1"))
          .isInstanceOf(DocumentNotFoundException.class);
      verify(memoryStore, never()).appendLink(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("should reject a document owned by another user")
    void shouldRejectForeignDocument() {
      assertThatThrownBy(() -> linkService.link("D1", "C3", "intruder"))
          .isInstanceOf(MemoryAccessDeniedException.class);
      verify(memoryStore, never()).appendLink(anyString(), anyString(), anyString());
      verify(memoryStore, never()).recordDocumentAccess(anyString());
    }
  }
}
