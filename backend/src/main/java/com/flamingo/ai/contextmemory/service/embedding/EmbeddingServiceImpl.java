package com.flamingo.ai.contextmemory.service.embedding;

import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.exception.EmbeddingUnavailableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** Embedding client backed by a LangChain4j {@link EmbeddingModel}. */
@Service
@Slf4j
public class EmbeddingServiceImpl implements EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final Executor embeddingExecutor;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;

  public EmbeddingServiceImpl(
      EmbeddingModel embeddingModel,
      @Qualifier("embeddingExecutor") Executor embeddingExecutor,
      MemoryConfig memoryConfig,
      MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel;
    this.embeddingExecutor = embeddingExecutor;
    this.memoryConfig = memoryConfig;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
  public float[] embed(String text) {
    return callProvider(text, memoryConfig.getEmbedding().getTimeout());
  }

  @Override
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
  public float[] embed(String text, Duration timeout) {
    return callProvider(text, timeout);
  }

  @Override
  public int dimensions() {
    return memoryConfig.getEmbedding().getDimensions();
  }

  private float[] callProvider(String text, Duration timeout) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Cannot embed blank text");
    }
    String input = text;
    int maxChars = memoryConfig.getEmbedding().getMaxInputChars();
    if (input.length() > maxChars) {
      log.debug("Embedding input cut from {} to {} chars", input.length(), maxChars);
      input = input.substring(0, maxChars);
    }

    String payload = input;
    Timer.Sample sample = Timer.start(meterRegistry);
    CompletableFuture<float[]> call =
        CompletableFuture.supplyAsync(
            () -> embeddingModel.embed(payload).content().vector(), embeddingExecutor);
    try {
      float[] vector = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      meterRegistry.counter("embedding.requests.success").increment();
      return vector;
    } catch (TimeoutException e) {
      call.cancel(true);
      throw new EmbeddingUnavailableException("Embedding timed out after " + timeout, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new EmbeddingUnavailableException(
          "Embedding provider failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      call.cancel(true);
      Thread.currentThread().interrupt();
      throw new EmbeddingUnavailableException("Interrupted while waiting for embedding", e);
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  @SuppressWarnings("unused")
  private float[] embedFallback(String text, Throwable t) {
    throw unavailable(t);
  }

  @SuppressWarnings("unused")
  private float[] embedFallback(String text, Duration timeout, Throwable t) {
    throw unavailable(t);
  }

  private EmbeddingUnavailableException unavailable(Throwable t) {
    meterRegistry.counter("embedding.requests.failure").increment();
    if (t instanceof EmbeddingUnavailableException unavailable) {
      log.warn("Embedding unavailable: {}", t.getMessage());
      return unavailable;
    }
    if (t instanceof IllegalArgumentException illegal) {
      throw illegal;
    }
    log.warn("Embedding circuit rejected call: {}", t.getMessage());
    return new EmbeddingUnavailableException("Embedding provider unavailable", t);
  }
}
