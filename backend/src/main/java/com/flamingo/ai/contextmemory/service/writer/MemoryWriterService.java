package com.flamingo.ai.contextmemory.service.writer;

import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.domain.model.FinishedTurn;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/** Persists finished turns as conversation memories. */
public interface MemoryWriterService {

  /**
   * Dispatches {@link #write} on the writer pool and returns at once. The dispatched task is
   * independent of the calling request and runs to completion even if that request is cancelled.
   *
   * @return completes with the persisted memory, or empty if it was rejected or lost
   */
  CompletableFuture<Optional<ConversationMemory>> writeAsync(FinishedTurn turn);

  /**
   * Summarizes, embeds, scores and upserts the turn's conversation memory, then links every
   * referenced document. Never throws: failures are logged and counted.
   *
   * @return the persisted memory, or empty if it was rejected or lost
   */
  Optional<ConversationMemory> write(FinishedTurn turn);
}
