package com.flamingo.ai.contextmemory.exception;

/**
 * The embedding provider timed out or failed. Callers continue without the vector: searches
 * return fewer results and writes are stored as pending.
 */
public class EmbeddingUnavailableException extends RuntimeException {

  public EmbeddingUnavailableException(String message) {
    super(message);
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
