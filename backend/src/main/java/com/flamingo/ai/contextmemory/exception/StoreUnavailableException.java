package com.flamingo.ai.contextmemory.exception;

/** The persistence layer could not be reached or rejected the operation. */
public class StoreUnavailableException extends RuntimeException {

  private final String userMessage;

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Memory storage is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
