package com.flamingo.ai.contextmemory.exception;

/** Exception thrown when no memory exists for a conversation. */
public class MemoryNotFoundException extends RuntimeException {

  private final String conversationId;

  public MemoryNotFoundException(String conversationId) {
    super("Memory not found for conversation: " + conversationId);
    this.conversationId = conversationId;
  }

  public String getConversationId() {
    return conversationId;
  }
}
