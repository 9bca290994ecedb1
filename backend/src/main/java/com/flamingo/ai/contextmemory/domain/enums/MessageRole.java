package com.flamingo.ai.contextmemory.domain.enums;

/** Role of the author of a conversation message. */
public enum MessageRole {
  USER,
  ASSISTANT,
  SYSTEM
}
