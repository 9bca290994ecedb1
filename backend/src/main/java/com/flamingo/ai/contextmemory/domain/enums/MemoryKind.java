package com.flamingo.ai.contextmemory.domain.enums;

/** Kind of embedded record a similarity query runs against. */
public enum MemoryKind {
  /** Summarized conversation segments. */
  CONVERSATION,

  /** Full-content document records. */
  DOCUMENT
}
