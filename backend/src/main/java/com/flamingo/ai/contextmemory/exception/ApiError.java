package com.flamingo.ai.contextmemory.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  public static final String MEMORY_NOT_FOUND = "MEMORY_001";
  public static final String MEMORY_ACCESS_DENIED = "MEMORY_002";
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String SESSION_NOT_FOUND = "SESSION_001";
  public static final String STORE_UNAVAILABLE = "STORE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
