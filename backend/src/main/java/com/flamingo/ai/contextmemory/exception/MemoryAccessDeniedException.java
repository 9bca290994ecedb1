package com.flamingo.ai.contextmemory.exception;

/** Exception thrown when a user touches a memory or document owned by someone else. */
public class MemoryAccessDeniedException extends RuntimeException {

  private final String userId;
  private final String resourceId;

  public MemoryAccessDeniedException(String userId, String resourceId) {
    super(String.format("%s is not owned by user %s", resourceId, userId));
    this.userId = userId;
    this.resourceId = resourceId;
  }

  public String getUserId() {
    return userId;
  }

  public String getResourceId() {
    return resourceId;
  }
}
