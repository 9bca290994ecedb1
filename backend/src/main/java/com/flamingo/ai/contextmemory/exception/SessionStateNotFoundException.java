package com.flamingo.ai.contextmemory.exception;

/** Exception thrown when a session has no live state (never begun, expired or superseded). */
public class SessionStateNotFoundException extends RuntimeException {

  private final String sessionId;

  public SessionStateNotFoundException(String sessionId) {
    super("No active state for session: " + sessionId);
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
