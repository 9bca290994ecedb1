package com.flamingo.ai.contextmemory.service.session;

import com.flamingo.ai.contextmemory.domain.entity.SessionState;
import com.flamingo.ai.contextmemory.domain.model.SessionStateUpdate;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/** Service for short-lived per-session working memory. */
public interface SessionStateService {

  /**
   * Starts (or restarts) the state of a session and supersedes every other session of the user.
   *
   * @param ttl time to live; the configured default when {@code null}
   */
  SessionState beginSession(String userId, String sessionId, Duration ttl);

  /**
   * Applies an update to a live session, beginning it first when it has no live state, and
   * refreshes its expiry.
   */
  SessionState updateState(String userId, String sessionId, SessionStateUpdate update);

  /** Adds documents to the active set of a live session; no-op when the session is not live. */
  void markDocumentsActive(String userId, String sessionId, Collection<String> documentIds);

  /** Returns the state if it is neither expired nor superseded. */
  Optional<SessionState> findActive(String userId, String sessionId);
}
