package com.flamingo.ai.contextmemory.api.rest;

import com.flamingo.ai.contextmemory.api.dto.request.UpdateSessionStateRequest;
import com.flamingo.ai.contextmemory.api.dto.response.SessionStateResponse;
import com.flamingo.ai.contextmemory.domain.entity.SessionState;
import com.flamingo.ai.contextmemory.exception.SessionStateNotFoundException;
import com.flamingo.ai.contextmemory.service.session.SessionStateService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for session working memory. */
@RestController
@RequestMapping("/api/users/{userId}/sessions")
@RequiredArgsConstructor
public class SessionController {

  private final SessionStateService sessionStateService;

  /**
   * Writes the working memory of a session, starting it if nothing live exists.
   *
   * @param userId the owner
   * @param sessionId the session
   * @param request fields to change; {@code begin} resets the session first
   * @return the current state
   */
  @PutMapping("/{sessionId}")
  public ResponseEntity<SessionStateResponse> updateSession(
      @PathVariable String userId,
      @PathVariable String sessionId,
      @Valid @RequestBody UpdateSessionStateRequest request) {
    if (request.isBegin()) {
      sessionStateService.beginSession(userId, sessionId, request.ttl());
    }
    SessionState state = sessionStateService.updateState(userId, sessionId, request.toUpdate());
    return ResponseEntity.ok(SessionStateResponse.fromEntity(state));
  }

  /** Gets the live state of a session; 404 once it expired or was superseded. */
  @GetMapping("/{sessionId}")
  public ResponseEntity<SessionStateResponse> getSession(
      @PathVariable String userId, @PathVariable String sessionId) {
    SessionState state =
        sessionStateService
            .findActive(userId, sessionId)
            .orElseThrow(() -> new SessionStateNotFoundException(sessionId));
    return ResponseEntity.ok(SessionStateResponse.fromEntity(state));
  }
}
