package com.flamingo.ai.contextmemory.service.session;

import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.domain.entity.SessionState;
import com.flamingo.ai.contextmemory.domain.model.SessionStateUpdate;
import com.flamingo.ai.contextmemory.domain.repository.SessionStateRepository;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Default {@link SessionStateService} backed by JPA. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionStateServiceImpl implements SessionStateService {

  private final SessionStateRepository sessionStateRepository;
  private final MemoryConfig memoryConfig;

  @Override
  @Transactional
  public SessionState beginSession(String userId, String sessionId, Duration ttl) {
    int superseded = sessionStateRepository.supersedeOthers(userId, sessionId);
    if (superseded > 0) {
      log.debug("Superseded {} older sessions of user {}", superseded, userId);
    }
    SessionState state =
        sessionStateRepository
            .findByUserIdAndSessionId(userId, sessionId)
            .orElseGet(() -> SessionState.builder().userId(userId).sessionId(sessionId).build());
    state.setActiveDocumentIds(new ArrayList<>());
    state.setCurrentPlanRef(null);
    state.setScratch(new LinkedHashMap<>());
    state.setSuperseded(false);
    state.setExpiresAt(LocalDateTime.now().plus(effectiveTtl(ttl)));
    log.info("Began session {} for user {}", sessionId, userId);
    return sessionStateRepository.save(state);
  }

  @Override
  @Transactional
  public SessionState updateState(String userId, String sessionId, SessionStateUpdate update) {
    SessionState state =
        findActive(userId, sessionId)
            .orElseGet(() -> beginSession(userId, sessionId, update.ttl()));
    if (update.activeDocumentIds() != null) {
      state.setActiveDocumentIds(
          new ArrayList<>(new LinkedHashSet<>(update.activeDocumentIds())));
    }
    if (update.currentPlanRef() != null) {
      state.setCurrentPlanRef(update.currentPlanRef());
    }
    if (update.scratch() != null && !update.scratch().isEmpty()) {
      Map<String, String> scratch = new LinkedHashMap<>(state.getScratch());
      scratch.putAll(update.scratch());
      state.setScratch(scratch);
    }
    state.setExpiresAt(LocalDateTime.now().plus(effectiveTtl(update.ttl())));
    return sessionStateRepository.save(state);
  }

  @Override
  @Transactional
  public void markDocumentsActive(
      String userId, String sessionId, Collection<String> documentIds) {
    if (sessionId == null || documentIds.isEmpty()) {
      return;
    }
    Optional<SessionState> active = findActive(userId, sessionId);
    if (active.isEmpty()) {
      return;
    }
    SessionState state = active.get();
    LinkedHashSet<String> merged = new LinkedHashSet<>(state.getActiveDocumentIds());
    if (merged.addAll(documentIds)) {
      state.setActiveDocumentIds(new ArrayList<>(merged));
      sessionStateRepository.save(state);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<SessionState> findActive(String userId, String sessionId) {
    LocalDateTime now = LocalDateTime.now();
    return sessionStateRepository
        .findByUserIdAndSessionId(userId, sessionId)
        .filter(state -> state.isActiveAt(now));
  }

  private Duration effectiveTtl(Duration ttl) {
    return ttl != null && !ttl.isNegative() && !ttl.isZero()
        ? ttl
        : memoryConfig.getSession().getDefaultTtl();
  }
}
