package com.flamingo.ai.contextmemory.service.preferences;

import com.flamingo.ai.contextmemory.domain.entity.UserPreferences;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.PreferenceSnapshot;
import com.flamingo.ai.contextmemory.domain.model.PreferencesUpdate;
import com.flamingo.ai.contextmemory.domain.repository.UserPreferencesRepository;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Default {@link UserPreferencesService} backed by JPA. */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserPreferencesServiceImpl implements UserPreferencesService {

  private final UserPreferencesRepository preferencesRepository;

  @Override
  @Transactional(readOnly = true)
  public PreferenceSnapshot getPreferences(String userId) {
    return preferencesRepository
        .findByUserId(userId)
        .map(UserPreferencesServiceImpl::toSnapshot)
        .orElseGet(PreferenceSnapshot::empty);
  }

  @Override
  @Transactional
  public PreferenceSnapshot upsert(String userId, PreferencesUpdate update) {
    UserPreferences preferences = loadOrCreate(userId);
    if (update.difficultyBias() != null) {
      preferences.setDifficultyBias(update.difficultyBias());
    }
    if (update.language() != null) {
      preferences.setLanguage(update.language());
    }
    if (update.communicationStyle() != null) {
      preferences.setCommunicationStyle(update.communicationStyle());
    }
    UserPreferences saved = preferencesRepository.save(preferences);
    log.debug("Updated preferences for user {}", userId);
    return toSnapshot(saved);
  }

  @Override
  @Transactional
  public void recordQuestionType(String userId, String questionType) {
    if (questionType == null || questionType.isBlank()) {
      return;
    }
    UserPreferences preferences = loadOrCreate(userId);
    Map<String, Integer> counts = new LinkedHashMap<>(preferences.getQuestionTypeCounts());
    counts.merge(questionType.trim().toLowerCase(Locale.ROOT), 1, Integer::sum);
    preferences.setQuestionTypeCounts(counts);
    preferencesRepository.save(preferences);
  }

  private UserPreferences loadOrCreate(String userId) {
    return preferencesRepository
        .findByUserId(userId)
        .orElseGet(() -> UserPreferences.builder().userId(userId).build());
  }

  static PreferenceSnapshot toSnapshot(UserPreferences preferences) {
    return new PreferenceSnapshot(
        Collections.unmodifiableMap(preferences.questionTypeBias()),
        preferences.getDifficultyBias(),
        preferences.getLanguage(),
        preferences.getCommunicationStyle());
  }
}
