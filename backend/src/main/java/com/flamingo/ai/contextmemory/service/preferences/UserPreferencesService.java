package com.flamingo.ai.contextmemory.service.preferences;

import com.flamingo.ai.contextmemory.domain.model.AssembledContext.PreferenceSnapshot;
import com.flamingo.ai.contextmemory.domain.model.PreferencesUpdate;

/** Service for per-user personalization signal. */
public interface UserPreferencesService {

  /** Returns the user's preferences, or an empty snapshot when none are stored. */
  PreferenceSnapshot getPreferences(String userId);

  /** Merges the non-null fields of {@code update} into the user's single record. */
  PreferenceSnapshot upsert(String userId, PreferencesUpdate update);

  /** Counts one more request of {@code questionType}. */
  void recordQuestionType(String userId, String questionType);
}
