package com.flamingo.ai.contextmemory.api.rest;

import com.flamingo.ai.contextmemory.api.dto.request.UpdatePreferencesRequest;
import com.flamingo.ai.contextmemory.api.dto.response.PreferencesResponse;
import com.flamingo.ai.contextmemory.domain.model.AssembledContext.PreferenceSnapshot;
import com.flamingo.ai.contextmemory.service.preferences.UserPreferencesService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for user preferences. */
@RestController
@RequestMapping("/api/users/{userId}/preferences")
@RequiredArgsConstructor
public class PreferencesController {

  private final UserPreferencesService userPreferencesService;

  /** Gets the preferences of a user; empty fields when none are stored. */
  @GetMapping
  public ResponseEntity<PreferencesResponse> getPreferences(@PathVariable String userId) {
    PreferenceSnapshot snapshot = userPreferencesService.getPreferences(userId);
    return ResponseEntity.ok(PreferencesResponse.fromSnapshot(userId, snapshot));
  }

  @PutMapping
  public ResponseEntity<PreferencesResponse> updatePreferences(
      @PathVariable String userId, @Valid @RequestBody UpdatePreferencesRequest request) {
    PreferenceSnapshot snapshot = userPreferencesService.upsert(userId, request.toUpdate());
    return ResponseEntity.ok(PreferencesResponse.fromSnapshot(userId, snapshot));
  }
}
