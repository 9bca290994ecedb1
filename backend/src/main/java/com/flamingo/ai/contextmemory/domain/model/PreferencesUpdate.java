package com.flamingo.ai.contextmemory.domain.model;

/** Partial preference update; {@code null} fields are left unchanged. */
public record PreferencesUpdate(
    String difficultyBias, String language, String communicationStyle) {}
