package com.flamingo.ai.contextmemory.api.dto.response;

import com.flamingo.ai.contextmemory.domain.model.AssembledContext.PreferenceSnapshot;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a user's preferences. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreferencesResponse {

  private String userId;
  private Map<String, Double> questionTypeBias;
  private String difficultyBias;
  private String language;
  private String communicationStyle;

  public static PreferencesResponse fromSnapshot(String userId, PreferenceSnapshot snapshot) {
    return PreferencesResponse.builder()
        .userId(userId)
        .questionTypeBias(snapshot.questionTypeBias())
        .difficultyBias(snapshot.difficultyBias())
        .language(snapshot.language())
        .communicationStyle(snapshot.communicationStyle())
        .build();
  }
}
