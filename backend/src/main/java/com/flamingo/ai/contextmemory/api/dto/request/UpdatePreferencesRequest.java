package com.flamingo.ai.contextmemory.api.dto.request;

import com.flamingo.ai.contextmemory.domain.model.PreferencesUpdate;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for updating user preferences. Absent fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePreferencesRequest {

  @Size(max = 50, message = "Difficulty bias must not exceed 50 characters")
  private String difficultyBias;

  @Size(max = 20, message = "Language must not exceed 20 characters")
  private String language;

  @Size(max = 100, message = "Communication style must not exceed 100 characters")
  private String communicationStyle;

  public PreferencesUpdate toUpdate() {
    return new PreferencesUpdate(difficultyBias, language, communicationStyle);
  }
}
