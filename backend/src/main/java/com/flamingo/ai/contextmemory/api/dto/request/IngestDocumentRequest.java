package com.flamingo.ai.contextmemory.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for handing over the extracted text of a document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestDocumentRequest {

  @NotBlank(message = "Document ID is required")
  private String documentId;

  @NotNull(message = "Full content is required")
  private String fullContent;

  private String summary;

  @Builder.Default private List<String> keyTopics = new ArrayList<>();

  @Builder.Default private Map<String, String> metadata = new LinkedHashMap<>();
}
