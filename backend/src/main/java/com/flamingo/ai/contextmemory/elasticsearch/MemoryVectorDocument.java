package com.flamingo.ai.contextmemory.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Elasticsearch document model for memory vectors. The document id is the conversation or document
 * id of the record it mirrors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryVectorDocument {

  /** Owner, used as the kNN filter */
  private String userId;

  /** Last activity in epoch seconds (UTC) */
  private Long recency;

  private List<Float> embedding;
}
