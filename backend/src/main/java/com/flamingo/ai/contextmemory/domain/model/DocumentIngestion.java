package com.flamingo.ai.contextmemory.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Extracted document handed over by the ingestion pipeline.
 *
 * @param summary optional; derived from the content when blank
 */
public record DocumentIngestion(
    String userId,
    String documentId,
    String fullContent,
    String summary,
    List<String> keyTopics,
    Map<String, String> metadata) {}
