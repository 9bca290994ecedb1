package com.flamingo.ai.contextmemory.domain.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Changes to a session's working memory. {@code null} fields are left unchanged; scratch entries
 * are merged key by key.
 *
 * @param ttl new time to live from now; the configured default when {@code null}
 */
public record SessionStateUpdate(
    List<String> activeDocumentIds,
    String currentPlanRef,
    Map<String, String> scratch,
    Duration ttl) {}
