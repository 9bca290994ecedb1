package com.flamingo.ai.contextmemory.domain.model;

import com.flamingo.ai.contextmemory.domain.enums.MemoryKind;

/**
 * A semantic lookup scoped to one user and one record kind.
 *
 * @param minSimilarity records below this cosine similarity are never returned
 * @param depthDays only records touched within this many days are candidates
 */
public record SimilarityQuery(
    float[] vector,
    String userId,
    MemoryKind kind,
    int limit,
    double minSimilarity,
    int depthDays) {}
