package com.flamingo.ai.contextmemory.service.search;

import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.model.SimilarityQuery;
import com.flamingo.ai.contextmemory.domain.model.VectorMatch;
import java.util.List;

/**
 * Nearest-neighbour lookup over stored embeddings. Implementations may be exact or approximate;
 * callers re-check ownership, threshold and freshness against the store.
 */
public interface MemoryVectorIndex {

  /**
   * Returns candidate keys (conversation or document ids) with their cosine similarity, best
   * first. May return records below the query threshold.
   */
  List<VectorMatch> nearest(SimilarityQuery query);

  /** Makes a searchable conversation memory visible to {@link #nearest}. */
  void upsert(ConversationMemory memory);

  /** Makes a searchable document memory visible to {@link #nearest}. */
  void upsert(DocumentMemory document);
}
