package com.flamingo.ai.contextmemory.service.search;

import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.model.SimilarityQuery;
import com.flamingo.ai.contextmemory.domain.model.VectorMatch;
import com.flamingo.ai.contextmemory.domain.repository.ConversationMemoryRepository;
import com.flamingo.ai.contextmemory.domain.repository.DocumentMemoryRepository;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Exact cosine scan over the user's embedded records in the relational store. Suitable for the
 * per-user corpus sizes of a single deployment; switch to the Elasticsearch index for larger ones.
 */
@Component
@ConditionalOnProperty(name = "memory.search.backend", havingValue = "store", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class StoreScanVectorIndex implements MemoryVectorIndex {

  private final ConversationMemoryRepository conversationRepository;
  private final DocumentMemoryRepository documentRepository;

  @Override
  public List<VectorMatch> nearest(SimilarityQuery query) {
    LocalDateTime since = LocalDateTime.now().minusDays(query.depthDays());
    List<VectorMatch> matches = new ArrayList<>();
    switch (query.kind()) {
      case CONVERSATION -> {
        for (ConversationMemory memory :
            conversationRepository.findSearchCandidates(query.userId(), since)) {
          score(query, memory.getConversationId(), memory.getEmbedding(), matches);
        }
      }
      case DOCUMENT -> {
        for (DocumentMemory document :
            documentRepository.findSearchCandidates(query.userId(), since)) {
          score(query, document.getDocumentId(), document.getEmbedding(), matches);
        }
      }
    }
    matches.sort(Comparator.comparingDouble(VectorMatch::similarity).reversed());
    return matches;
  }

  private void score(SimilarityQuery query, String key, float[] embedding, List<VectorMatch> out) {
    if (embedding == null || embedding.length != query.vector().length) {
      log.debug("Skipping {} with unusable embedding", key);
      return;
    }
    double similarity =
        CosineSimilarity.between(Embedding.from(query.vector()), Embedding.from(embedding));
    if (similarity >= query.minSimilarity()) {
      out.add(new VectorMatch(key, similarity));
    }
  }

  /** Vectors are read straight from the store, nothing to sync. */
  @Override
  public void upsert(ConversationMemory memory) {}

  @Override
  public void upsert(DocumentMemory document) {}
}
