package com.flamingo.ai.contextmemory.service.search;

import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.enums.MemoryKind;
import com.flamingo.ai.contextmemory.domain.model.ScoredMemory;
import com.flamingo.ai.contextmemory.domain.model.SimilarityQuery;
import com.flamingo.ai.contextmemory.domain.model.VectorMatch;
import com.flamingo.ai.contextmemory.service.store.MemoryStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ranks a user's memories against a query vector.
 *
 * <p>Only records with a present embedding and a similarity of at least the query threshold are
 * returned, ordered by similarity, then importance, then recency. Returned records get their
 * access count bumped in the background.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimilaritySearchService {

  private final MemoryVectorIndex vectorIndex;
  private final MemoryStore memoryStore;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;

  /** Builds a query with the configured limit and threshold. */
  public SimilarityQuery defaultQuery(
      float[] vector, String userId, MemoryKind kind, Integer depthDays) {
    MemoryConfig.Search search = memoryConfig.getSearch();
    int depth = depthDays != null && depthDays > 0 ? depthDays : search.getDefaultDepthDays();
    return new SimilarityQuery(
        vector, userId, kind, search.getDefaultLimit(), search.getMinSimilarity(), depth);
  }

  @Timed(value = "memory.search.conversations", description = "Conversation similarity search")
  public List<ScoredMemory<ConversationMemory>> searchConversations(SimilarityQuery query) {
    requireKind(query, MemoryKind.CONVERSATION);
    List<VectorMatch> matches = candidates(query);
    List<ConversationMemory> records = memoryStore.findConversations(keys(matches));
    List<ScoredMemory<ConversationMemory>> ranked =
        rank(
            query,
            matches,
            records,
            ConversationMemory::getConversationId,
            m -> query.userId().equals(m.getUserId()) && m.isSearchable(),
            ConversationMemory::getImportance,
            ConversationMemory::recency);
    memoryStore.recordConversationAccessAsync(
        ranked.stream().map(hit -> hit.record().getConversationId()).toList());
    record(query, ranked.size());
    return ranked;
  }

  @Timed(value = "memory.search.documents", description = "Document similarity search")
  public List<ScoredMemory<DocumentMemory>> searchDocuments(SimilarityQuery query) {
    requireKind(query, MemoryKind.DOCUMENT);
    List<VectorMatch> matches = candidates(query);
    List<DocumentMemory> records = memoryStore.findDocuments(keys(matches));
    List<ScoredMemory<DocumentMemory>> ranked =
        rank(
            query,
            matches,
            records,
            DocumentMemory::getDocumentId,
            d -> query.userId().equals(d.getUserId()) && d.isSearchable(),
            d -> 0.0,
            DocumentMemory::recency);
    memoryStore.recordDocumentAccessAsync(
        ranked.stream().map(hit -> hit.record().getDocumentId()).toList());
    record(query, ranked.size());
    return ranked;
  }

  private List<VectorMatch> candidates(SimilarityQuery query) {
    if (query.limit() <= 0) {
      return List.of();
    }
    List<VectorMatch> matches = vectorIndex.nearest(query);
    log.debug(
        "Vector index returned {} {} candidates for user {}",
        matches.size(),
        query.kind(),
        query.userId());
    return matches;
  }

  private <T> List<ScoredMemory<T>> rank(
      SimilarityQuery query,
      List<VectorMatch> matches,
      List<T> records,
      Function<T, String> key,
      Predicate<T> eligible,
      ToDoubleFunction<T> importance,
      Function<T, LocalDateTime> recency) {
    Map<String, Double> similarityByKey =
        matches.stream()
            .collect(
                Collectors.toMap(
                    VectorMatch::key, VectorMatch::similarity, Math::max, LinkedHashMap::new));
    LocalDateTime since = LocalDateTime.now().minusDays(query.depthDays());

    List<ScoredMemory<T>> hits = new ArrayList<>();
    for (T record : records) {
      Double similarity = similarityByKey.get(key.apply(record));
      if (similarity == null || similarity < query.minSimilarity() || !eligible.test(record)) {
        continue;
      }
      LocalDateTime touched = recency.apply(record);
      if (touched != null && touched.isBefore(since)) {
        continue;
      }
      hits.add(new ScoredMemory<>(record, similarity));
    }

    Comparator<ScoredMemory<T>> order =
        Comparator.<ScoredMemory<T>>comparingDouble(hit -> hit.similarity())
            .reversed()
            .thenComparing(
                Comparator.<ScoredMemory<T>>comparingDouble(
                        hit -> importance.applyAsDouble(hit.record()))
                    .reversed())
            .thenComparing(
                hit -> recency.apply(hit.record()),
                Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));
    hits.sort(order);
    return hits.size() > query.limit() ? new ArrayList<>(hits.subList(0, query.limit())) : hits;
  }

  private static List<String> keys(List<VectorMatch> matches) {
    return matches.stream().map(VectorMatch::key).distinct().toList();
  }

  private static void requireKind(SimilarityQuery query, MemoryKind expected) {
    if (query.kind() != expected) {
      throw new IllegalArgumentException(
          "Expected a " + expected + " query but got " + query.kind());
    }
  }

  private void record(SimilarityQuery query, int hits) {
    meterRegistry
        .counter("memory.search", "kind", query.kind().name().toLowerCase())
        .increment();
    log.debug(
        "Similarity search for user {} returned {} {} hits", query.userId(), hits, query.kind());
  }
}
