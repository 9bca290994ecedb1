package com.flamingo.ai.contextmemory.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.contextmemory.config.MemoryConfig;
import com.flamingo.ai.contextmemory.domain.entity.ConversationMemory;
import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.enums.MemoryKind;
import com.flamingo.ai.contextmemory.domain.model.SimilarityQuery;
import com.flamingo.ai.contextmemory.domain.model.VectorMatch;
import com.flamingo.ai.contextmemory.exception.StoreUnavailableException;
import com.flamingo.ai.contextmemory.service.search.MemoryVectorIndex;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Approximate nearest neighbour index in Elasticsearch, one index per record kind. Documents only
 * carry the owner, the vector and the recency; the relational store stays the source of truth.
 */
@Component
@ConditionalOnProperty(name = "memory.search.backend", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchMemoryVectorIndex implements MemoryVectorIndex {

  private final ElasticsearchClient elasticsearchClient;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;

  @Value("${elasticsearch.index-prefix:context-memory}")
  private String indexPrefix;

  public ElasticsearchMemoryVectorIndex(
      ElasticsearchClient elasticsearchClient,
      MemoryConfig memoryConfig,
      MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.memoryConfig = memoryConfig;
    this.meterRegistry = meterRegistry;
  }

  @PostConstruct
  public void initIndices() {
    for (MemoryKind kind : MemoryKind.values()) {
      String indexName = indexName(kind);
      try {
        boolean exists = elasticsearchClient.indices().exists(e -> e.index(indexName)).value();
        if (!exists) {
          createIndex(indexName);
          log.info("Created Elasticsearch vector index: {}", indexName);
        }
      } catch (IOException e) {
        throw new IllegalStateException(
            "Failed to initialize Elasticsearch index '" + indexName + "'", e);
      }
    }
  }

  private void createIndex(String indexName) throws IOException {
    Map<String, Property> properties = new HashMap<>();
    properties.put("userId", Property.of(p -> p.keyword(k -> k)));
    properties.put("recency", Property.of(p -> p.long_(l -> l)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(memoryConfig.getEmbedding().getDimensions())
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    elasticsearchClient
        .indices()
        .create(
            CreateIndexRequest.of(c -> c.index(indexName).mappings(m -> m.properties(properties))));
  }

  @Override
  @Timed(value = "memory.vector_search", description = "Elasticsearch kNN search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "nearestFallback")
  public List<VectorMatch> nearest(SimilarityQuery query) {
    int k = Math.max(1, query.limit() * memoryConfig.getSearch().getCandidateMultiplier());
    List<Float> vector = toFloatList(query.vector());
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName(query.kind()))
                    .knn(
                        kn ->
                            kn.field("embedding")
                                .queryVector(vector)
                                .k(k)
                                .numCandidates(k * 2)
                                .filter(
                                    f -> f.term(t -> t.field("userId").value(query.userId()))))
                    .size(k));
    try {
      SearchResponse<MemoryVectorDocument> response =
          elasticsearchClient.search(request, MemoryVectorDocument.class);
      List<VectorMatch> matches = new ArrayList<>();
      for (Hit<MemoryVectorDocument> hit : response.hits().hits()) {
        double score = hit.score() != null ? hit.score() : 0.0;
        matches.add(new VectorMatch(hit.id(), toCosineSimilarity(score)));
      }
      meterRegistry.counter("memory.vector_search", "backend", "elasticsearch").increment();
      return matches;
    } catch (IOException e) {
      throw new StoreUnavailableException("Vector search failed: " + e.getMessage(), e);
    }
  }

  @SuppressWarnings("unused")
  private List<VectorMatch> nearestFallback(SimilarityQuery query, Throwable t) {
    log.warn("Vector search fallback triggered: {}", t.getMessage());
    meterRegistry.counter("memory.vector_search.fallback").increment();
    if (t instanceof StoreUnavailableException unavailable) {
      throw unavailable;
    }
    throw new StoreUnavailableException("Vector index unavailable", t);
  }

  @Override
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "upsertConversationFallback")
  public void upsert(ConversationMemory memory) {
    index(
        MemoryKind.CONVERSATION,
        memory.getConversationId(),
        memory.getUserId(),
        memory.getEmbedding(),
        memory.recency().toEpochSecond(ZoneOffset.UTC));
  }

  @Override
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "upsertDocumentFallback")
  public void upsert(DocumentMemory document) {
    index(
        MemoryKind.DOCUMENT,
        document.getDocumentId(),
        document.getUserId(),
        document.getEmbedding(),
        document.recency().toEpochSecond(ZoneOffset.UTC));
  }

  @SuppressWarnings("unused")
  private void upsertConversationFallback(ConversationMemory memory, Throwable t) {
    log.warn("Indexing conversation {} skipped: {}", memory.getConversationId(), t.getMessage());
    meterRegistry.counter("memory.index.fallback").increment();
  }

  @SuppressWarnings("unused")
  private void upsertDocumentFallback(DocumentMemory document, Throwable t) {
    log.warn("Indexing document {} skipped: {}", document.getDocumentId(), t.getMessage());
    meterRegistry.counter("memory.index.fallback").increment();
  }

  private void index(
      MemoryKind kind, String id, String userId, float[] embedding, long recencyEpochSeconds) {
    MemoryVectorDocument doc =
        MemoryVectorDocument.builder()
            .userId(userId)
            .recency(recencyEpochSeconds)
            .embedding(toFloatList(embedding))
            .build();

    BulkRequest.Builder bulk = new BulkRequest.Builder();
    bulk.operations(op -> op.index(idx -> idx.index(indexName(kind)).id(id).document(doc)));
    try {
      BulkResponse response = elasticsearchClient.bulk(bulk.build());
      if (response.errors()) {
        log.warn("Indexing {} {} reported errors: {}", kind, id, response.items());
        meterRegistry.counter("memory.index.errors").increment();
      }
    } catch (IOException e) {
      throw new StoreUnavailableException("Failed to index " + kind + " " + id, e);
    }
  }

  String indexName(MemoryKind kind) {
    return indexPrefix + "-" + kind.name().toLowerCase() + "s";
  }

  /** Elasticsearch scores cosine kNN hits as {@code (1 + cos) / 2}. */
  static double toCosineSimilarity(double score) {
    return 2.0 * score - 1.0;
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> values = new ArrayList<>(vector.length);
    for (float v : vector) {
      values.add(v);
    }
    return values;
  }
}
