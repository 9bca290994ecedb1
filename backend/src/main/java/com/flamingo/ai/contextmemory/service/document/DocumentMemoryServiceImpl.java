package com.flamingo.ai.contextmemory.service.document;

import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.model.DocumentIngestion;
import com.flamingo.ai.contextmemory.domain.model.DocumentView;
import com.flamingo.ai.contextmemory.exception.DocumentNotFoundException;
import com.flamingo.ai.contextmemory.exception.MemoryAccessDeniedException;
import com.flamingo.ai.contextmemory.service.embedding.RetryingEmbedder;
import com.flamingo.ai.contextmemory.service.store.MemoryStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Default {@link DocumentMemoryService} on top of the memory store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentMemoryServiceImpl implements DocumentMemoryService {

  private static final int DIGEST_SENTENCES = 3;
  private static final int DIGEST_CHARS = 600;

  private final MemoryStore memoryStore;
  private final RetryingEmbedder retryingEmbedder;
  private final MeterRegistry meterRegistry;

  @Override
  public DocumentMemory ingest(DocumentIngestion ingestion) {
    if (ingestion.fullContent() == null) {
      throw new IllegalArgumentException("Document content is required");
    }
    Optional<DocumentMemory> existing = memoryStore.findDocument(ingestion.documentId());
    if (existing.isPresent() && !existing.get().getUserId().equals(ingestion.userId())) {
      throw new MemoryAccessDeniedException(ingestion.userId(), ingestion.documentId());
    }

    String summary =
        ingestion.summary() != null && !ingestion.summary().isBlank()
            ? ingestion.summary().trim()
            : leadDigest(ingestion.fullContent());

    DocumentMemory document =
        existing.orElseGet(
            () ->
                DocumentMemory.builder()
                    .documentId(ingestion.documentId())
                    .userId(ingestion.userId())
                    .build());
    document.setFullContent(ingestion.fullContent());
    document.setSummary(summary);
    document.setKeyTopics(
        ingestion.keyTopics() != null ? new ArrayList<>(ingestion.keyTopics()) : new ArrayList<>());
    document.setMetadata(
        ingestion.metadata() != null
            ? new LinkedHashMap<>(ingestion.metadata())
            : new LinkedHashMap<>());

    String embeddingInput = summary.isBlank() ? ingestion.fullContent() : summary;
    Optional<float[]> embedding =
        embeddingInput.isBlank()
            ? Optional.empty()
            : retryingEmbedder.tryEmbed(embeddingInput, "document " + ingestion.documentId());
    document.setEmbedding(embedding.orElse(null));
    document.setPendingEmbedding(embedding.isEmpty() && !embeddingInput.isBlank());

    DocumentMemory saved = memoryStore.saveDocument(document);
    if (saved.isPendingEmbedding()) {
      meterRegistry.counter("memory.pending_embedding", "kind", "document").increment();
    }
    log.info(
        "Ingested document {} for user {} ({} chars, pendingEmbedding={})",
        saved.getDocumentId(),
        saved.getUserId(),
        saved.getFullContent().length(),
        saved.isPendingEmbedding());
    return saved;
  }

  @Override
  public DocumentView getDocument(String userId, String documentId) {
    DocumentMemory document = requireOwned(userId, documentId);
    memoryStore.recordDocumentAccess(documentId);
    DocumentMemory refreshed = memoryStore.findDocument(documentId).orElse(document);
    return new DocumentView(refreshed, memoryStore.linkedConversationIds(documentId));
  }

  @Override
  public List<DocumentMemory> findLinkedDocuments(String userId, Collection<String> documentIds) {
    if (documentIds.isEmpty()) {
      return List.of();
    }
    LinkedHashSet<String> ordered = new LinkedHashSet<>(documentIds);
    Map<String, DocumentMemory> byId =
        memoryStore.findDocuments(ordered).stream()
            .filter(d -> d.getUserId().equals(userId))
            .collect(Collectors.toMap(DocumentMemory::getDocumentId, Function.identity()));
    List<DocumentMemory> documents =
        ordered.stream().map(byId::get).filter(d -> d != null).collect(Collectors.toList());
    if (documents.size() < ordered.size()) {
      log.debug(
          "Skipped {} unknown or foreign documents for user {}",
          ordered.size() - documents.size(),
          userId);
    }
    memoryStore.recordDocumentAccessAsync(
        documents.stream().map(DocumentMemory::getDocumentId).collect(Collectors.toList()));
    return documents;
  }

  private DocumentMemory requireOwned(String userId, String documentId) {
    DocumentMemory document =
        memoryStore
            .findDocument(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    if (!document.getUserId().equals(userId)) {
      throw new MemoryAccessDeniedException(userId, documentId);
    }
    return document;
  }

  /** First sentences of the content, used when no summary is handed over. */
  static String leadDigest(String content) {
    String flat = content.replaceAll("\\s+", " ").trim();
    if (flat.isEmpty()) {
      return "";
    }
    String[] sentences = flat.split("(?<=[.!?])\\s+");
    StringBuilder digest = new StringBuilder();
    for (int i = 0; i < sentences.length && i < DIGEST_SENTENCES; i++) {
      if (digest.length() + sentences[i].length() > DIGEST_CHARS) {
        break;
      }
      if (digest.length() > 0) {
        digest.append(' ');
      }
      digest.append(sentences[i]);
    }
    if (digest.length() == 0) {
      return flat.substring(0, Math.min(DIGEST_CHARS, flat.length()));
    }
    return digest.toString();
  }
}
