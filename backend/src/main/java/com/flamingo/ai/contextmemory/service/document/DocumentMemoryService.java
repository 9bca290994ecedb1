package com.flamingo.ai.contextmemory.service.document;

import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.model.DocumentIngestion;
import com.flamingo.ai.contextmemory.domain.model.DocumentView;
import java.util.Collection;
import java.util.List;

/** Service for full-content document memories. */
public interface DocumentMemoryService {

  /**
   * Creates or replaces a document memory. The content is stored untruncated; the summary is
   * embedded, and the record is kept as pending when embedding is unavailable.
   *
   * @throws com.flamingo.ai.contextmemory.exception.MemoryAccessDeniedException if the document id
   *     belongs to another user
   */
  DocumentMemory ingest(DocumentIngestion ingestion);

  /**
   * Reads one document with its linked conversations and counts the read as an access.
   *
   * @throws com.flamingo.ai.contextmemory.exception.DocumentNotFoundException if unknown
   * @throws com.flamingo.ai.contextmemory.exception.MemoryAccessDeniedException if not owned
   */
  DocumentView getDocument(String userId, String documentId);

  /**
   * Loads the user's documents among {@code documentIds}, in the given order. Unknown and foreign
   * ids are skipped. Access counts are bumped in the background.
   */
  List<DocumentMemory> findLinkedDocuments(String userId, Collection<String> documentIds);
}
