package com.flamingo.ai.contextmemory.api.rest;

import com.flamingo.ai.contextmemory.api.dto.request.IngestDocumentRequest;
import com.flamingo.ai.contextmemory.api.dto.request.LinkDocumentRequest;
import com.flamingo.ai.contextmemory.api.dto.response.DocumentResponse;
import com.flamingo.ai.contextmemory.api.dto.response.LinkResponse;
import com.flamingo.ai.contextmemory.domain.entity.DocumentMemory;
import com.flamingo.ai.contextmemory.domain.model.DocumentIngestion;
import com.flamingo.ai.contextmemory.domain.model.DocumentView;
import com.flamingo.ai.contextmemory.service.document.DocumentMemoryService;
import com.flamingo.ai.contextmemory.service.linker.DocumentLinkService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document memories. */
@RestController
@RequestMapping("/api/users/{userId}/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentMemoryService documentMemoryService;
  private final DocumentLinkService documentLinkService;

  /** Stores the extracted text of a document, replacing an earlier version. */
  @PostMapping
  public ResponseEntity<DocumentResponse> ingest(
      @PathVariable String userId, @Valid @RequestBody IngestDocumentRequest request) {
    DocumentMemory document =
        documentMemoryService.ingest(
            new DocumentIngestion(
                userId,
                request.getDocumentId(),
                request.getFullContent(),
                request.getSummary(),
                request.getKeyTopics(),
                request.getMetadata()));
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromEntity(document));
  }

  /** Gets a document with its full content. Counts as an access. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(
      @PathVariable String userId, @PathVariable String documentId) {
    DocumentView view = documentMemoryService.getDocument(userId, documentId);
    return ResponseEntity.ok(DocumentResponse.fromView(view));
  }

  /** Links a conversation to the document. Linking twice has no further effect. */
  @PostMapping("/{documentId}/links")
  public ResponseEntity<LinkResponse> link(
      @PathVariable String userId,
      @PathVariable String documentId,
      @Valid @RequestBody LinkDocumentRequest request) {
    boolean appended = documentLinkService.link(documentId, request.getConversationId(), userId);
    return ResponseEntity.ok(
        LinkResponse.builder()
            .documentId(documentId)
            .conversationId(request.getConversationId())
            .newlyLinked(appended)
            .build());
  }
}
