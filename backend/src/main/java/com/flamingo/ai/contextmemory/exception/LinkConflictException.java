package com.flamingo.ai.contextmemory.exception;

/** A concurrent append of the same document/conversation link was detected. */
public class LinkConflictException extends RuntimeException {

  private final String documentId;
  private final String conversationId;

  public LinkConflictException(String documentId, String conversationId, Throwable cause) {
    super(
        String.format(
            "Concurrent link of document %s to conversation %s", documentId, conversationId),
        cause);
    this.documentId = documentId;
    this.conversationId = conversationId;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getConversationId() {
    return conversationId;
  }
}
