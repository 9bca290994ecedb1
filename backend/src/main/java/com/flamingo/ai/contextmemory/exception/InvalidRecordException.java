package com.flamingo.ai.contextmemory.exception;

/** A memory record is malformed (for example an embedding of the wrong length). */
public class InvalidRecordException extends RuntimeException {

  private final String recordKey;

  public InvalidRecordException(String recordKey, String message) {
    super(message);
    this.recordKey = recordKey;
  }

  public String getRecordKey() {
    return recordKey;
  }
}
