package com.flamingo.ai.contextmemory.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

/**
 * Persists an embedding vector as a JSON number array. A missing embedding stays {@code NULL} so
 * that the record is never a similarity candidate.
 */
@Converter
public class EmbeddingConverter extends JsonAttributeConverter<float[]> {

  public EmbeddingConverter() {
    super(new TypeReference<>() {}, () -> null);
  }

  @Override
  boolean isEmpty(float[] attribute) {
    return attribute.length == 0;
  }
}
