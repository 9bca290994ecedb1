package com.flamingo.ai.contextmemory.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.LinkedHashMap;
import java.util.Map;

/** Persists string key/value metadata as a JSON object, preserving insertion order. */
@Converter
public class StringMapConverter extends JsonAttributeConverter<Map<String, String>> {

  public StringMapConverter() {
    super(new TypeReference<>() {}, LinkedHashMap::new);
  }

  @Override
  boolean isEmpty(Map<String, String> attribute) {
    return attribute.isEmpty();
  }
}
