package com.flamingo.ai.contextmemory.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.LinkedHashMap;
import java.util.Map;

/** Persists per-key counters (question type tallies) as a JSON object. */
@Converter
public class CountMapConverter extends JsonAttributeConverter<Map<String, Integer>> {

  public CountMapConverter() {
    super(new TypeReference<>() {}, LinkedHashMap::new);
  }

  @Override
  boolean isEmpty(Map<String, Integer> attribute) {
    return attribute.isEmpty();
  }
}
