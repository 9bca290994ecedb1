package com.flamingo.ai.contextmemory.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

/** Persists ordered string lists (key points, decisions, document ids) as a JSON array. */
@Converter
public class StringListConverter extends JsonAttributeConverter<List<String>> {

  public StringListConverter() {
    super(new TypeReference<>() {}, ArrayList::new);
  }

  @Override
  boolean isEmpty(List<String> attribute) {
    return attribute.isEmpty();
  }
}
