package com.flamingo.ai.contextmemory.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Base for converters that keep a typed attribute as JSON in a TEXT column. Empty values are
 * stored as {@code NULL} and read back through {@link #emptyValue()}.
 *
 * @param <T> attribute type
 */
@Slf4j
abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

  static final ObjectMapper MAPPER = new ObjectMapper();

  private final TypeReference<T> type;
  private final Supplier<T> emptyValue;

  JsonAttributeConverter(TypeReference<T> type, Supplier<T> emptyValue) {
    this.type = type;
    this.emptyValue = emptyValue;
  }

  /** Whether the attribute carries nothing worth storing. */
  abstract boolean isEmpty(T attribute);

  T emptyValue() {
    return emptyValue.get();
  }

  @Override
  public String convertToDatabaseColumn(T attribute) {
    if (attribute == null || isEmpty(attribute)) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Failed to serialize " + type.getType().getTypeName() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public T convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return emptyValue();
    }
    try {
      return MAPPER.readValue(dbData, type);
    } catch (JsonProcessingException e) {
      log.error(
          "Unreadable {} column, treating as empty: {}",
          type.getType().getTypeName(),
          e.getMessage());
      return emptyValue();
    }
  }
}
