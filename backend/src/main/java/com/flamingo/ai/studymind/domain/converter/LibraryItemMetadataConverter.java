package com.flamingo.ai.studymind.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studymind.domain.metadata.LibraryItemMetadata;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * JPA converter storing {@link LibraryItemMetadata} as typed JSON in a TEXT column.
 *
 * <p>Writes fail loudly since an item without metadata would break the per-type guarantees. Reads
 * of unparseable rows yield {@code null} and are logged.
 */
@Converter
@Slf4j
public class LibraryItemMetadataConverter
    implements AttributeConverter<LibraryItemMetadata, String> {

  private static final ObjectMapper MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  @Override
  public String convertToDatabaseColumn(LibraryItemMetadata attribute) {
    if (attribute == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Failed to serialize " + attribute.itemType() + " metadata", e);
    }
  }

  @Override
  public LibraryItemMetadata convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return null;
    }
    try {
      return MAPPER.readValue(dbData, LibraryItemMetadata.class);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize library item metadata: {}", e.getMessage());
      return null;
    }
  }
}
