package com.example.kbassist.util;

import com.example.kbassist.model.Citation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.io.IOException;
import java.util.Collections;
import java.util.List;

/** Stores a citation list as a JSON array in a text column. */
@Converter(autoApply = false)
public class CitationListConverter implements AttributeConverter<List<Citation>, String> {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @Override
  public String convertToDatabaseColumn(List<Citation> attribute) {
    if (attribute == null || attribute.isEmpty()) {
      return "[]";
    }
    try {
      return OBJECT_MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize citations", e);
    }
  }

  @Override
  public List<Citation> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return Collections.emptyList();
    }
    try {
      return OBJECT_MAPPER.readValue(dbData, OBJECT_MAPPER.getTypeFactory().constructCollectionType(List.class, Citation.class));
    } catch (IOException e) {
      throw new IllegalStateException("Unable to deserialize citations", e);
    }
  }
}
