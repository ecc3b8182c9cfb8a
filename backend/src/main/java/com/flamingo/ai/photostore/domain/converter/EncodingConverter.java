package com.flamingo.ai.photostore.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** JPA converter for persisting a face encoding vector as a JSON array in a TEXT column. */
@Converter
public class EncodingConverter implements AttributeConverter<double[], String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Override
  public String convertToDatabaseColumn(double[] attribute) {
    if (attribute == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize face encoding", e);
    }
  }

  @Override
  public double[] convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return null;
    }
    try {
      return MAPPER.readValue(dbData, double[].class);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Stored face encoding is not a JSON number array", e);
    }
  }
}
