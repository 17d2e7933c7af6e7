package com.flamingo.ai.knowledgedesk.domain.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.time.Instant;

/**
 * JPA converter persisting {@link Instant} as an ISO-8601 UTC string in a TEXT column. SQLite has
 * no native timestamp type.
 */
@Converter(autoApply = true)
public class InstantStringConverter implements AttributeConverter<Instant, String> {

  @Override
  public String convertToDatabaseColumn(Instant attribute) {
    return attribute == null ? null : attribute.toString();
  }

  @Override
  public Instant convertToEntityAttribute(String dbData) {
    return dbData == null || dbData.isBlank() ? null : Instant.parse(dbData);
  }
}
