package io.leadline.pipeline.prospect;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class PopulationConverter implements AttributeConverter<Population, String> {

  @Override
  public String convertToDatabaseColumn(Population attribute) {
    return attribute != null ? attribute.storageValue() : null;
  }

  @Override
  public Population convertToEntityAttribute(String dbData) {
    return dbData != null ? Population.fromStorage(dbData) : null;
  }
}
