package io.leadline.pipeline.prospect;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class EngagementStageConverter implements AttributeConverter<EngagementStage, String> {

  @Override
  public String convertToDatabaseColumn(EngagementStage attribute) {
    return attribute != null ? attribute.storageValue() : null;
  }

  @Override
  public EngagementStage convertToEntityAttribute(String dbData) {
    return dbData != null ? EngagementStage.fromStorage(dbData) : null;
  }
}
