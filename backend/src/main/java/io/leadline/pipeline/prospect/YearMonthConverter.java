package io.leadline.pipeline.prospect;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.time.YearMonth;

/** Stores parked months as {@code YYYY-MM} text, which also sorts chronologically. */
@Converter(autoApply = true)
public class YearMonthConverter implements AttributeConverter<YearMonth, String> {

  @Override
  public String convertToDatabaseColumn(YearMonth attribute) {
    return attribute != null ? attribute.toString() : null;
  }

  @Override
  public YearMonth convertToEntityAttribute(String dbData) {
    return dbData != null ? YearMonth.parse(dbData) : null;
  }
}
