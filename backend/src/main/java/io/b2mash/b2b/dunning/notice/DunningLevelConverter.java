package io.b2mash.b2b.dunning.notice;

import io.b2mash.b2b.dunning.policy.DunningLevel;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link DunningLevel} as its level number (1..3), not the enum ordinal. */
@Converter
public class DunningLevelConverter implements AttributeConverter<DunningLevel, Integer> {

  @Override
  public Integer convertToDatabaseColumn(DunningLevel level) {
    return level == null ? null : level.number();
  }

  @Override
  public DunningLevel convertToEntityAttribute(Integer number) {
    return number == null ? null : DunningLevel.of(number);
  }
}
