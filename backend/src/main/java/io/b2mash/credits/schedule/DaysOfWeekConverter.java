package io.b2mash.credits.schedule;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/** Stores a set of days as comma-separated ISO day numbers, e.g. {@code "6,7"}. */
@Converter
public class DaysOfWeekConverter implements AttributeConverter<Set<DayOfWeek>, String> {

  @Override
  public String convertToDatabaseColumn(Set<DayOfWeek> days) {
    if (days == null || days.isEmpty()) {
      return null;
    }
    return EnumSet.copyOf(days).stream()
        .map(day -> String.valueOf(day.getValue()))
        .collect(Collectors.joining(","));
  }

  @Override
  public Set<DayOfWeek> convertToEntityAttribute(String column) {
    if (column == null || column.isBlank()) {
      return null;
    }
    return Arrays.stream(column.split(","))
        .map(String::trim)
        .map(Integer::parseInt)
        .map(DayOfWeek::of)
        .collect(Collectors.toCollection(() -> EnumSet.noneOf(DayOfWeek.class)));
  }
}
