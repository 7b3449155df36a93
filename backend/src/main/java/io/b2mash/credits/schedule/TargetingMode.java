package io.b2mash.credits.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.b2mash.credits.exception.ScheduleValidationException;
import java.util.Locale;

public enum TargetingMode {
  NEW_USERS,
  ACTIVE_USERS,
  ALL_USERS,
  CUSTOM;

  @JsonCreator
  public static TargetingMode from(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException ex) {
      throw new ScheduleValidationException("targetingMode", "Unknown targeting mode: " + value);
    }
  }
}
