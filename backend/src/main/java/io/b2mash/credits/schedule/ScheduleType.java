package io.b2mash.credits.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.b2mash.credits.exception.ScheduleValidationException;
import java.util.Locale;

public enum ScheduleType {
  ONE_OFF,
  DAILY,
  WEEKLY,
  MONTHLY;

  /** Accepts the enum name in any case, plus {@code once} as an alias for {@link #ONE_OFF}. */
  @JsonCreator
  public static ScheduleType from(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    var normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    if ("ONCE".equals(normalized) || "ONEOFF".equals(normalized)) {
      return ONE_OFF;
    }
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new ScheduleValidationException("scheduleType", "Unknown schedule type: " + value);
    }
  }
}
