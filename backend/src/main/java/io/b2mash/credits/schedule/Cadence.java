package io.b2mash.credits.schedule;

import io.b2mash.credits.exception.ScheduleValidationException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.IsoFields;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * How often a credit schedule fires. Each variant carries only the parameters its type needs, and
 * the compact constructors reject anything else, so a persisted schedule can always be turned back
 * into a valid cadence.
 *
 * <p>Period keys identify "which occurrence" a firing belongs to and, together with the schedule
 * id, are the exactly-once key of an execution.
 */
public sealed interface Cadence
    permits Cadence.OneOff, Cadence.Daily, Cadence.Weekly, Cadence.Monthly {

  String ONE_OFF_PERIOD_KEY = "once";

  ScheduleType type();

  /** Whether the cadence has an occurrence on the given calendar date (ignoring start/end). */
  boolean occursOn(LocalDate date);

  /** Period key of the occurrence on the given date. */
  String periodKey(LocalDate date);

  record OneOff() implements Cadence {

    @Override
    public ScheduleType type() {
      return ScheduleType.ONE_OFF;
    }

    @Override
    public boolean occursOn(LocalDate date) {
      return true;
    }

    @Override
    public String periodKey(LocalDate date) {
      return ONE_OFF_PERIOD_KEY;
    }
  }

  record Daily() implements Cadence {

    @Override
    public ScheduleType type() {
      return ScheduleType.DAILY;
    }

    @Override
    public boolean occursOn(LocalDate date) {
      return true;
    }

    @Override
    public String periodKey(LocalDate date) {
      return date.toString();
    }
  }

  /** Fires on each configured ISO day of the week. */
  record Weekly(Set<DayOfWeek> daysOfWeek) implements Cadence {

    public Weekly {
      if (daysOfWeek == null || daysOfWeek.isEmpty()) {
        throw new ScheduleValidationException(
            "daysOfWeek", "Weekly schedules require at least one day of the week");
      }
      daysOfWeek = Collections.unmodifiableSet(EnumSet.copyOf(daysOfWeek));
    }

    @Override
    public ScheduleType type() {
      return ScheduleType.WEEKLY;
    }

    @Override
    public boolean occursOn(LocalDate date) {
      return daysOfWeek.contains(date.getDayOfWeek());
    }

    @Override
    public String periodKey(LocalDate date) {
      var week =
          String.format(
              "%d-W%02d",
              date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
      if (daysOfWeek.size() == 1) {
        return week;
      }
      return week + "-" + date.getDayOfWeek().getValue();
    }
  }

  /** Fires on {@code dayOfMonth}, or on the last day of months that are shorter. */
  record Monthly(int dayOfMonth) implements Cadence {

    public Monthly {
      if (dayOfMonth < 1 || dayOfMonth > 31) {
        throw new ScheduleValidationException(
            "dayOfMonth", "Day of month must be between 1 and 31, got " + dayOfMonth);
      }
    }

    @Override
    public ScheduleType type() {
      return ScheduleType.MONTHLY;
    }

    @Override
    public boolean occursOn(LocalDate date) {
      return date.getDayOfMonth() == Math.min(dayOfMonth, date.lengthOfMonth());
    }

    @Override
    public String periodKey(LocalDate date) {
      return YearMonth.from(date).toString();
    }
  }
}
