package io.b2mash.credits.schedule;

import io.b2mash.credits.config.CreditSchedulerProperties;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Resolves a schedule's occurrences in the engine zone. Recurring cadences only have an occurrence
 * on their own calendar date: an occurrence that was missed (engine down, schedule inactive) is not
 * caught up later.
 */
@Component
public class FireTimeCalculator {

  // Far enough to cover a monthly cadence plus a leap day
  private static final int MAX_LOOKAHEAD_DAYS = 400;

  private final ZoneId zone;

  public FireTimeCalculator(CreditSchedulerProperties properties) {
    this.zone = properties.zone();
  }

  public record Occurrence(LocalDate date, Instant fireAt, String periodKey) {}

  /**
   * The occurrence that is due at {@code now}: today's occurrence once its execution time has
   * passed, or for a one-off schedule the single occurrence once start date and time have passed.
   */
  public Optional<Occurrence> dueOccurrence(CreditSchedule schedule, Instant now) {
    var cadence = schedule.cadence();
    var today = LocalDate.ofInstant(now, zone);
    if (cadence instanceof Cadence.OneOff) {
      var fireAt = fireAt(schedule, schedule.getStartDate());
      if (now.isBefore(fireAt) || isAfterEnd(schedule, today)) {
        return Optional.empty();
      }
      return Optional.of(
          new Occurrence(schedule.getStartDate(), fireAt, cadence.periodKey(today)));
    }
    if (!withinBounds(schedule, today) || !cadence.occursOn(today)) {
      return Optional.empty();
    }
    var fireAt = fireAt(schedule, today);
    if (now.isBefore(fireAt)) {
      return Optional.empty();
    }
    return Optional.of(new Occurrence(today, fireAt, cadence.periodKey(today)));
  }

  /** The first fire time strictly after {@code now}, if the schedule has one. */
  public Optional<Occurrence> nextOccurrenceAfter(CreditSchedule schedule, Instant now) {
    var cadence = schedule.cadence();
    var today = LocalDate.ofInstant(now, zone);
    if (cadence instanceof Cadence.OneOff) {
      var fireAt = fireAt(schedule, schedule.getStartDate());
      if (!fireAt.isAfter(now)) {
        return Optional.empty();
      }
      return Optional.of(
          new Occurrence(schedule.getStartDate(), fireAt, cadence.periodKey(today)));
    }
    var date = today.isBefore(schedule.getStartDate()) ? schedule.getStartDate() : today;
    for (int i = 0; i < MAX_LOOKAHEAD_DAYS; i++, date = date.plusDays(1)) {
      if (isAfterEnd(schedule, date)) {
        return Optional.empty();
      }
      if (!cadence.occursOn(date)) {
        continue;
      }
      var fireAt = fireAt(schedule, date);
      if (fireAt.isAfter(now)) {
        return Optional.of(new Occurrence(date, fireAt, cadence.periodKey(date)));
      }
    }
    return Optional.empty();
  }

  public ZoneId zone() {
    return zone;
  }

  private Instant fireAt(CreditSchedule schedule, LocalDate date) {
    return date.atTime(schedule.getExecutionTime()).atZone(zone).toInstant();
  }

  private static boolean withinBounds(CreditSchedule schedule, LocalDate date) {
    return !date.isBefore(schedule.getStartDate()) && !isAfterEnd(schedule, date);
  }

  private static boolean isAfterEnd(CreditSchedule schedule, LocalDate date) {
    return schedule.getEndDate() != null && date.isAfter(schedule.getEndDate());
  }
}
