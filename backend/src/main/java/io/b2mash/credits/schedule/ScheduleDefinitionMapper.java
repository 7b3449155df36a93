package io.b2mash.credits.schedule;

import io.b2mash.credits.config.CreditScheduleProperties;
import io.b2mash.credits.exception.ScheduleValidationException;
import io.b2mash.credits.schedule.dto.CreateScheduleRequest;
import io.b2mash.credits.schedule.dto.UpdateScheduleRequest;
import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns request payloads into {@link ScheduleDefinition}s. Parameters that belong to a different
 * schedule type or targeting mode than the one requested are rejected rather than ignored.
 */
@Component
public class ScheduleDefinitionMapper {

  private final CreditScheduleProperties defaults;

  public ScheduleDefinitionMapper(CreditScheduleProperties defaults) {
    this.defaults = defaults;
  }

  public ScheduleDefinition toDefinition(CreateScheduleRequest request) {
    return new ScheduleDefinition(
        request.name(),
        request.description(),
        cadence(request.scheduleType(), toDays(request.daysOfWeek()), request.dayOfMonth()),
        request.startDate(),
        request.endDate(),
        coalesce(request.executionTime(), defaults.defaultExecutionTime()),
        targeting(
            request.targetingMode(),
            request.maxDaysSinceRegistration(),
            request.minDaysSinceRegistration(),
            request.maxDaysSinceLastActivity(),
            request.customCriteria()),
        request.creditAmount(),
        coalesce(request.creditType(), defaults.defaultCreditType()),
        coalesce(request.maxUsersPerExecution(), defaults.defaultMaxUsersPerExecution()),
        request.maxTotalCredits(),
        request.maxCreditsPerUser(),
        coalesce(request.active(), Boolean.TRUE));
  }

  /**
   * Overlays a partial update on the current definition. When the schedule type (or targeting
   * mode) changes, the old variant's parameters are dropped and the patch must supply the new
   * variant's.
   */
  public ScheduleDefinition merge(CreditSchedule current, UpdateScheduleRequest patch) {
    var type = coalesce(patch.scheduleType(), current.getScheduleType());
    boolean sameType = type == current.getScheduleType();
    var days =
        patch.daysOfWeek() != null
            ? toDays(patch.daysOfWeek())
            : sameType ? current.getDaysOfWeek() : null;
    var dayOfMonth =
        patch.dayOfMonth() != null
            ? patch.dayOfMonth()
            : sameType ? current.getDayOfMonth() : null;

    var mode = coalesce(patch.targetingMode(), current.getTargetingMode());
    boolean sameMode = mode == current.getTargetingMode();
    var maxRegistration =
        overlay(patch.maxDaysSinceRegistration(), current.getMaxDaysSinceRegistration(), sameMode);
    var minRegistration =
        overlay(patch.minDaysSinceRegistration(), current.getMinDaysSinceRegistration(), sameMode);
    var maxActivity =
        overlay(patch.maxDaysSinceLastActivity(), current.getMaxDaysSinceLastActivity(), sameMode);
    var criteria = overlay(patch.customCriteria(), current.getCustomCriteria(), sameMode);

    return new ScheduleDefinition(
        coalesce(patch.name(), current.getName()),
        coalesce(patch.description(), current.getDescription()),
        cadence(type, days, dayOfMonth),
        coalesce(patch.startDate(), current.getStartDate()),
        coalesce(patch.endDate(), current.getEndDate()),
        coalesce(patch.executionTime(), current.getExecutionTime()),
        targeting(mode, maxRegistration, minRegistration, maxActivity, criteria),
        coalesce(patch.creditAmount(), current.getCreditAmount()),
        coalesce(patch.creditType(), current.getCreditType()),
        coalesce(patch.maxUsersPerExecution(), current.getMaxUsersPerExecution()),
        coalesce(patch.maxTotalCredits(), current.getMaxTotalCredits()),
        coalesce(patch.maxCreditsPerUser(), current.getMaxCreditsPerUser()),
        coalesce(patch.active(), current.isActive()));
  }

  public static Cadence cadence(ScheduleType type, Set<DayOfWeek> daysOfWeek, Integer dayOfMonth) {
    if (type == null) {
      throw new ScheduleValidationException("scheduleType", "Schedule type is required");
    }
    boolean hasDays = daysOfWeek != null && !daysOfWeek.isEmpty();
    if (type != ScheduleType.WEEKLY && hasDays) {
      throw new ScheduleValidationException(
          "daysOfWeek", "daysOfWeek is only allowed for WEEKLY schedules");
    }
    if (type != ScheduleType.MONTHLY && dayOfMonth != null) {
      throw new ScheduleValidationException(
          "dayOfMonth", "dayOfMonth is only allowed for MONTHLY schedules");
    }
    return switch (type) {
      case ONE_OFF -> new Cadence.OneOff();
      case DAILY -> new Cadence.Daily();
      case WEEKLY -> new Cadence.Weekly(daysOfWeek);
      case MONTHLY -> {
        if (dayOfMonth == null) {
          throw new ScheduleValidationException(
              "dayOfMonth", "MONTHLY schedules require dayOfMonth");
        }
        yield new Cadence.Monthly(dayOfMonth);
      }
    };
  }

  public static Targeting targeting(
      TargetingMode mode,
      Integer maxDaysSinceRegistration,
      Integer minDaysSinceRegistration,
      Integer maxDaysSinceLastActivity,
      String customCriteria) {
    if (mode == null) {
      throw new ScheduleValidationException("targetingMode", "Targeting mode is required");
    }
    boolean registration = maxDaysSinceRegistration != null || minDaysSinceRegistration != null;
    boolean activity = maxDaysSinceLastActivity != null;
    boolean custom = customCriteria != null && !customCriteria.isBlank();
    if (mode != TargetingMode.NEW_USERS && registration) {
      throw new ScheduleValidationException(
          "maxDaysSinceRegistration",
          "Registration windows are only allowed for NEW_USERS targeting");
    }
    if (mode != TargetingMode.ACTIVE_USERS && activity) {
      throw new ScheduleValidationException(
          "maxDaysSinceLastActivity",
          "maxDaysSinceLastActivity is only allowed for ACTIVE_USERS targeting");
    }
    if (mode != TargetingMode.CUSTOM && custom) {
      throw new ScheduleValidationException(
          "customCriteria", "customCriteria is only allowed for CUSTOM targeting");
    }
    return switch (mode) {
      case NEW_USERS -> {
        if (maxDaysSinceRegistration == null) {
          throw new ScheduleValidationException(
              "maxDaysSinceRegistration", "NEW_USERS targeting requires maxDaysSinceRegistration");
        }
        yield new Targeting.NewUsers(maxDaysSinceRegistration, minDaysSinceRegistration);
      }
      case ACTIVE_USERS -> {
        if (maxDaysSinceLastActivity == null) {
          throw new ScheduleValidationException(
              "maxDaysSinceLastActivity",
              "ACTIVE_USERS targeting requires maxDaysSinceLastActivity");
        }
        yield new Targeting.ActiveUsers(maxDaysSinceLastActivity);
      }
      case ALL_USERS -> new Targeting.AllUsers();
      case CUSTOM -> new Targeting.Custom(customCriteria);
    };
  }

  /** Converts ISO day numbers (1 = Monday .. 7 = Sunday). */
  public static Set<DayOfWeek> toDays(Set<Integer> isoDays) {
    if (isoDays == null) {
      return null;
    }
    var days = EnumSet.noneOf(DayOfWeek.class);
    for (Integer isoDay : isoDays) {
      if (isoDay == null || isoDay < 1 || isoDay > 7) {
        throw new ScheduleValidationException(
            "daysOfWeek", "Days of week must be ISO day numbers 1-7, got " + isoDay);
      }
      days.add(DayOfWeek.of(isoDay));
    }
    return days;
  }

  private static <T> T overlay(T patched, T current, boolean keepCurrent) {
    if (patched != null) {
      return patched;
    }
    return keepCurrent ? current : null;
  }

  private static <T> T coalesce(T value, T fallback) {
    return value != null ? value : fallback;
  }
}
