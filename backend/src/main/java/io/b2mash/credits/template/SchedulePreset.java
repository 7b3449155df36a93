package io.b2mash.credits.template;

import io.b2mash.credits.schedule.Cadence;
import io.b2mash.credits.schedule.ScheduleDefinition;
import io.b2mash.credits.schedule.ScheduleDefinitionMapper;
import io.b2mash.credits.schedule.Targeting;
import io.b2mash.credits.template.dto.TemplateOverrides;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A named schedule blueprint.
 *
 * @param maxUsersPerExecution per-run cap, or null for the configured default
 */
public record SchedulePreset(
    String key,
    String name,
    String description,
    Cadence cadence,
    LocalTime executionTime,
    Targeting targeting,
    BigDecimal creditAmount,
    String creditType,
    Integer maxUsersPerExecution) {

  /**
   * Builds a definition from this preset. Day-of-week and day-of-month overrides are only accepted
   * for presets of the matching schedule type.
   */
  public ScheduleDefinition toDefinition(
      TemplateOverrides overrides, LocalDate today, int defaultMaxUsersPerExecution) {
    var o = overrides != null ? overrides : TemplateOverrides.NONE;
    var cadenceOverride =
        o.daysOfWeek() != null || o.dayOfMonth() != null
            ? ScheduleDefinitionMapper.cadence(
                cadence.type(), ScheduleDefinitionMapper.toDays(o.daysOfWeek()), o.dayOfMonth())
            : cadence;
    int cap =
        o.maxUsersPerExecution() != null
            ? o.maxUsersPerExecution()
            : maxUsersPerExecution != null ? maxUsersPerExecution : defaultMaxUsersPerExecution;
    return new ScheduleDefinition(
        o.name() != null ? o.name() : name,
        description,
        cadenceOverride,
        o.startDate() != null ? o.startDate() : today,
        null,
        o.executionTime() != null ? o.executionTime() : executionTime,
        targeting,
        o.creditAmount() != null ? o.creditAmount() : creditAmount,
        creditType,
        cap,
        null,
        null,
        true);
  }
}
