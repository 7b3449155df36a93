package io.b2mash.credits.template.dto;

import io.b2mash.credits.schedule.Cadence;
import io.b2mash.credits.schedule.ScheduleType;
import io.b2mash.credits.schedule.Targeting;
import io.b2mash.credits.schedule.TargetingMode;
import io.b2mash.credits.template.SchedulePreset;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

public record TemplateResponse(
    String key,
    String name,
    String description,
    ScheduleType scheduleType,
    List<Integer> daysOfWeek,
    Integer dayOfMonth,
    LocalTime executionTime,
    TargetingMode targetingMode,
    Integer maxDaysSinceRegistration,
    Integer maxDaysSinceLastActivity,
    BigDecimal creditAmount,
    String creditType,
    Integer maxUsersPerExecution) {

  public static TemplateResponse from(SchedulePreset preset) {
    List<Integer> days = null;
    Integer dayOfMonth = null;
    if (preset.cadence() instanceof Cadence.Weekly weekly) {
      days = weekly.daysOfWeek().stream().map(DayOfWeek::getValue).sorted().toList();
    } else if (preset.cadence() instanceof Cadence.Monthly monthly) {
      dayOfMonth = monthly.dayOfMonth();
    }
    Integer maxDaysSinceRegistration = null;
    Integer maxDaysSinceLastActivity = null;
    if (preset.targeting() instanceof Targeting.NewUsers newUsers) {
      maxDaysSinceRegistration = newUsers.maxDaysSinceRegistration();
    } else if (preset.targeting() instanceof Targeting.ActiveUsers activeUsers) {
      maxDaysSinceLastActivity = activeUsers.maxDaysSinceLastActivity();
    }
    return new TemplateResponse(
        preset.key(),
        preset.name(),
        preset.description(),
        preset.cadence().type(),
        days,
        dayOfMonth,
        preset.executionTime(),
        preset.targeting().mode(),
        maxDaysSinceRegistration,
        maxDaysSinceLastActivity,
        preset.creditAmount(),
        preset.creditType(),
        preset.maxUsersPerExecution());
  }
}
