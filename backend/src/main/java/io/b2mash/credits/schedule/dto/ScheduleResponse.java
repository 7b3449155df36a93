package io.b2mash.credits.schedule.dto;

import io.b2mash.credits.schedule.CreditSchedule;
import io.b2mash.credits.schedule.ScheduleType;
import io.b2mash.credits.schedule.TargetingMode;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

public record ScheduleResponse(
    UUID id,
    String name,
    String description,
    boolean active,
    ScheduleType scheduleType,
    LocalDate startDate,
    LocalDate endDate,
    LocalTime executionTime,
    List<Integer> daysOfWeek,
    Integer dayOfMonth,
    TargetingMode targetingMode,
    Integer maxDaysSinceRegistration,
    Integer minDaysSinceRegistration,
    Integer maxDaysSinceLastActivity,
    String customCriteria,
    BigDecimal creditAmount,
    String creditType,
    int maxUsersPerExecution,
    BigDecimal maxTotalCredits,
    BigDecimal maxCreditsPerUser,
    BigDecimal totalCreditsDistributed,
    long totalUsersCredited,
    long totalExecutions,
    Instant lastFiredAt,
    Instant nextFireAt,
    Instant createdAt,
    Instant updatedAt) {

  public static ScheduleResponse from(CreditSchedule schedule, Instant nextFireAt) {
    var days =
        schedule.getDaysOfWeek() == null
            ? null
            : schedule.getDaysOfWeek().stream().map(DayOfWeek::getValue).sorted().toList();
    return new ScheduleResponse(
        schedule.getId(),
        schedule.getName(),
        schedule.getDescription(),
        schedule.isActive(),
        schedule.getScheduleType(),
        schedule.getStartDate(),
        schedule.getEndDate(),
        schedule.getExecutionTime(),
        days,
        schedule.getDayOfMonth(),
        schedule.getTargetingMode(),
        schedule.getMaxDaysSinceRegistration(),
        schedule.getMinDaysSinceRegistration(),
        schedule.getMaxDaysSinceLastActivity(),
        schedule.getCustomCriteria(),
        schedule.getCreditAmount(),
        schedule.getCreditType(),
        schedule.getMaxUsersPerExecution(),
        schedule.getMaxTotalCredits(),
        schedule.getMaxCreditsPerUser(),
        schedule.getTotalCreditsDistributed(),
        schedule.getTotalUsersCredited(),
        schedule.getTotalExecutions(),
        schedule.getLastFiredAt(),
        nextFireAt,
        schedule.getCreatedAt(),
        schedule.getUpdatedAt());
  }
}
