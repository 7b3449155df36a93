package io.b2mash.credits.schedule.dto;

import io.b2mash.credits.schedule.ScheduleType;
import io.b2mash.credits.schedule.TargetingMode;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;

/** Partial update: only non-null fields change. */
public record UpdateScheduleRequest(
    @Size(max = 200) String name,
    @Size(max = 1000) String description,
    ScheduleType scheduleType,
    LocalDate startDate,
    LocalDate endDate,
    LocalTime executionTime,
    Set<Integer> daysOfWeek,
    Integer dayOfMonth,
    TargetingMode targetingMode,
    Integer maxDaysSinceRegistration,
    Integer minDaysSinceRegistration,
    Integer maxDaysSinceLastActivity,
    String customCriteria,
    BigDecimal creditAmount,
    @Size(max = 50) String creditType,
    Integer maxUsersPerExecution,
    BigDecimal maxTotalCredits,
    BigDecimal maxCreditsPerUser,
    Boolean active) {}
