package io.b2mash.credits.schedule.dto;

import io.b2mash.credits.schedule.ScheduleType;
import io.b2mash.credits.schedule.TargetingMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;

/**
 * Full credit schedule definition. {@code daysOfWeek} holds ISO day numbers (1 = Monday, 7 =
 * Sunday). Omitted execution time, credit type and cap fall back to the configured defaults.
 */
public record CreateScheduleRequest(
    @NotBlank @Size(max = 200) String name,
    @Size(max = 1000) String description,
    @NotNull ScheduleType scheduleType,
    @NotNull LocalDate startDate,
    LocalDate endDate,
    LocalTime executionTime,
    Set<Integer> daysOfWeek,
    Integer dayOfMonth,
    @NotNull TargetingMode targetingMode,
    Integer maxDaysSinceRegistration,
    Integer minDaysSinceRegistration,
    Integer maxDaysSinceLastActivity,
    String customCriteria,
    @NotNull BigDecimal creditAmount,
    @Size(max = 50) String creditType,
    Integer maxUsersPerExecution,
    BigDecimal maxTotalCredits,
    BigDecimal maxCreditsPerUser,
    Boolean active) {}
