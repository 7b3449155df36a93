package io.b2mash.credits.schedule;

import io.b2mash.credits.exception.ScheduleValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A complete, validated credit schedule policy. Everything that creates or changes a schedule goes
 * through this record, so fire-time code never sees an inconsistent definition.
 */
public record ScheduleDefinition(
    String name,
    String description,
    Cadence cadence,
    LocalDate startDate,
    LocalDate endDate,
    LocalTime executionTime,
    Targeting targeting,
    BigDecimal creditAmount,
    String creditType,
    int maxUsersPerExecution,
    BigDecimal maxTotalCredits,
    BigDecimal maxCreditsPerUser,
    boolean active) {

  // Matches the NUMERIC(19, 4) credit columns
  static final int CREDIT_SCALE = 4;
  static final int CREDIT_INTEGER_DIGITS = 15;

  public ScheduleDefinition {
    if (name == null || name.isBlank()) {
      throw new ScheduleValidationException("name", "Schedule name is required");
    }
    if (name.length() > 200) {
      throw new ScheduleValidationException("name", "Schedule name must be at most 200 characters");
    }
    if (cadence == null) {
      throw new ScheduleValidationException("scheduleType", "Schedule type is required");
    }
    if (startDate == null) {
      throw new ScheduleValidationException("startDate", "Start date is required");
    }
    if (endDate != null && endDate.isBefore(startDate)) {
      throw new ScheduleValidationException("endDate", "End date must not be before start date");
    }
    if (executionTime == null) {
      throw new ScheduleValidationException("executionTime", "Execution time is required");
    }
    if (targeting == null) {
      throw new ScheduleValidationException("targetingMode", "Targeting mode is required");
    }
    if (creditAmount == null || creditAmount.signum() <= 0) {
      throw new ScheduleValidationException("creditAmount", "Credit amount must be positive");
    }
    requireCreditPrecision("creditAmount", creditAmount);
    if (creditType == null || creditType.isBlank()) {
      throw new ScheduleValidationException("creditType", "Credit type is required");
    }
    if (maxUsersPerExecution <= 0) {
      throw new ScheduleValidationException(
          "maxUsersPerExecution", "Max users per execution must be greater than 0");
    }
    if (maxTotalCredits != null && maxTotalCredits.signum() <= 0) {
      throw new ScheduleValidationException(
          "maxTotalCredits", "Max total credits must be positive when set");
    }
    requireCreditPrecision("maxTotalCredits", maxTotalCredits);
    if (maxCreditsPerUser != null && maxCreditsPerUser.signum() <= 0) {
      throw new ScheduleValidationException(
          "maxCreditsPerUser", "Max credits per user must be positive when set");
    }
    requireCreditPrecision("maxCreditsPerUser", maxCreditsPerUser);
    name = name.trim();
    creditType = creditType.trim();
  }

  public ScheduleDefinition withName(String newName) {
    return new ScheduleDefinition(
        newName,
        description,
        cadence,
        startDate,
        endDate,
        executionTime,
        targeting,
        creditAmount,
        creditType,
        maxUsersPerExecution,
        maxTotalCredits,
        maxCreditsPerUser,
        active);
  }

  private static void requireCreditPrecision(String field, BigDecimal value) {
    if (value == null) {
      return;
    }
    var normalized = value.stripTrailingZeros();
    if (normalized.scale() > CREDIT_SCALE) {
      throw new ScheduleValidationException(
          field, field + " must have at most " + CREDIT_SCALE + " decimal places");
    }
    if (normalized.precision() - normalized.scale() > CREDIT_INTEGER_DIGITS) {
      throw new ScheduleValidationException(
          field, field + " must have at most " + CREDIT_INTEGER_DIGITS + " integer digits");
    }
  }
}
