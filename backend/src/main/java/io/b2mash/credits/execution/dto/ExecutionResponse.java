package io.b2mash.credits.execution.dto;

import io.b2mash.credits.execution.CreditScheduleExecution;
import io.b2mash.credits.execution.ExecutionStatus;
import io.b2mash.credits.execution.TriggerSource;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record ExecutionResponse(
    UUID id,
    UUID scheduleId,
    String periodKey,
    Instant executionTime,
    TriggerSource triggeredBy,
    ExecutionStatus status,
    int cohortSize,
    int usersCredited,
    int usersFailed,
    BigDecimal totalAmountGranted,
    String errorMessage,
    Instant finishedAt) {

  public static ExecutionResponse from(CreditScheduleExecution execution) {
    return new ExecutionResponse(
        execution.getId(),
        execution.getScheduleId(),
        execution.getPeriodKey(),
        execution.getExecutionTime(),
        execution.getTriggeredBy(),
        execution.getStatus(),
        execution.getCohortSize(),
        execution.getUsersCredited(),
        execution.getUsersFailed(),
        execution.getTotalAmountGranted(),
        execution.getErrorMessage(),
        execution.getFinishedAt());
  }
}
